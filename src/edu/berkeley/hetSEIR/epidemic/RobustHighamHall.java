 /*
    This file is part of hetSEIR.

    hetSEIR is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    hetSEIR is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with hetSEIR.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.berkeley.hetSEIR.epidemic;

import org.apache.commons.math3.ode.nonstiff.HighamHall54Integrator;

/// Higham-Hall 5(4) configured from the settings, with a fallback for a broken initial step guess
class RobustHighamHall extends HighamHall54Integrator {

	RobustHighamHall (IntegratorSettings settings) {
		super (settings.minStep, settings.maxStep, settings.absTolerance, settings.relTolerance);
		setMaxEvaluations (settings.maxEvaluations);
	}

	@Override
	public double initializeStep (boolean forward, int order, double[] scale,
			double t0, double[] y0, double[] yDot0, double[] y1, double[] yDot1) {
		double guess = super.initializeStep (forward, order, scale, t0, y0, yDot0, y1, yDot1);
		// degenerate derivatives give NaN, start with the largest step and let the error control shrink it
		if (Double.isNaN (guess) || Double.isInfinite (guess)) {
			return forward ? getMaxStep() : -getMaxStep();
		}
		return guess;
	}
}
