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

package edu.berkeley.hetSEIR.maximum_likelihood;

import java.util.Arrays;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

/**
 * Outcome of one calibration run.
 * <p>
 * The normalized parameters are divided by the value of the reference group (index 0), so that
 * entry is exactly one. This is only a reporting convention; it does not make the absolute scale
 * identifiable (the raw vector carries the scale the fit actually used).
 */
public class CalibrationResult {

	private final double[] parameters;
	private final double[] rawParameters;
	public final double negLogLikelihood;
	public final int evaluations;
	public final int iterations;
	/// false if a cap was hit before the stopping rule was met; the parameters are the best found anyway
	public final boolean converged;
	public final ParameterizationMode mode;
	
	public CalibrationResult (double[] rawParameters, double negLogLikelihood, int evaluations, int iterations, boolean converged, ParameterizationMode mode) {
		if (rawParameters == null || rawParameters.length == 0) {
			throw new InvalidParameterException ("No parameters to report.");
		}
		InvalidParameterException.checkPositive ("Parameter of the reference group", rawParameters[0]);
		this.rawParameters = rawParameters.clone();
		this.parameters = new double[rawParameters.length];
		for (int i=0; i<rawParameters.length; i++) {
			this.parameters[i] = rawParameters[i] / rawParameters[0];
		}
		this.negLogLikelihood = negLogLikelihood;
		this.evaluations = evaluations;
		this.iterations = iterations;
		this.converged = converged;
		this.mode = mode;
	}
	
	/// normalized to the reference group
	public double[] getParameters () {
		return this.parameters.clone();
	}
	
	public double[] getRawParameters () {
		return this.rawParameters.clone();
	}

	@Override
	public String toString() {
		return "[" + this.mode.label + "] " + Arrays.toString (this.parameters) + " -logL=" + this.negLogLikelihood + " converged=" + this.converged + " (" + this.iterations + " iterations, " + this.evaluations + " evaluations)";
	}
}
