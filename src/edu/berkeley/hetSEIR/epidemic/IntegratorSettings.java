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

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

/// numerical knobs for the {@link CompartmentalIntegrator}; passed explicitly, never global
public class IntegratorSettings {
	
	public static final double MIN_STEP = 1.0e-8;
	public static final double MAX_STEP = 1.0d;
	public static final double ABS_TOLERANCE = 1.0e-6;
	public static final double REL_TOLERANCE = 1.0e-9;
	public static final int MAX_EVALUATIONS = 200000;
	public static final double NEGATIVITY_TOLERANCE = 1.0e-8;
	public static final double EQUILIBRIUM_EPSILON = 1.0e-9;

	public static final IntegratorSettings DEFAULT = new IntegratorSettings (MIN_STEP, MAX_STEP, ABS_TOLERANCE, REL_TOLERANCE, MAX_EVALUATIONS, NEGATIVITY_TOLERANCE, EQUILIBRIUM_EPSILON);

	/// smallest step the solver may take before giving up
	public final double minStep;
	/// largest step, in time units of the rates
	public final double maxStep;
	public final double absTolerance;
	public final double relTolerance;
	/// cap on derivative evaluations between two grid points
	public final int maxEvaluations;
	/// negative values down to -negativityTolerance * N_i are clamped, below that we fail
	public final double negativityTolerance;
	/// E+I below this fraction of N counts as burnt out
	public final double equilibriumEpsilon;
	
	public IntegratorSettings (double minStep, double maxStep, double absTolerance, double relTolerance, int maxEvaluations, double negativityTolerance, double equilibriumEpsilon) {
		InvalidParameterException.checkPositive ("minStep", minStep);
		InvalidParameterException.checkPositive ("maxStep", maxStep);
		if (minStep > maxStep) throw new InvalidParameterException ("minStep bigger than maxStep.");
		InvalidParameterException.checkPositive ("absTolerance", absTolerance);
		InvalidParameterException.checkPositive ("relTolerance", relTolerance);
		if (maxEvaluations <= 0) throw new InvalidParameterException ("maxEvaluations has to be positive.");
		InvalidParameterException.checkPositive ("negativityTolerance", negativityTolerance);
		InvalidParameterException.checkPositive ("equilibriumEpsilon", equilibriumEpsilon);
		this.minStep = minStep;
		this.maxStep = maxStep;
		this.absTolerance = absTolerance;
		this.relTolerance = relTolerance;
		this.maxEvaluations = maxEvaluations;
		this.negativityTolerance = negativityTolerance;
		this.equilibriumEpsilon = equilibriumEpsilon;
	}
	
	public IntegratorSettings withTolerances (double newAbsTolerance, double newRelTolerance) {
		return new IntegratorSettings (this.minStep, this.maxStep, newAbsTolerance, newRelTolerance, this.maxEvaluations, this.negativityTolerance, this.equilibriumEpsilon);
	}

	public IntegratorSettings withMaxEvaluations (int newMaxEvaluations) {
		return new IntegratorSettings (this.minStep, this.maxStep, this.absTolerance, this.relTolerance, newMaxEvaluations, this.negativityTolerance, this.equilibriumEpsilon);
	}

	@Override
	public String toString() {
		return "minStep=" + this.minStep + ", maxStep=" + this.maxStep + ", absTol=" + this.absTolerance + ", relTol=" + this.relTolerance + ", maxEval=" + this.maxEvaluations;
	}
}
