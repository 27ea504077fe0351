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

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

/// stopping rules and step sizes for the Nelder-Mead search; all caps are hard
public class OptimizerSettings {

	public static final double INITIAL_STEP = 0.5d;
	public static final double RESTART_STEP = 0.2d;
	public static final double RELATIVE_ERROR = 1e-10;
	public static final double COORDINATE_ERROR = 1e-7;
	public static final int MAX_ITERATIONS = 5000;
	public static final int MAX_EVALUATIONS = 20000;
	public static final int MAX_RESTARTS = 5;
	public static final double RESTART_IMPROVEMENT = 1e-6;
	
	public static final OptimizerSettings DEFAULT = new OptimizerSettings (INITIAL_STEP, RESTART_STEP, RELATIVE_ERROR, COORDINATE_ERROR, MAX_ITERATIONS, MAX_EVALUATIONS, MAX_RESTARTS, RESTART_IMPROVEMENT, false);
	
	/// initial simplex edge, in log-parameter space
	public final double initialStep;
	/// simplex edge when restarting at the best point
	public final double restartStep;
	/// stop when best and worst value on the simplex are this close (relative)
	public final double relativeError;
	/// or when the simplex has shrunk to this size in every log-coordinate
	public final double coordinateError;
	/// over all restarts
	public final int maxIterations;
	/// over all restarts
	public final int maxEvaluations;
	public final int maxRestarts;
	/// a restart that improves the value by less than this (relative) ends the search
	public final double restartImprovement;
	public final boolean verbose;
	
	public OptimizerSettings (double initialStep, double restartStep, double relativeError, double coordinateError, int maxIterations, int maxEvaluations, int maxRestarts, double restartImprovement, boolean verbose) {
		InvalidParameterException.checkPositive ("initialStep", initialStep);
		InvalidParameterException.checkPositive ("restartStep", restartStep);
		InvalidParameterException.checkPositive ("relativeError", relativeError);
		InvalidParameterException.checkPositive ("coordinateError", coordinateError);
		if (maxIterations <= 0) throw new InvalidParameterException ("maxIterations has to be positive.");
		if (maxEvaluations <= 0) throw new InvalidParameterException ("maxEvaluations has to be positive.");
		if (maxRestarts < 0) throw new InvalidParameterException ("maxRestarts can't be negative.");
		InvalidParameterException.checkPositive ("restartImprovement", restartImprovement);
		this.initialStep = initialStep;
		this.restartStep = restartStep;
		this.relativeError = relativeError;
		this.coordinateError = coordinateError;
		this.maxIterations = maxIterations;
		this.maxEvaluations = maxEvaluations;
		this.maxRestarts = maxRestarts;
		this.restartImprovement = restartImprovement;
		this.verbose = verbose;
	}
	
	public OptimizerSettings withLimits (int newMaxIterations, int newMaxEvaluations) {
		return new OptimizerSettings (this.initialStep, this.restartStep, this.relativeError, this.coordinateError, newMaxIterations, newMaxEvaluations, this.maxRestarts, this.restartImprovement, this.verbose);
	}

	public OptimizerSettings withVerbose (boolean newVerbose) {
		return new OptimizerSettings (this.initialStep, this.restartStep, this.relativeError, this.coordinateError, this.maxIterations, this.maxEvaluations, this.maxRestarts, this.restartImprovement, newVerbose);
	}
}
