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
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.optimization.PointValuePair;
import org.apache.commons.math3.optimization.direct.NelderMeadSimplex;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.demography.SeroObservation;
import edu.berkeley.hetSEIR.epidemic.CompartmentalIntegrator;
import edu.berkeley.hetSEIR.epidemic.IntegratorSettings;
import edu.berkeley.hetSEIR.utility.ConsoleOutput;

/**
 * Maximum likelihood fit of the per-group parameters (activities) against serosurvey counts.
 * <p>
 * Nelder-Mead on the log-parameters, with the box constraint enforced through the penalty of the
 * {@link SeroObjectiveFunction}. After the simplex collapses we restart at the best point with a
 * fresh simplex, until a restart doesn't improve anymore. Running into the iteration or evaluation
 * cap is not an error: the best point so far is returned with converged = false.
 */
public class SeroCalibrationEngine {
	
	public static final double LOWER_BOUND = 1e-4;
	public static final double UPPER_BOUND = 20d;

	private final OptimizerSettings optimizerSettings;
	private final IntegratorSettings integratorSettings;
	private final Map<ParameterizationMode, TransmissionModel> models;
	
	public SeroCalibrationEngine () {
		this (OptimizerSettings.DEFAULT, IntegratorSettings.DEFAULT);
	}
	
	/// only the activity model is known from the start
	public SeroCalibrationEngine (OptimizerSettings optimizerSettings, IntegratorSettings integratorSettings) {
		this (optimizerSettings, integratorSettings, defaultModels());
	}

	private SeroCalibrationEngine (OptimizerSettings optimizerSettings, IntegratorSettings integratorSettings, Map<ParameterizationMode, TransmissionModel> models) {
		this.optimizerSettings = optimizerSettings;
		this.integratorSettings = integratorSettings;
		this.models = models;
	}
	
	private static Map<ParameterizationMode, TransmissionModel> defaultModels () {
		Map<ParameterizationMode, TransmissionModel> models = new EnumMap<ParameterizationMode, TransmissionModel> (ParameterizationMode.class);
		models.put (ParameterizationMode.ACTIVITY, new TransmissionModel.ActivityModel());
		return models;
	}
	
	/// a copy of this engine that uses the given transmission model for the given mode
	public SeroCalibrationEngine withModel (ParameterizationMode mode, TransmissionModel model) {
		Map<ParameterizationMode, TransmissionModel> newModels = new EnumMap<ParameterizationMode, TransmissionModel> (this.models);
		newModels.put (mode, model);
		return new SeroCalibrationEngine (this.optimizerSettings, this.integratorSettings, newModels);
	}
	
	public static double[][] uniformBounds (int numGroups, double lower, double upper) {
		double[][] bounds = new double[numGroups][];
		for (int i=0; i<numGroups; i++) bounds[i] = new double[] {lower, upper};
		return bounds;
	}
	
	public CalibrationResult fitParameters (PopulationContext context, SeroObservation observation, double latentRate, double recoveryRate, double epsilon, double surveyTime, String mode, double[] initialGuess, double[][] bounds) {
		return fitParameters (context, observation, latentRate, recoveryRate, epsilon, surveyTime, ParameterizationMode.fromString (mode), initialGuess, bounds);
	}
	
	/// initialGuess and bounds may be null (all ones, and [1e-4, 20] for everybody)
	public CalibrationResult fitParameters (PopulationContext context, SeroObservation observation, double latentRate, double recoveryRate, double epsilon, double surveyTime, ParameterizationMode mode, double[] initialGuess, double[][] bounds) {
		
		if (mode == null) throw new ModelNotRecognizedException ("No parameterization mode given.");
		TransmissionModel model = this.models.get (mode);
		if (model == null) {
			// the matrix for this one has to come from whoever knows its form
			throw new UnsupportedOperationException ("No transmission matrix known for mode " + mode.label + "; register one with withModel().");
		}
		
		// check the input
		int numGroups = context.getNumGroups();
		if (observation.getNumGroups() != numGroups) {
			throw new InvalidParameterException ("Observation has " + observation.getNumGroups() + " groups, population has " + numGroups + ".");
		}
		InvalidParameterException.checkPositive ("Latent rate r", latentRate);
		InvalidParameterException.checkPositive ("Recovery rate gamma", recoveryRate);
		InvalidParameterException.checkPositive ("Survey time", surveyTime);
		if (!(0d <= epsilon) || !(epsilon <= 1d)) {
			throw new InvalidParameterException ("Assortativity has to be in [0,1] (not " + epsilon + ").");
		}
		double[][] themBounds = (bounds == null) ? uniformBounds (numGroups, LOWER_BOUND, UPPER_BOUND) : bounds;
		if (themBounds.length != numGroups) throw new InvalidParameterException ("Need bounds for each of the " + numGroups + " groups.");
		for (int i=0; i<numGroups; i++) {
			if (themBounds[i] == null || themBounds[i].length != 2 || !(0d < themBounds[i][0]) || !(themBounds[i][0] < themBounds[i][1]) || Double.isInfinite (themBounds[i][1])) {
				throw new InvalidParameterException ("Bounds of group " + i + " have to be a finite pair 0 < lower < upper.");
			}
		}
		if (initialGuess != null && initialGuess.length != numGroups) {
			throw new InvalidParameterException ("Initial guess has length " + initialGuess.length + ", expected " + numGroups + ".");
		}
		double[] startPoint = new double[numGroups];
		for (int i=0; i<numGroups; i++) {
			double guess = (initialGuess == null) ? 1d : initialGuess[i];
			if (initialGuess == null) {
				// ones, pushed into the box
				guess = Math.min (Math.max (guess, themBounds[i][0]), themBounds[i][1]);
			}
			if (!(themBounds[i][0] <= guess) || !(guess <= themBounds[i][1])) {
				throw new InvalidParameterException ("Initial guess " + guess + " for group " + i + " is outside of its bounds.");
			}
			startPoint[i] = Math.log (guess);
		}
		
		SeroObjectiveFunction objective = new SeroObjectiveFunction (context, observation, model, new CompartmentalIntegrator (this.integratorSettings, false), latentRate, recoveryRate, epsilon, surveyTime, themBounds);
		
		return minimize (objective, startPoint, mode);
	}
	
	private CalibrationResult minimize (SeroObjectiveFunction objective, double[] startPoint, ParameterizationMode mode) {
		
		OptimizerSettings settings = this.optimizerSettings;
		int totalIterations = 0;
		
		// first round
		SimplexRun run = runSimplex (objective, startPoint, settings.initialStep, totalIterations);
		totalIterations += run.iterations;
		PointValuePair best = run.best;
		boolean converged = run.converged;
		
		// restart at the best point, as long as that helps
		int restarts = 0;
		while (converged) {
			if (restarts >= settings.maxRestarts) {
				// still improving when we ran out of restarts
				converged = false;
				break;
			}
			SimplexRun restart = runSimplex (objective, best.getPoint(), settings.restartStep, totalIterations);
			totalIterations += restart.iterations;
			restarts++;
			
			double improvement = best.getValue() - restart.best.getValue();
			if (restart.best.getValue() < best.getValue()) {
				best = restart.best;
			}
			if (settings.verbose) {
				ConsoleOutput.synchronizedPrintln ("# [RESTART_" + restarts + "] improvement: " + improvement + "\tbest: " + Arrays.toString (exp (best.getPoint())));
			}
			converged = restart.converged;
			if (improvement <= settings.restartImprovement * Math.max (1d, Math.abs (best.getValue()))) {
				// nothing to gain anymore
				break;
			}
		}
		
		if (objective.getNumClamped() > 0) {
			ConsoleOutput.warning ("Clamped " + objective.getNumClamped() + " slightly negative compartment values to zero during the fit.");
		}
		if (best.getValue() >= SeroObjectiveFunction.PENALTY) {
			ConsoleOutput.warning ("No admissible parameter vector found.");
			converged = false;
		}
		if (!converged) {
			ConsoleOutput.warning ("Calibration did not converge within " + settings.maxIterations + " iterations and " + settings.maxEvaluations + " evaluations; reporting best point found.");
		}
		
		CalibrationResult result = new CalibrationResult (exp (best.getPoint()), best.getValue(), objective.getEvaluations(), totalIterations, converged, mode);
		if (settings.verbose) {
			ConsoleOutput.synchronizedPrintln ("# [MAX_AT] " + result);
		}
		return result;
	}
	
	private static class SimplexRun {
		final PointValuePair best;
		final int iterations;
		final boolean converged;
		
		SimplexRun (PointValuePair best, int iterations, boolean converged) {
			this.best = best;
			this.iterations = iterations;
			this.converged = converged;
		}
	}
	
	private SimplexRun runSimplex (SeroObjectiveFunction objective, double[] currPoint, double stepSize, int iterationsSoFar) {
		
		OptimizerSettings settings = this.optimizerSettings;
		
		// a simplex with edges of stepSize in each log-coordinate
		double[] steps = new double[currPoint.length];
		Arrays.fill (steps, stepSize);
		NelderMeadSimplex nm = new NelderMeadSimplex (steps);
		nm.build (currPoint);
		nm.evaluate (objective, new PointValueCompare());
		
		int iterations = 0;
		boolean converged = false;
		while (true) {
			
			// simplex is kept sorted, best first
			double bestQ = nm.getPoint(0).getValue();
			double worstQ = nm.getPoint(nm.getSize()-1).getValue();
			
			// extent of the simplex in each coordinate
			double[] maximums = Arrays.copyOf (nm.getPoint(0).getPoint(), currPoint.length);
			double[] minimums = Arrays.copyOf (maximums, maximums.length);
			for (PointValuePair pv : nm.getPoints()) {
				for (int i=0; i<maximums.length; i++) {
					maximums[i] = Math.max (maximums[i], pv.getPoint()[i]);
					minimums[i] = Math.min (minimums[i], pv.getPoint()[i]);
				}
			}
			double errorCoord = 0d;
			for (int i=0; i<maximums.length; i++) {
				errorCoord = Math.max (errorCoord, maximums[i] - minimums[i]);
			}
			double errorQ = Math.abs (worstQ - bestQ) / Math.max (1d, Math.abs (bestQ));
			
			if ((iterations > 0) && (bestQ < SeroObjectiveFunction.PENALTY) && ((errorQ < settings.relativeError) || (errorCoord < settings.coordinateError))) {
				converged = true;
				break;
			}
			// deterministic give up
			if ((iterationsSoFar + iterations >= settings.maxIterations) || (objective.getEvaluations() >= settings.maxEvaluations)) {
				break;
			}
			
			if (settings.verbose && (iterations % 100 == 0)) {
				ConsoleOutput.synchronizedPrintln ("# [NELDER_MEAD_ITERATION_" + (iterationsSoFar + iterations) + "] " + bestQ + "\t" + Arrays.toString (exp (nm.getPoint(0).getPoint())));
			}
			
			nm.iterate (objective, new PointValueCompare());
			iterations++;
		}
		
		return new SimplexRun (nm.getPoint(0), iterations, converged);
	}
	
	private static double[] exp (double[] logPoint) {
		double[] point = new double[logPoint.length];
		for (int i=0; i<point.length; i++) point[i] = Math.exp (logPoint[i]);
		return point;
	}
	
	// smallest value first
	public static class PointValueCompare implements Comparator<PointValuePair> {
		
		@Override
		public int compare(PointValuePair o1, PointValuePair o2) {
			return Double.compare (o1.getValue(), o2.getValue());
		}
	}
}
