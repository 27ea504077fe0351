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

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;

import com.martiansoftware.jsap.JSAPException;

import edu.berkeley.hetSEIR.demography.ContactMatrixFactory;
import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.epidemic.CompartmentState;
import edu.berkeley.hetSEIR.epidemic.CompartmentalIntegrator;
import edu.berkeley.hetSEIR.epidemic.EpidemicMetrics;
import edu.berkeley.hetSEIR.epidemic.EpidemicMetrics.EpidemicSummary;
import edu.berkeley.hetSEIR.epidemic.ReproductionNumberCalibrator;
import edu.berkeley.hetSEIR.epidemic.ThresholdNotReachedException;
import edu.berkeley.hetSEIR.epidemic.Trajectory;
import edu.berkeley.hetSEIR.utility.ConsoleOutput;

/**
 * Fits the group parameters to a serosurvey, then runs the epidemic forward with the fitted
 * parameters at the requested R0 and reports final size and herd immunity threshold.
 */
public class SeroEstimation {

	public static void main (String[] args) throws JSAPException, IOException {
		
		long programStartTime = System.currentTimeMillis();

		// print out the command line arguments
		PrintStream outStream = System.out;
		outStream.print("# Command-line arguments: ");
		for (String arg: args)	{
			outStream.print(arg + " ");
		}
		outStream.print("\n");
		
		SeroParamSet params = new SeroParamSet (args);
		if (!params.valid) return;
		params.print (outStream);
		
		PopulationContext context = params.getPopulationContext();
		SeroCalibrationEngine engine = new SeroCalibrationEngine (params.optimizerSettings, params.integratorSettings);
		CalibrationResult result = engine.fitParameters (context, params.getObservation(), params.latentRate, params.recoveryRate, params.epsilon, params.surveyTime, params.mode, params.startPoint, params.bounds);
		
		outStream.println ("# [FIT] " + result);
		
		EpidemicSummary summary = forwardRun (context, result.getParameters(), params, outStream);
		if (summary != null) {
			outStream.println ("# [FINAL_SIZE] " + summary.finalSize);
			outStream.println ("# [ATTACK_RATES] " + Arrays.toString (summary.getAttackRates()));
			outStream.println ("# [PEAK_TIME] " + summary.peakTime);
			outStream.println ("# [HIT] " + summary.herdImmunityThreshold);
		}
		
		outStream.println ("# Total time: " + (System.currentTimeMillis() - programStartTime)/1000d + " s");
	}

	// only activities go into the forward run; null if the threshold is never crossed
	static EpidemicSummary forwardRun (PopulationContext context, double[] activities, SeroParamSet params, PrintStream outStream) {
		if (params.mode != ParameterizationMode.ACTIVITY) {
			ConsoleOutput.warning ("No forward run for mode " + params.mode.label + ".");
			return null;
		}
		PopulationContext fitted = context.withActivities (activities);
		double[][] beta = ContactMatrixFactory.buildContactMatrix (fitted, params.epsilon);
		double[] fractions = fitted.fractions();
		double scalingFactor = ReproductionNumberCalibrator.calibrateR0 (beta, params.recoveryRate, fractions, fitted.totalPopulation, params.r0Target);
		outStream.println ("# [SCALING_FACTOR] " + scalingFactor);
		
		CompartmentalIntegrator integrator = new CompartmentalIntegrator (params.integratorSettings);
		Trajectory trajectory = integrator.integrateToEquilibrium (CompartmentState.initialState (fitted), params.latentRate, params.recoveryRate, ReproductionNumberCalibrator.scale (beta, scalingFactor), 0d, params.samplingStep, params.maxTime);
		
		try {
			return EpidemicMetrics.computeMetrics (trajectory, beta, scalingFactor, params.recoveryRate, fitted.totalPopulation, fractions);
		}
		catch (ThresholdNotReachedException e) {
			ConsoleOutput.warning (e.getMessage());
			outStream.println ("# [FINAL_SIZE] " + EpidemicMetrics.finalSize (trajectory, fitted.totalPopulation));
			return null;
		}
	}
}
