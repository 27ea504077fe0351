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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import edu.berkeley.hetSEIR.demography.ContactMatrixFactory;
import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.demography.SeroObservation;
import edu.berkeley.hetSEIR.epidemic.CompartmentalIntegrator;
import edu.berkeley.hetSEIR.epidemic.IntegratorSettings;

public class SeroCalibrationEngineTest {
	
	private static final double LATENT_RATE = 1d/3d;
	private static final double RECOVERY_RATE = 0.25;
	
	// Long Island
	private static final double LI_N = 2839436d;
	private static final double[] LI_FRACTIONS = new double[] {0.632, 0.186, 0.093, 0.068, 0.022};
	private static final int[] LI_TESTED = new int[] {1599, 301, 111, 50, 50};
	private static final double[] LI_SERO = new double[] {0.087, 0.320, 0.158, 0.084, 0.207};
	
	private static PopulationContext context (double totalPopulation, double[] fractions, double totalInfected) {
		double[] ones = new double[fractions.length];
		double[] infected = new double[fractions.length];
		for (int i=0; i<fractions.length; i++) {
			ones[i] = 1d;
			infected[i] = totalInfected * fractions[i];
		}
		return PopulationContext.fromVectors (totalPopulation, fractions, ones, infected);
	}

	@Test
	public void recoversSyntheticActivities () {
		double[] fractions = new double[] {0.5, 0.3, 0.2};
		PopulationContext context = context (1e6, fractions, 10d);
		double surveyTime = 70d;
		double[] truth = new double[] {0.5, 1d, 0.25};
		
		// noise free data from the true activities
		int[] tested = new int[] {1000000, 1000000, 1000000};
		SeroObservation dummy = new SeroObservation (tested, new double[3]);
		SeroObjectiveFunction generator = new SeroObjectiveFunction (context, dummy, new TransmissionModel.ActivityModel(), new CompartmentalIntegrator(), LATENT_RATE, RECOVERY_RATE, 0d, surveyTime, SeroCalibrationEngine.uniformBounds (3, SeroCalibrationEngine.LOWER_BOUND, SeroCalibrationEngine.UPPER_BOUND));
		double[] prevalence = generator.predictedSeroprevalence (truth);
		for (double p : prevalence) assertTrue (p > 0.05 && p < 0.95);
		SeroObservation observation = new SeroObservation (tested, prevalence);
		
		CalibrationResult result = new SeroCalibrationEngine().fitParameters (context, observation, LATENT_RATE, RECOVERY_RATE, 0d, surveyTime, "activity", null, null);
		
		assertTrue (result.converged);
		assertEquals (ParameterizationMode.ACTIVITY, result.mode);
		double[] normalized = result.getParameters();
		assertEquals (1d, normalized[0], 0d);
		assertEquals (2d, normalized[1], 2e-3);
		assertEquals (0.5, normalized[2], 1e-3);
		// here the scale is identifiable too
		double[] raw = result.getRawParameters();
		for (int i=0; i<truth.length; i++) {
			assertEquals (truth[i], raw[i], 1e-3 * truth[i]);
		}
	}
	
	@Test
	public void longIsland () {
		PopulationContext context = context (LI_N, LI_FRACTIONS, 10d);
		SeroObservation observation = new SeroObservation (LI_TESTED, LI_SERO);
		
		CalibrationResult result = new SeroCalibrationEngine().fitParameters (context, observation, LATENT_RATE, RECOVERY_RATE, 0d, 100d, ParameterizationMode.ACTIVITY, null, null);
		
		assertTrue (result.converged);
		double[] expected = new double[] {1d, 4.31, 1.96, 0.92, 2.48};
		double[] normalized = result.getParameters();
		for (int i=0; i<expected.length; i++) {
			assertEquals ("group " + i, expected[i], normalized[i], 0.01 * expected[i]);
		}
		assertTrue (result.negLogLikelihood < SeroObjectiveFunction.PENALTY);
		assertTrue (result.evaluations > 0);
	}
	
	@Test
	public void capsGiveBestPointSoFar () {
		PopulationContext context = context (LI_N, LI_FRACTIONS, 10d);
		SeroObservation observation = new SeroObservation (LI_TESTED, LI_SERO);
		SeroCalibrationEngine engine = new SeroCalibrationEngine (OptimizerSettings.DEFAULT.withLimits (3, 1000), IntegratorSettings.DEFAULT);
		
		CalibrationResult result = engine.fitParameters (context, observation, LATENT_RATE, RECOVERY_RATE, 0d, 100d, "activity", null, null);
		
		assertFalse (result.converged);
		assertEquals (3, result.iterations);
		assertEquals (1d, result.getParameters()[0], 0d);
	}
	
	@Test
	public void registeredSusceptibilityModel () {
		PopulationContext context = context (LI_N, LI_FRACTIONS, 10d);
		SeroObservation observation = new SeroObservation (LI_TESTED, LI_SERO);
		// some matrix where the parameters only scale the receiving side
		TransmissionModel susceptibility = new TransmissionModel() {
			@Override
			public double[][] transmissionMatrix (double[] parameters, PopulationContext populationContext, double epsilon) {
				double[] ones = new double[parameters.length];
				Arrays.fill (ones, 1d);
				double[][] beta = ContactMatrixFactory.buildContactMatrix (ones, populationContext.fractions(), populationContext.totalPopulation, epsilon);
				for (int i=0; i<beta.length; i++) {
					for (int j=0; j<beta.length; j++) beta[i][j] *= parameters[i];
				}
				return beta;
			}
		};
		SeroCalibrationEngine engine = new SeroCalibrationEngine (OptimizerSettings.DEFAULT.withLimits (5, 1000), IntegratorSettings.DEFAULT).withModel (ParameterizationMode.SUSCEPTIBILITY, susceptibility);
		
		CalibrationResult result = engine.fitParameters (context, observation, LATENT_RATE, RECOVERY_RATE, 0d, 100d, " Susceptibility", null, null);
		
		assertEquals (ParameterizationMode.SUSCEPTIBILITY, result.mode);
		assertTrue (result.negLogLikelihood < SeroObjectiveFunction.PENALTY);
	}
	
	@Test (expected = UnsupportedOperationException.class)
	public void susceptibilityNeedsAModel () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (LI_TESTED, LI_SERO), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "susceptibility", null, null);
	}

	@Test (expected = ModelNotRecognizedException.class)
	public void unknownMode () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (LI_TESTED, LI_SERO), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "contact", null, null);
	}
	
	@Test (expected = InvalidParameterException.class)
	public void guessOutsideBounds () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (LI_TESTED, LI_SERO), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "activity", new double[] {1d, 1d, 1d, 1d, 50d}, null);
	}

	@Test (expected = InvalidParameterException.class)
	public void guessOfWrongLength () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (LI_TESTED, LI_SERO), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "activity", new double[] {1d, 1d}, null);
	}

	@Test (expected = InvalidParameterException.class)
	public void observationDoesNotMatch () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (new int[] {10, 10}, new double[] {0.1, 0.2}), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "activity", null, null);
	}

	@Test (expected = InvalidParameterException.class)
	public void invertedBounds () {
		new SeroCalibrationEngine().fitParameters (context (LI_N, LI_FRACTIONS, 10d), new SeroObservation (LI_TESTED, LI_SERO), LATENT_RATE, RECOVERY_RATE, 0d, 100d, "activity", null, SeroCalibrationEngine.uniformBounds (5, 2d, 1d));
	}
}
