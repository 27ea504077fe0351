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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import edu.berkeley.hetSEIR.demography.ContactMatrixFactory;
import edu.berkeley.hetSEIR.demography.InvalidParameterException;

public class ReproductionNumberCalibratorTest {
	
	private static final double[] FRACTIONS = new double[] {0.632, 0.186, 0.093, 0.068, 0.022};
	private static final double[] ACTIVITIES = new double[] {1d, 4.31, 1.96, 0.92, 2.48};
	private static final double N = 2839436d;
	private static final double GAMMA = 0.25;

	@Test
	public void singleGroup () {
		// beta = a/N, so R0 = a / gamma
		double[][] beta = ContactMatrixFactory.buildContactMatrix (new double[] {1.5}, new double[] {0.9999999}, 1000d, 0d);
		assertEquals (6d, ReproductionNumberCalibrator.basicReproductionNumber (beta, GAMMA, new double[] {0.9999999}, 1000d), 1e-9);
	}
	
	@Test
	public void proportionateMixingClosedForm () {
		double[][] beta = ContactMatrixFactory.buildContactMatrix (ACTIVITIES, FRACTIONS, N, 0d);
		// rank one, R0 = sum f a^2 / (sum f a gamma)
		double first = 0d;
		double second = 0d;
		for (int i=0; i<FRACTIONS.length; i++) {
			first += FRACTIONS[i] * ACTIVITIES[i];
			second += FRACTIONS[i] * ACTIVITIES[i] * ACTIVITIES[i];
		}
		double expected = second / (first * GAMMA);
		assertEquals (expected, ReproductionNumberCalibrator.basicReproductionNumber (beta, GAMMA, FRACTIONS, N), 1e-9 * expected);
	}
	
	@Test
	public void scaledMatrixHasTargetR0 () {
		for (double epsilon : new double[] {0d, 0.3, 0.8, 1d}) {
			for (double r0Target : new double[] {0.8, 1.5, 3d, 12d}) {
				double[][] beta = ContactMatrixFactory.buildContactMatrix (ACTIVITIES, FRACTIONS, N, epsilon);
				double scalingFactor = ReproductionNumberCalibrator.calibrateR0 (beta, GAMMA, FRACTIONS, N, r0Target);
				double[][] scaled = ReproductionNumberCalibrator.scale (beta, scalingFactor);
				double recomputed = ReproductionNumberCalibrator.basicReproductionNumber (scaled, GAMMA, FRACTIONS, N);
				assertEquals ("epsilon " + epsilon + ", R0 " + r0Target, r0Target, recomputed, 1e-6 * r0Target);
			}
		}
	}
	
	@Test
	public void nextGenerationMatrixEntries () {
		double[][] beta = new double[][] {{1e-3, 2e-3}, {3e-3, 4e-3}};
		double[][] ngm = ReproductionNumberCalibrator.nextGenerationMatrix (beta, 0.5, new double[] {0.4, 0.6}, 100d);
		assertEquals (40d * 1e-3 / 0.5, ngm[0][0], 1e-12);
		assertEquals (40d * 2e-3 / 0.5, ngm[0][1], 1e-12);
		assertEquals (60d * 3e-3 / 0.5, ngm[1][0], 1e-12);
		assertEquals (60d * 4e-3 / 0.5, ngm[1][1], 1e-12);
	}
	
	@Test (expected = InvalidParameterException.class)
	public void negativeRate () {
		ReproductionNumberCalibrator.calibrateR0 (new double[][] {{1d, -1d}, {1d, 1d}}, GAMMA, new double[] {0.5, 0.5}, 100d, 3d);
	}

	@Test (expected = InvalidParameterException.class)
	public void zeroGamma () {
		ReproductionNumberCalibrator.calibrateR0 (new double[][] {{1d}}, 0d, new double[] {0.5}, 100d, 3d);
	}

	@Test (expected = InvalidParameterException.class)
	public void zeroTarget () {
		ReproductionNumberCalibrator.calibrateR0 (new double[][] {{1d}}, GAMMA, new double[] {0.5}, 100d, 0d);
	}
}
