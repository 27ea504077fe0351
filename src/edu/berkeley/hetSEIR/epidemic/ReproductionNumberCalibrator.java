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
import edu.berkeley.hetSEIR.epidemic.auxiliary.DominantEigenvalue;
import Jama.Matrix;

/**
 * Normalizes a transmission matrix to a given basic reproduction number.
 * <p>
 * The next-generation matrix is {@code M = diag(N f) * beta / gamma}, its dominant eigenvalue is R0.
 * Dividing beta by {@code s = lambda_1 / R0_target} therefore gives a matrix with exactly the target R0.
 */
public class ReproductionNumberCalibrator {

	/// M[i][j] = N f_i beta[i][j] / gamma
	public static double[][] nextGenerationMatrix (double[][] beta, double gamma, double[] populationFractions, double totalPopulation) {
		checkInput (beta, gamma, populationFractions, totalPopulation);
		int numGroups = populationFractions.length;
		double[] groupSizes = new double[numGroups];
		for (int i=0; i<numGroups; i++) groupSizes[i] = totalPopulation * populationFractions[i];
		return weightedNextGenerationMatrix (beta, 1d, gamma, groupSizes);
	}
	
	/// diag(weights) * beta / (scalingFactor * gamma); weights are the group sizes for R0, the susceptibles for Rt
	static double[][] weightedNextGenerationMatrix (double[][] beta, double scalingFactor, double gamma, double[] weights) {
		int numGroups = weights.length;
		Matrix diagonal = new Matrix (numGroups, numGroups);
		for (int i=0; i<numGroups; i++) {
			diagonal.set (i, i, weights[i]);
		}
		return diagonal.times (new Matrix (beta)).timesEquals (1d / (scalingFactor * gamma)).getArray();
	}
	
	/// dominant eigenvalue of the next-generation matrix
	public static double basicReproductionNumber (double[][] beta, double gamma, double[] populationFractions, double totalPopulation) {
		return DominantEigenvalue.computePositive (nextGenerationMatrix (beta, gamma, populationFractions, totalPopulation));
	}
	
	/// the factor s such that beta / s has reproduction number r0Target
	public static double calibrateR0 (double[][] beta, double gamma, double[] populationFractions, double totalPopulation, double r0Target) {
		InvalidParameterException.checkPositive ("Target reproduction number", r0Target);
		double lambda = basicReproductionNumber (beta, gamma, populationFractions, totalPopulation);
		return lambda / r0Target;
	}
	
	/// beta / s
	public static double[][] scale (double[][] beta, double scalingFactor) {
		InvalidParameterException.checkPositive ("Scaling factor", scalingFactor);
		return new Matrix (beta).times (1d / scalingFactor).getArray();
	}
	
	private static void checkInput (double[][] beta, double gamma, double[] populationFractions, double totalPopulation) {
		InvalidParameterException.checkPositive ("Recovery rate", gamma);
		InvalidParameterException.checkPositive ("Total population", totalPopulation);
		if (populationFractions == null || populationFractions.length == 0) {
			throw new InvalidParameterException ("Need population fractions for at least one group.");
		}
		if (beta == null || beta.length != populationFractions.length) {
			throw new InvalidParameterException ("Transmission matrix does not match the number of groups.");
		}
		for (int i=0; i<beta.length; i++) {
			InvalidParameterException.checkLength ("row " + i + " of the transmission matrix", beta[i], populationFractions.length);
			InvalidParameterException.checkPositive ("Population fraction of group " + i, populationFractions[i]);
			for (int j=0; j<beta[i].length; j++) {
				if (beta[i][j] < 0d) {
					throw new InvalidParameterException ("Negative transmission rate " + beta[i][j] + " at (" + i + "," + j + ").");
				}
			}
		}
	}
}
