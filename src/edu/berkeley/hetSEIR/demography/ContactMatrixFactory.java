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

package edu.berkeley.hetSEIR.demography;

/**
 * Builds the unscaled group-to-group transmission matrix from the group activities.
 * <p>
 * {@code beta[i][j] = (1-epsilon) * a_i * a_j / sum_k (N f_k a_k) + epsilon * a_i / (N f_i) * [i==j]}
 * <p>
 * An assortativity of zero gives proportionate mixing, one confines all contacts to the own group.
 * Called inside the objective function of the optimizer, so keep it cheap.
 */
public class ContactMatrixFactory {
	
	public static double[][] buildContactMatrix (double[] activities, double[] populationFractions, double totalPopulation, double epsilon) {
		
		// check the input
		if (populationFractions == null || populationFractions.length == 0) {
			throw new InvalidParameterException ("Need population fractions for at least one group.");
		}
		int numGroups = populationFractions.length;
		InvalidParameterException.checkLength ("activities", activities, numGroups);
		InvalidParameterException.checkPositive ("Total population", totalPopulation);
		if (!(0d <= epsilon) || !(epsilon <= 1d)) {
			throw new InvalidParameterException ("Assortativity has to be in [0,1] (not " + epsilon + ").");
		}
		for (int i=0; i<numGroups; i++) {
			InvalidParameterException.checkPositive ("Population fraction of group " + i, populationFractions[i]);
			InvalidParameterException.checkPositive ("Activity of group " + i, activities[i]);
		}
		
		// total activity mass in the population
		double activityMass = 0d;
		for (int k=0; k<numGroups; k++) {
			activityMass += totalPopulation * populationFractions[k] * activities[k];
		}
		
		double[][] beta = new double[numGroups][numGroups];
		for (int i=0; i<numGroups; i++) {
			for (int j=0; j<numGroups; j++) {
				// proportionate part
				beta[i][j] = (1d - epsilon) * activities[i] * activities[j] / activityMass;
			}
			// assortative part only on the diagonal
			beta[i][i] += epsilon * activities[i] / (totalPopulation * populationFractions[i]);
		}
		
		return beta;
	}
	
	public static double[][] buildContactMatrix (PopulationContext context, double epsilon) {
		return buildContactMatrix (context.activities(), context.fractions(), context.totalPopulation, epsilon);
	}
}
