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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The total population of a scenario together with its demographic groups.
 * Created once per scenario and only read afterwards.
 */
public class PopulationContext {

	/// how far the fractions may be off from summing to one; census fractions usually come rounded to three digits
	public static final double FRACTION_SUM_EPSILON = 5e-3;

	/// total population size N
	public final double totalPopulation;
	
	private final List<DemographicGroup> groups;
	
	public PopulationContext (double totalPopulation, List<DemographicGroup> groups) {
		InvalidParameterException.checkPositive ("Total population", totalPopulation);
		if (groups == null || groups.isEmpty()) {
			throw new InvalidParameterException ("Need at least one demographic group.");
		}
		
		double fractionSum = 0d;
		for (int i=0; i<groups.size(); i++) {
			DemographicGroup group = groups.get(i);
			if (group.index != i) {
				throw new InvalidParameterException ("Group at position " + i + " has index " + group.index + ".");
			}
			if (group.initialInfected > totalPopulation * group.populationFraction) {
				throw new InvalidParameterException ("Group " + i + " has more initial infected than members.");
			}
			fractionSum += group.populationFraction;
		}
		if (Math.abs (fractionSum - 1d) > FRACTION_SUM_EPSILON) {
			throw new InvalidParameterException ("Population fractions sum to " + fractionSum + ", not 1.");
		}

		this.totalPopulation = totalPopulation;
		this.groups = Collections.unmodifiableList (new ArrayList<DemographicGroup> (groups));
	}
	
	// convenience for the vector shaped input
	public static PopulationContext fromVectors (double totalPopulation, double[] populationFractions, double[] activities, double[] initialInfected) {
		if (populationFractions == null) throw new InvalidParameterException ("Population fractions are missing.");
		InvalidParameterException.checkLength ("activities", activities, populationFractions.length);
		InvalidParameterException.checkLength ("initial infected", initialInfected, populationFractions.length);
		List<DemographicGroup> groupList = new ArrayList<DemographicGroup>();
		for (int i=0; i<populationFractions.length; i++) {
			groupList.add (new DemographicGroup (i, populationFractions[i], activities[i], initialInfected[i]));
		}
		return new PopulationContext (totalPopulation, groupList);
	}
	
	public int getNumGroups () {
		return this.groups.size();
	}
	
	public DemographicGroup getGroup (int i) {
		return this.groups.get(i);
	}

	public List<DemographicGroup> getGroups () {
		return this.groups;
	}
	
	public double[] fractions () {
		double[] toReturn = new double[this.groups.size()];
		for (DemographicGroup group : this.groups) toReturn[group.index] = group.populationFraction;
		return toReturn;
	}
	
	public double[] activities () {
		double[] toReturn = new double[this.groups.size()];
		for (DemographicGroup group : this.groups) toReturn[group.index] = group.activity;
		return toReturn;
	}

	public double[] initialInfected () {
		double[] toReturn = new double[this.groups.size()];
		for (DemographicGroup group : this.groups) toReturn[group.index] = group.initialInfected;
		return toReturn;
	}

	/// N_i = N * f_i
	public double[] groupSizes () {
		double[] toReturn = new double[this.groups.size()];
		for (DemographicGroup group : this.groups) toReturn[group.index] = this.totalPopulation * group.populationFraction;
		return toReturn;
	}

	/// the same population, but with the activities replaced
	public PopulationContext withActivities (double[] newActivities) {
		InvalidParameterException.checkLength ("activities", newActivities, this.groups.size());
		List<DemographicGroup> groupList = new ArrayList<DemographicGroup>();
		for (DemographicGroup group : this.groups) {
			groupList.add (group.withActivity (newActivities[group.index]));
		}
		return new PopulationContext (this.totalPopulation, groupList);
	}
}
