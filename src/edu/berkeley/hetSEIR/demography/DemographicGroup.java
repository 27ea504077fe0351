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

public class DemographicGroup {

	/// position of this group in all the vectors and matrices
	public final int index;
	
	/// share of the total population, in (0,1)
	public final double populationFraction;
	
	/// relative contact (or susceptibility) multiplier
	public final double activity;
	
	/// number of individuals infectious at time zero
	public final double initialInfected;
	
	public DemographicGroup (int index, double populationFraction, double activity, double initialInfected) {
		if (index < 0) throw new InvalidParameterException ("Negative group index " + index + ".");
		if (!(populationFraction > 0d) || !(populationFraction < 1d)) {
			throw new InvalidParameterException ("Population fraction of group " + index + " has to be in (0,1) (not " + populationFraction + ").");
		}
		InvalidParameterException.checkPositive ("Activity of group " + index, activity);
		if (!(initialInfected >= 0d) || Double.isInfinite (initialInfected)) {
			throw new InvalidParameterException ("Initial infected of group " + index + " has to be nonnegative (not " + initialInfected + ").");
		}
		this.index = index;
		this.populationFraction = populationFraction;
		this.activity = activity;
		this.initialInfected = initialInfected;
	}
	
	// same group, other activity
	public DemographicGroup withActivity (double newActivity) {
		return new DemographicGroup (this.index, this.populationFraction, newActivity, this.initialInfected);
	}

	@Override
	public String toString() {
		return "[group " + this.index + ": fraction=" + this.populationFraction + ", activity=" + this.activity + ", I0=" + this.initialInfected + "]";
	}
}
