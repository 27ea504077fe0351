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

import java.util.Arrays;

/// serosurvey result: per group the sample size and the fraction that tested positive
public class SeroObservation {

	private final int[] tested;
	private final double[] seropositiveFractions;
	
	public SeroObservation (int[] tested, double[] seropositiveFractions) {
		if (tested == null || seropositiveFractions == null) {
			throw new InvalidParameterException ("Tested and seropositive fractions have to be given.");
		}
		if (tested.length != seropositiveFractions.length) {
			throw new InvalidParameterException ("Have " + tested.length + " sample sizes but " + seropositiveFractions.length + " seropositive fractions.");
		}
		for (int i=0; i<tested.length; i++) {
			if (tested[i] <= 0) {
				throw new InvalidParameterException ("Sample size of group " + i + " has to be positive (not " + tested[i] + ").");
			}
			if (!(seropositiveFractions[i] >= 0d) || !(seropositiveFractions[i] <= 1d)) {
				throw new InvalidParameterException ("Seropositive fraction of group " + i + " has to be in [0,1] (not " + seropositiveFractions[i] + ").");
			}
		}
		this.tested = Arrays.copyOf (tested, tested.length);
		this.seropositiveFractions = Arrays.copyOf (seropositiveFractions, seropositiveFractions.length);
	}
	
	public int getNumGroups () {
		return this.tested.length;
	}
	
	public int getTested (int i) {
		return this.tested[i];
	}

	public double getSeropositiveFraction (int i) {
		return this.seropositiveFractions[i];
	}
	
	/// positive_i = round (fraction_i * tested_i)
	public int getPositive (int i) {
		return (int) Math.round (this.seropositiveFractions[i] * this.tested[i]);
	}
	
	public int[] positives () {
		int[] toReturn = new int[this.tested.length];
		for (int i=0; i<toReturn.length; i++) toReturn[i] = getPositive (i);
		return toReturn;
	}

	@Override
	public String toString() {
		return "tested=" + Arrays.toString (this.tested) + ", seropositive=" + Arrays.toString (this.seropositiveFractions);
	}
}
