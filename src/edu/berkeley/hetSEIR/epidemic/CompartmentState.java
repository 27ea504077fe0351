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

import java.util.Arrays;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.demography.PopulationContext;

/**
 * Susceptible, exposed, infectious and removed counts for every group at one point in time.
 * The flat layout used by the ODE is {@code [S_0..S_G-1, E_0..E_G-1, I_0..I_G-1, R_0..R_G-1]}.
 */
public class CompartmentState {
	
	public static final int NUM_COMPARTMENTS = 4;

	private final double[] susceptible;
	private final double[] exposed;
	private final double[] infectious;
	private final double[] removed;
	
	public CompartmentState (double[] susceptible, double[] exposed, double[] infectious, double[] removed) {
		if (susceptible == null) throw new InvalidParameterException ("Susceptible vector is missing.");
		int numGroups = susceptible.length;
		InvalidParameterException.checkLength ("exposed", exposed, numGroups);
		InvalidParameterException.checkLength ("infectious", infectious, numGroups);
		InvalidParameterException.checkLength ("removed", removed, numGroups);
		this.susceptible = Arrays.copyOf (susceptible, numGroups);
		this.exposed = Arrays.copyOf (exposed, numGroups);
		this.infectious = Arrays.copyOf (infectious, numGroups);
		this.removed = Arrays.copyOf (removed, numGroups);
	}
	
	/// everybody susceptible, except the initially infectious ones
	public static CompartmentState initialState (PopulationContext context) {
		double[] groupSizes = context.groupSizes();
		double[] infected = context.initialInfected();
		double[] susceptible = new double[groupSizes.length];
		for (int i=0; i<susceptible.length; i++) {
			susceptible[i] = groupSizes[i] - infected[i];
		}
		return new CompartmentState (susceptible, new double[groupSizes.length], infected, new double[groupSizes.length]);
	}
	
	public static CompartmentState unpack (double[] y) {
		assert (y.length % NUM_COMPARTMENTS == 0);
		int numGroups = y.length / NUM_COMPARTMENTS;
		return new CompartmentState (
				Arrays.copyOfRange (y, 0, numGroups),
				Arrays.copyOfRange (y, numGroups, 2*numGroups),
				Arrays.copyOfRange (y, 2*numGroups, 3*numGroups),
				Arrays.copyOfRange (y, 3*numGroups, 4*numGroups));
	}
	
	public double[] pack () {
		int numGroups = getNumGroups();
		double[] y = new double[NUM_COMPARTMENTS * numGroups];
		System.arraycopy (this.susceptible, 0, y, 0, numGroups);
		System.arraycopy (this.exposed, 0, y, numGroups, numGroups);
		System.arraycopy (this.infectious, 0, y, 2*numGroups, numGroups);
		System.arraycopy (this.removed, 0, y, 3*numGroups, numGroups);
		return y;
	}
	
	public int getNumGroups () {
		return this.susceptible.length;
	}
	
	public double getSusceptible (int i) {
		return this.susceptible[i];
	}

	public double getExposed (int i) {
		return this.exposed[i];
	}

	public double getInfectious (int i) {
		return this.infectious[i];
	}

	public double getRemoved (int i) {
		return this.removed[i];
	}
	
	public double[] susceptible () {
		return Arrays.copyOf (this.susceptible, this.susceptible.length);
	}

	public double[] exposed () {
		return Arrays.copyOf (this.exposed, this.exposed.length);
	}

	public double[] infectious () {
		return Arrays.copyOf (this.infectious, this.infectious.length);
	}

	public double[] removed () {
		return Arrays.copyOf (this.removed, this.removed.length);
	}
	
	/// S_i + E_i + I_i + R_i
	public double groupTotal (int i) {
		return this.susceptible[i] + this.exposed[i] + this.infectious[i] + this.removed[i];
	}
	
	public double totalSusceptible () {
		return sum (this.susceptible);
	}

	public double totalInfectious () {
		return sum (this.infectious);
	}

	public double totalRemoved () {
		return sum (this.removed);
	}

	public double total () {
		return sum (this.susceptible) + sum (this.exposed) + sum (this.infectious) + sum (this.removed);
	}
	
	private static double sum (double[] values) {
		double sum = 0d;
		for (double v : values) sum += v;
		return sum;
	}

	@Override
	public String toString() {
		return "S=" + Arrays.toString (this.susceptible) + " E=" + Arrays.toString (this.exposed) + " I=" + Arrays.toString (this.infectious) + " R=" + Arrays.toString (this.removed);
	}
}
