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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

/// compartment states on an increasing time grid
public class Trajectory {

	private final double[] times;
	private final List<CompartmentState> states;
	
	public Trajectory (double[] times, List<CompartmentState> states) {
		if (times == null || states == null || times.length == 0) {
			throw new InvalidParameterException ("A trajectory needs at least one time point.");
		}
		if (times.length != states.size()) {
			throw new InvalidParameterException ("Have " + times.length + " time points but " + states.size() + " states.");
		}
		for (int k=1; k<times.length; k++) {
			if (!(times[k-1] < times[k])) {
				throw new InvalidParameterException ("Times not strictly increasing at index " + k + ".");
			}
		}
		this.times = times.clone();
		this.states = Collections.unmodifiableList (new ArrayList<CompartmentState> (states));
	}
	
	public int size () {
		return this.times.length;
	}
	
	public double getTime (int k) {
		return this.times[k];
	}
	
	public double[] times () {
		return this.times.clone();
	}
	
	public CompartmentState getState (int k) {
		return this.states.get(k);
	}

	public List<CompartmentState> getStates () {
		return this.states;
	}
	
	public CompartmentState getLastState () {
		return this.states.get (this.states.size() - 1);
	}

	public double getLastTime () {
		return this.times[this.times.length - 1];
	}
	
	public int getNumGroups () {
		return this.states.get(0).getNumGroups();
	}
}
