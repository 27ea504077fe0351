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

/// compartments went negative beyond roundoff
public class PhysicalInvariantViolationException extends TrajectoryFailureException {

	private static final long serialVersionUID = 1L;

	public PhysicalInvariantViolationException (String message, double lastStableTime, CompartmentState lastStableState) {
		super (message, lastStableTime, lastStableState, null);
	}
}
