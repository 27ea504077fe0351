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

/// malformed scenario input (fractions, population, assortativity, rates, grids); caller has to fix the input
public class InvalidParameterException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidParameterException (String message) {
		super (message);
	}

	// some checks that come up everywhere
	public static void checkPositive (String name, double value) {
		if (!(value > 0d) || Double.isInfinite (value)) {
			throw new InvalidParameterException (name + " has to be positive and finite (not " + value + ").");
		}
	}

	public static void checkLength (String name, double[] vector, int expected) {
		if (vector == null) {
			throw new InvalidParameterException (name + " is missing.");
		}
		if (vector.length != expected) {
			throw new InvalidParameterException ("Length of " + name + " is " + vector.length + ", expected " + expected + ".");
		}
	}
}
