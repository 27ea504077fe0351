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

package edu.berkeley.hetSEIR.maximum_likelihood;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

public class ParameterizationModeTest {

	@Test
	public void labels () {
		assertEquals (ParameterizationMode.ACTIVITY, ParameterizationMode.fromString ("activity"));
		assertEquals (ParameterizationMode.SUSCEPTIBILITY, ParameterizationMode.fromString (" SUSCEPTIBILITY "));
	}
	
	@Test (expected = ModelNotRecognizedException.class)
	public void unknown () {
		ParameterizationMode.fromString ("infectivity");
	}

	@Test (expected = ModelNotRecognizedException.class)
	public void missing () {
		ParameterizationMode.fromString (null);
	}
	
	@Test
	public void resultIsNormalizedToFirstGroup () {
		CalibrationResult result = new CalibrationResult (new double[] {0.5, 2d, 0.25}, 12d, 100, 40, true, ParameterizationMode.ACTIVITY);
		assertArrayEquals (new double[] {1d, 4d, 0.5}, result.getParameters(), 1e-15);
		assertArrayEquals (new double[] {0.5, 2d, 0.25}, result.getRawParameters(), 0d);
	}
	
	@Test (expected = InvalidParameterException.class)
	public void emptyResult () {
		new CalibrationResult (new double[0], 12d, 100, 40, true, ParameterizationMode.ACTIVITY);
	}
	
	@Test (expected = InvalidParameterException.class)
	public void referenceGroupMustBePositive () {
		new CalibrationResult (new double[] {0d, 2d}, 12d, 100, 40, true, ParameterizationMode.ACTIVITY);
	}
}
