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

import edu.berkeley.hetSEIR.demography.ContactMatrixFactory;
import edu.berkeley.hetSEIR.demography.PopulationContext;

/// turns a trial parameter vector into an (unscaled) transmission matrix
public interface TransmissionModel {

	public double[][] transmissionMatrix (double[] parameters, PopulationContext context, double epsilon);
	
	/// the parameters are the group activities of the contact matrix
	public static class ActivityModel implements TransmissionModel {
		@Override
		public double[][] transmissionMatrix (double[] parameters, PopulationContext context, double epsilon) {
			return ContactMatrixFactory.buildContactMatrix (parameters, context.fractions(), context.totalPopulation, epsilon);
		}
	}
}
