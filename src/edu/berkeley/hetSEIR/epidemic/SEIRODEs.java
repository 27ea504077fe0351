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

import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;

/**
 * Right hand side of the stratified SEIR system.
 * <pre>
 * dS_i/dt = -(sum_j beta_ij I_j) S_i
 * dE_i/dt =  (sum_j beta_ij I_j) S_i - r E_i
 * dI_i/dt =  r E_i - gamma I_i
 * dR_i/dt =  gamma I_i
 * </pre>
 * State layout as in {@link CompartmentState#pack()}.
 */
public class SEIRODEs implements FirstOrderDifferentialEquations {

	private final double[][] beta;
	private final double latentRate;
	private final double recoveryRate;
	private final int numGroups;
	
	public SEIRODEs (double[][] beta, double latentRate, double recoveryRate) {
		this.beta = beta;
		this.latentRate = latentRate;
		this.recoveryRate = recoveryRate;
		this.numGroups = beta.length;
	}
	
	@Override
	public void computeDerivatives (double t, double[] y, double[] yDot) {
		
		assert !Double.isNaN(t);
		assert (y.length == getDimension());
		
		int sOff = 0;
		int eOff = this.numGroups;
		int iOff = 2*this.numGroups;
		int rOff = 3*this.numGroups;
		
		for (int i=0; i<this.numGroups; i++) {
			// force of infection on group i
			double force = 0d;
			double[] row = this.beta[i];
			for (int j=0; j<this.numGroups; j++) {
				force += row[j] * y[iOff + j];
			}
			double newInfections = force * y[sOff + i];
			double onset = this.latentRate * y[eOff + i];
			double recovery = this.recoveryRate * y[iOff + i];
			
			yDot[sOff + i] = - newInfections;
			yDot[eOff + i] = newInfections - onset;
			yDot[iOff + i] = onset - recovery;
			yDot[rOff + i] = recovery;
		}
	}

	@Override
	public int getDimension () {
		return CompartmentState.NUM_COMPARTMENTS * this.numGroups;
	}
}
