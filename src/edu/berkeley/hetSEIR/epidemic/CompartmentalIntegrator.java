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
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.ode.nonstiff.HighamHall54Integrator;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.utility.ConsoleOutput;

/**
 * Integrates the stratified SEIR system with an adaptive embedded Runge-Kutta scheme
 * (Higham-Hall 5(4)) and records the state at every point of a given time grid.
 * <p>
 * The step size control shrinks the steps wherever the dynamics get stiff; if that would take
 * the step below {@link IntegratorSettings#minStep}, or more than
 * {@link IntegratorSettings#maxEvaluations} derivative evaluations between two grid points,
 * we give up with an {@link IntegrationDivergenceException}.
 */
public class CompartmentalIntegrator {

	private final IntegratorSettings settings;
	/// false if the caller reports the clamped values itself (e.g. once per fit)
	private final boolean warnOnClamping;
	private int numClamped = 0;
	
	public CompartmentalIntegrator () {
		this (IntegratorSettings.DEFAULT);
	}
	
	public CompartmentalIntegrator (IntegratorSettings settings) {
		this (settings, true);
	}

	public CompartmentalIntegrator (IntegratorSettings settings, boolean warnOnClamping) {
		this.settings = settings;
		this.warnOnClamping = warnOnClamping;
	}
	
	/// values clamped to zero over all calls so far
	public int getNumClamped () {
		return this.numClamped;
	}
	
	public IntegratorSettings getSettings () {
		return this.settings;
	}
	
	/// the state at timeGrid[0] is the initial state
	public Trajectory integrate (CompartmentState initialState, double latentRate, double recoveryRate, double[][] betaScaled, double[] timeGrid) {
		
		checkInput (initialState, latentRate, recoveryRate, betaScaled);
		if (timeGrid == null || timeGrid.length == 0) {
			throw new InvalidParameterException ("Need at least one time point.");
		}
		for (int k=0; k<timeGrid.length; k++) {
			if (Double.isNaN (timeGrid[k]) || Double.isInfinite (timeGrid[k])) {
				throw new InvalidParameterException ("Time point " + k + " is not finite.");
			}
			if ((k > 0) && !(timeGrid[k-1] < timeGrid[k])) {
				throw new InvalidParameterException ("Time grid not strictly increasing at index " + k + ".");
			}
		}
		
		SEIRODEs ode = new SEIRODEs (betaScaled, latentRate, recoveryRate);
		HighamHall54Integrator integrator = getIntegrator();
		double[] groupSizes = groupSizes (initialState);
		
		List<CompartmentState> states = new ArrayList<CompartmentState>();
		states.add (initialState);
		double[] values = initialState.pack();
		int clamped = 0;
		
		// go from grid point to grid point
		for (int k=1; k<timeGrid.length; k++) {
			clamped += step (integrator, ode, values, timeGrid[k-1], timeGrid[k], groupSizes, states.get(states.size()-1));
			states.add (CompartmentState.unpack (values));
		}
		
		reportClamped (clamped);
		
		return new Trajectory (timeGrid, states);
	}
	
	/**
	 * Integrates in steps of samplingStep, starting at startTime, until the exposed and infectious
	 * compartments together are below {@link IntegratorSettings#equilibriumEpsilon} times N and no
	 * longer growing. Fails with an {@link IntegrationDivergenceException} if that doesn't happen before maxTime.
	 */
	public Trajectory integrateToEquilibrium (CompartmentState initialState, double latentRate, double recoveryRate, double[][] betaScaled, double startTime, double samplingStep, double maxTime) {

		checkInput (initialState, latentRate, recoveryRate, betaScaled);
		InvalidParameterException.checkPositive ("Sampling step", samplingStep);
		if (!(maxTime > startTime)) {
			throw new InvalidParameterException ("Maximal time " + maxTime + " has to be after the start time " + startTime + ".");
		}
		
		SEIRODEs ode = new SEIRODEs (betaScaled, latentRate, recoveryRate);
		HighamHall54Integrator integrator = getIntegrator();
		double[] groupSizes = groupSizes (initialState);
		double threshold = this.settings.equilibriumEpsilon * initialState.total();

		List<Double> times = new ArrayList<Double>();
		List<CompartmentState> states = new ArrayList<CompartmentState>();
		times.add (startTime);
		states.add (initialState);
		double[] values = initialState.pack();
		double previousActive = activeInfections (initialState);
		int clamped = 0;
		
		// nothing going on at all
		boolean finished = (previousActive <= 0d);
		int k = 0;
		while (!finished) {
			double currTime = startTime + k * samplingStep;
			double nextTime = startTime + (k+1) * samplingStep;
			if (nextTime > maxTime) {
				throw new IntegrationDivergenceException ("No equilibrium reached before time " + maxTime + ", still " + previousActive + " exposed or infectious.", currTime, states.get(states.size()-1));
			}
			clamped += step (integrator, ode, values, currTime, nextTime, groupSizes, states.get(states.size()-1));
			CompartmentState nextState = CompartmentState.unpack (values);
			times.add (nextTime);
			states.add (nextState);
			
			// burnt out?
			double active = activeInfections (nextState);
			finished = (active < threshold) && (active <= previousActive);
			previousActive = active;
			k++;
		}
		
		reportClamped (clamped);
		
		double[] timeArray = new double[times.size()];
		for (int i=0; i<timeArray.length; i++) timeArray[i] = times.get(i);
		return new Trajectory (timeArray, states);
	}
	
	// one interval, values are updated in place, returns number of clamped entries
	private int step (HighamHall54Integrator integrator, SEIRODEs ode, double[] values, double startTime, double endTime, double[] groupSizes, CompartmentState lastStable) {
		
		try {
			integrator.integrate (ode, startTime, values, endTime, values);
		}
		catch (NumberIsTooSmallException e) {
			throw new IntegrationDivergenceException ("Step size dropped below " + this.settings.minStep + " between " + startTime + " and " + endTime + ".", startTime, lastStable, e);
		}
		catch (MaxCountExceededException e) {
			throw new IntegrationDivergenceException ("More than " + this.settings.maxEvaluations + " evaluations needed between " + startTime + " and " + endTime + ".", startTime, lastStable, e);
		}
		
		return checkValues (values, groupSizes, startTime, endTime, lastStable);
	}
	
	// clamps roundoff negatives in place and returns how many; fails on non-finite or clearly negative values
	int checkValues (double[] values, double[] groupSizes, double startTime, double endTime, CompartmentState lastStable) {
		int numGroups = groupSizes.length;
		int clamped = 0;
		for (int idx=0; idx<values.length; idx++) {
			if (Double.isNaN (values[idx]) || Double.isInfinite (values[idx])) {
				throw new IntegrationDivergenceException ("Non-finite compartment value at time " + endTime + ".", startTime, lastStable);
			}
			if (values[idx] < 0d) {
				double groupSize = groupSizes[idx % numGroups];
				if (values[idx] < - this.settings.negativityTolerance * Math.max (1d, groupSize)) {
					throw new PhysicalInvariantViolationException ("Compartment " + (idx / numGroups) + " of group " + (idx % numGroups) + " is " + values[idx] + " at time " + endTime + ".", startTime, lastStable);
				}
				// roundoff
				values[idx] = 0d;
				clamped++;
			}
		}
		return clamped;
	}
	
	private void reportClamped (int newlyClamped) {
		this.numClamped += newlyClamped;
		if (this.warnOnClamping && newlyClamped > 0) {
			ConsoleOutput.warning ("Clamped " + newlyClamped + " slightly negative compartment values to zero.");
		}
	}
	
	private HighamHall54Integrator getIntegrator () {
		return new RobustHighamHall (this.settings);
	}
	
	private static double[] groupSizes (CompartmentState state) {
		double[] sizes = new double[state.getNumGroups()];
		for (int i=0; i<sizes.length; i++) sizes[i] = state.groupTotal (i);
		return sizes;
	}
	
	private static double activeInfections (CompartmentState state) {
		double active = 0d;
		for (int i=0; i<state.getNumGroups(); i++) {
			active += state.getExposed (i) + state.getInfectious (i);
		}
		return active;
	}
	
	private static void checkInput (CompartmentState initialState, double latentRate, double recoveryRate, double[][] betaScaled) {
		if (initialState == null) throw new InvalidParameterException ("Initial state is missing.");
		InvalidParameterException.checkPositive ("Latent rate r", latentRate);
		InvalidParameterException.checkPositive ("Recovery rate gamma", recoveryRate);
		int numGroups = initialState.getNumGroups();
		if (betaScaled == null || betaScaled.length != numGroups) {
			throw new InvalidParameterException ("Transmission matrix does not match the " + numGroups + " groups of the initial state.");
		}
		for (double[] row : betaScaled) {
			InvalidParameterException.checkLength ("transmission matrix row", row, numGroups);
			for (double value : row) {
				if (!(value >= 0d) || Double.isInfinite (value)) {
					throw new InvalidParameterException ("Transmission matrix has entry " + value + ".");
				}
			}
		}
		double[] packed = initialState.pack();
		for (int idx=0; idx<packed.length; idx++) {
			if (!(packed[idx] >= 0d) || Double.isInfinite (packed[idx])) {
				throw new InvalidParameterException ("Initial state has entry " + packed[idx] + " at " + idx + ": " + Arrays.toString (packed));
			}
		}
	}
}
