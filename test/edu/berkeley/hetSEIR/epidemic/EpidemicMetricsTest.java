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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import edu.berkeley.hetSEIR.demography.ContactMatrixFactory;
import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.epidemic.EpidemicMetrics.EpidemicSummary;
import edu.berkeley.hetSEIR.epidemic.EpidemicMetrics.HerdImmunityThreshold;

public class EpidemicMetricsTest {
	
	// Long Island
	private static final double[] FRACTIONS = new double[] {0.632, 0.186, 0.093, 0.068, 0.022};
	private static final double[] ACTIVITIES = new double[] {1d, 4.31, 1.96, 0.92, 2.48};
	private static final double N = 2839436d;
	private static final double LATENT_RATE = 1d/3d;
	private static final double RECOVERY_RATE = 0.25;
	private static final double R0 = 3d;

	@Test
	public void longIslandToEquilibrium () throws ThresholdNotReachedException {
		// one infectious individual, spread over the groups
		PopulationContext context = PopulationContext.fromVectors (N, FRACTIONS, ACTIVITIES, FRACTIONS.clone());
		double[][] beta = ContactMatrixFactory.buildContactMatrix (context, 0d);
		double scalingFactor = ReproductionNumberCalibrator.calibrateR0 (beta, RECOVERY_RATE, FRACTIONS, N, R0);
		Trajectory trajectory = new CompartmentalIntegrator().integrateToEquilibrium (CompartmentState.initialState (context), LATENT_RATE, RECOVERY_RATE, ReproductionNumberCalibrator.scale (beta, scalingFactor), 0d, 0.05, 1000d);
		
		EpidemicSummary summary = EpidemicMetrics.computeMetrics (trajectory, beta, scalingFactor, RECOVERY_RATE, N, FRACTIONS);
		
		assertEquals (0.693, summary.finalSize, 0.01 * 0.693);
		assertEquals (0.398, summary.getHitOverall(), 0.01 * 0.398);
		double[] expectedPerGroup = new double[] {0.286, 0.766, 0.483, 0.266, 0.566};
		double[] perGroup = summary.getHitPerGroup();
		for (int i=0; i<expectedPerGroup.length; i++) {
			assertEquals ("group " + i, expectedPerGroup[i], perGroup[i], 0.01 * expectedPerGroup[i]);
		}
		
		// the start is fully susceptible, up to one individual
		double[] rtSeries = summary.getRtSeries();
		assertEquals (R0, rtSeries[0], 1e-3);
		
		// the threshold is the largest Rt that is at most one, and it doesn't grow back afterwards
		HerdImmunityThreshold hit = summary.herdImmunityThreshold;
		assertTrue (hit.rt <= 1d);
		for (int k=0; k<rtSeries.length; k++) {
			if (rtSeries[k] <= 1d) assertTrue (rtSeries[k] <= hit.rt);
		}
		assertTrue (hit.timeIndex + 1 < rtSeries.length);
		assertTrue (rtSeries[hit.timeIndex + 1] <= 1d);
		assertEquals (trajectory.getTime (hit.timeIndex), hit.time, 0d);
		
		// everybody got the disease more often in the more active groups
		double[] attackRates = summary.getAttackRates();
		assertTrue (attackRates[1] > attackRates[4]);
		assertTrue (attackRates[4] > attackRates[2]);
		assertTrue (attackRates[2] > attackRates[0]);
		assertTrue (attackRates[0] > attackRates[3]);
		
		assertTrue (summary.peakTime > 0d);
		assertTrue (summary.peakTime < trajectory.getLastTime());
	}
	
	@Test
	public void horizonTooShort () {
		PopulationContext context = PopulationContext.fromVectors (N, FRACTIONS, ACTIVITIES, FRACTIONS.clone());
		double[][] beta = ContactMatrixFactory.buildContactMatrix (context, 0d);
		double scalingFactor = ReproductionNumberCalibrator.calibrateR0 (beta, RECOVERY_RATE, FRACTIONS, N, R0);
		Trajectory trajectory = new CompartmentalIntegrator().integrate (CompartmentState.initialState (context), LATENT_RATE, RECOVERY_RATE, ReproductionNumberCalibrator.scale (beta, scalingFactor), new double[] {0d, 5d, 10d, 20d});
		try {
			EpidemicMetrics.computeMetrics (trajectory, beta, scalingFactor, RECOVERY_RATE, N, FRACTIONS);
			fail ("Rt can't have dropped to one yet.");
		}
		catch (ThresholdNotReachedException e) {
			assertEquals (20d, e.getLastTime(), 0d);
		}
	}
	
	// two groups of 40 and 60, handmade states
	private static Trajectory handmadeTrajectory () {
		List<CompartmentState> states = new ArrayList<CompartmentState>();
		states.add (state (39d, 0d, 1d, 0d, 60d, 0d, 0d, 0d));
		states.add (state (30d, 4d, 5d, 1d, 50d, 4d, 4d, 2d));
		states.add (state (20d, 2d, 10d, 8d, 40d, 2d, 6d, 12d));
		states.add (state (10d, 1d, 4d, 25d, 35d, 1d, 3d, 21d));
		states.add (state (9d, 0d, 1d, 30d, 34d, 0d, 1d, 25d));
		return new Trajectory (new double[] {0d, 1d, 2d, 3d, 4d}, states);
	}
	
	private static CompartmentState state (double s0, double e0, double i0, double r0, double s1, double e1, double i1, double r1) {
		return new CompartmentState (new double[] {s0, s1}, new double[] {e0, e1}, new double[] {i0, i1}, new double[] {r0, r1});
	}
	
	@Test
	public void thresholdTakesLargestRtBelowOneEarliestFirst () throws ThresholdNotReachedException {
		Trajectory trajectory = handmadeTrajectory();
		double[] rtSeries = new double[] {2.5, 1.2, 1d, 0.7, 1d};
		HerdImmunityThreshold hit = EpidemicMetrics.herdImmunityThreshold (trajectory, rtSeries, 100d, new double[] {0.4, 0.6});
		assertEquals (2, hit.timeIndex);
		assertEquals (2d, hit.time, 0d);
		assertEquals (1d, hit.rt, 0d);
		// 1 - 60/100
		assertEquals (0.4, hit.overall, 1e-12);
		assertArrayEquals (new double[] {0.5, 1d/3d}, hit.getPerGroup(), 1e-12);
	}
	
	@Test (expected = ThresholdNotReachedException.class)
	public void thresholdNeverReached () throws ThresholdNotReachedException {
		EpidemicMetrics.herdImmunityThreshold (handmadeTrajectory(), new double[] {2.5, 2d, 1.5, 1.1, 1.01}, 100d, new double[] {0.4, 0.6});
	}
	
	@Test
	public void finalSizePeakAndAttackRates () {
		Trajectory trajectory = handmadeTrajectory();
		assertEquals (0.55, EpidemicMetrics.finalSize (trajectory, 100d), 1e-12);
		assertArrayEquals (new double[] {0.75, 25d/60d}, EpidemicMetrics.attackRates (trajectory, 100d, new double[] {0.4, 0.6}), 1e-12);
		// 16 infectious at t=2
		assertEquals (2d, EpidemicMetrics.peakTime (trajectory), 0d);
	}
	
	@Test
	public void rtFollowsTheSusceptibles () {
		// single group, beta N / gamma = 4
		double[][] beta = new double[][] {{0.01}};
		List<CompartmentState> states = new ArrayList<CompartmentState>();
		states.add (new CompartmentState (new double[] {100d}, new double[] {0d}, new double[] {0d}, new double[] {0d}));
		states.add (new CompartmentState (new double[] {50d}, new double[] {0d}, new double[] {0d}, new double[] {50d}));
		states.add (new CompartmentState (new double[] {0d}, new double[] {0d}, new double[] {0d}, new double[] {100d}));
		Trajectory trajectory = new Trajectory (new double[] {0d, 1d, 2d}, states);
		double[] rtSeries = EpidemicMetrics.effectiveReproductionNumbers (trajectory, beta, 2d, 0.25);
		assertArrayEquals (new double[] {2d, 1d, 0d}, rtSeries, 1e-12);
	}
	
	@Test (expected = InvalidParameterException.class)
	public void rtSeriesTooShort () throws ThresholdNotReachedException {
		EpidemicMetrics.herdImmunityThreshold (handmadeTrajectory(), new double[] {2.5, 0.5}, 100d, new double[] {0.4, 0.6});
	}
}
