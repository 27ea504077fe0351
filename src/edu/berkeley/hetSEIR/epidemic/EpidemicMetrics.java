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
import edu.berkeley.hetSEIR.epidemic.auxiliary.DominantEigenvalue;

/**
 * Summary statistics derived from a finished {@link Trajectory}: final size, effective
 * reproduction number over time, and the herd immunity threshold.
 */
public class EpidemicMetrics {
	
	public static class HerdImmunityThreshold {
		/// index into the trajectory
		public final int timeIndex;
		public final double time;
		/// the effective reproduction number at that point, largest among the ones <= 1
		public final double rt;
		/// 1 - sum S_i / N
		public final double overall;
		/// 1 - S_i / N_i
		private final double[] perGroup;
		
		public HerdImmunityThreshold (int timeIndex, double time, double rt, double overall, double[] perGroup) {
			this.timeIndex = timeIndex;
			this.time = time;
			this.rt = rt;
			this.overall = overall;
			this.perGroup = perGroup.clone();
		}
		
		public double[] getPerGroup () {
			return this.perGroup.clone();
		}

		@Override
		public String toString() {
			return "HIT=" + this.overall + " at t=" + this.time + " (Rt=" + this.rt + "), per group " + Arrays.toString (this.perGroup);
		}
	}
	
	public static class EpidemicSummary {
		public final double finalSize;
		private final double[] attackRates;
		private final double[] rtSeries;
		public final HerdImmunityThreshold herdImmunityThreshold;
		public final double peakTime;
		
		public EpidemicSummary (double finalSize, double[] attackRates, double[] rtSeries, HerdImmunityThreshold herdImmunityThreshold, double peakTime) {
			this.finalSize = finalSize;
			this.attackRates = attackRates.clone();
			this.rtSeries = rtSeries.clone();
			this.herdImmunityThreshold = herdImmunityThreshold;
			this.peakTime = peakTime;
		}
		
		public double[] getAttackRates () {
			return this.attackRates.clone();
		}
		
		public double[] getRtSeries () {
			return this.rtSeries.clone();
		}
		
		public double getHitOverall () {
			return this.herdImmunityThreshold.overall;
		}
		
		public double[] getHitPerGroup () {
			return this.herdImmunityThreshold.getPerGroup();
		}
	}

	/// everything at once; fails if the horizon is too short to see Rt drop to one
	public static EpidemicSummary computeMetrics (Trajectory trajectory, double[][] betaUnscaled, double scalingFactor, double gamma, double totalPopulation, double[] populationFractions) throws ThresholdNotReachedException {
		double[] rtSeries = effectiveReproductionNumbers (trajectory, betaUnscaled, scalingFactor, gamma);
		HerdImmunityThreshold hit = herdImmunityThreshold (trajectory, rtSeries, totalPopulation, populationFractions);
		return new EpidemicSummary (finalSize (trajectory, totalPopulation), attackRates (trajectory, totalPopulation, populationFractions), rtSeries, hit, peakTime (trajectory));
	}
	
	/// sum R_i at the last time point, over N
	public static double finalSize (Trajectory trajectory, double totalPopulation) {
		InvalidParameterException.checkPositive ("Total population", totalPopulation);
		return trajectory.getLastState().totalRemoved() / totalPopulation;
	}
	
	/// R_i / N_i at the last time point
	public static double[] attackRates (Trajectory trajectory, double totalPopulation, double[] populationFractions) {
		double[] groupSizes = groupSizes (trajectory, totalPopulation, populationFractions);
		CompartmentState lastState = trajectory.getLastState();
		double[] rates = new double[groupSizes.length];
		for (int i=0; i<rates.length; i++) {
			rates[i] = lastState.getRemoved (i) / groupSizes[i];
		}
		return rates;
	}
	
	/// Rt(t) = dominant eigenvalue of diag(S(t)) beta / (s gamma), for every time point
	public static double[] effectiveReproductionNumbers (Trajectory trajectory, double[][] betaUnscaled, double scalingFactor, double gamma) {
		InvalidParameterException.checkPositive ("Scaling factor", scalingFactor);
		InvalidParameterException.checkPositive ("Recovery rate", gamma);
		if (betaUnscaled == null || betaUnscaled.length != trajectory.getNumGroups()) {
			throw new InvalidParameterException ("Transmission matrix does not match the groups of the trajectory.");
		}
		
		double[] rtSeries = new double[trajectory.size()];
		for (int k=0; k<rtSeries.length; k++) {
			double[][] ngm = ReproductionNumberCalibrator.weightedNextGenerationMatrix (betaUnscaled, scalingFactor, gamma, trajectory.getState(k).susceptible());
			// no susceptibles left gives zero, that's fine here
			rtSeries[k] = DominantEigenvalue.compute (ngm);
		}
		return rtSeries;
	}
	
	/**
	 * Among all time points with Rt <= 1 take the one with the largest Rt, that is, the one where
	 * the epidemic just stopped growing. Earliest one on ties.
	 */
	public static HerdImmunityThreshold herdImmunityThreshold (Trajectory trajectory, double[] rtSeries, double totalPopulation, double[] populationFractions) throws ThresholdNotReachedException {
		if (rtSeries == null || rtSeries.length != trajectory.size()) {
			throw new InvalidParameterException ("Need one reproduction number per time point (" + trajectory.size() + ").");
		}
		double[] groupSizes = groupSizes (trajectory, totalPopulation, populationFractions);
		
		int bestIdx = -1;
		for (int k=0; k<rtSeries.length; k++) {
			if (rtSeries[k] <= 1d && (bestIdx < 0 || rtSeries[k] > rtSeries[bestIdx])) {
				bestIdx = k;
			}
		}
		if (bestIdx < 0) {
			throw new ThresholdNotReachedException ("Effective reproduction number never drops to one up to time " + trajectory.getLastTime() + "; extend the horizon.", trajectory.getLastTime());
		}
		
		CompartmentState state = trajectory.getState (bestIdx);
		double[] perGroup = new double[groupSizes.length];
		for (int i=0; i<perGroup.length; i++) {
			perGroup[i] = 1d - state.getSusceptible (i) / groupSizes[i];
		}
		double overall = 1d - state.totalSusceptible() / totalPopulation;
		
		return new HerdImmunityThreshold (bestIdx, trajectory.getTime (bestIdx), rtSeries[bestIdx], overall, perGroup);
	}
	
	/// time of the largest total number of infectious individuals
	public static double peakTime (Trajectory trajectory) {
		int peakIdx = 0;
		for (int k=1; k<trajectory.size(); k++) {
			if (trajectory.getState(k).totalInfectious() > trajectory.getState(peakIdx).totalInfectious()) {
				peakIdx = k;
			}
		}
		return trajectory.getTime (peakIdx);
	}
	
	private static double[] groupSizes (Trajectory trajectory, double totalPopulation, double[] populationFractions) {
		InvalidParameterException.checkPositive ("Total population", totalPopulation);
		InvalidParameterException.checkLength ("population fractions", populationFractions, trajectory.getNumGroups());
		double[] sizes = new double[populationFractions.length];
		for (int i=0; i<sizes.length; i++) {
			InvalidParameterException.checkPositive ("Population fraction of group " + i, populationFractions[i]);
			sizes[i] = totalPopulation * populationFractions[i];
		}
		return sizes;
	}
}
