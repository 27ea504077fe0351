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

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.distribution.BinomialDistribution;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;
import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.demography.SeroObservation;
import edu.berkeley.hetSEIR.epidemic.CompartmentState;
import edu.berkeley.hetSEIR.epidemic.CompartmentalIntegrator;
import edu.berkeley.hetSEIR.epidemic.TrajectoryFailureException;
import edu.berkeley.hetSEIR.epidemic.auxiliary.DegenerateSpectrumException;

/**
 * Negative binomial log-likelihood of the serosurvey, as a function of the log of the per-group
 * parameters. The predicted seroprevalence of group i is R_i(surveyTime) / N_i.
 * <p>
 * Points outside the bounds, and points where the model breaks down (degenerate spectrum,
 * diverging or unphysical trajectory), get {@link #PENALTY}, so one bad trial point doesn't
 * stop the search. Nothing is remembered between calls, except the evaluation counter.
 */
public class SeroObjectiveFunction implements MultivariateFunction {
	
	/// big, but finite, so that the simplex arithmetic stays sane
	public static final double PENALTY = 1e100;
	
	/// predicted probabilities are kept this far from 0 and 1
	public static final double PROBABILITY_EPSILON = 1e-12;
	
	private final PopulationContext context;
	private final SeroObservation observation;
	private final TransmissionModel model;
	private final CompartmentalIntegrator integrator;
	private final double latentRate;
	private final double recoveryRate;
	private final double epsilon;
	private final double surveyTime;
	private final double[][] logBounds;
	private final CompartmentState initialState;
	private final double[] groupSizes;
	private final int[] positives;
	
	private int evaluations = 0;
	
	public SeroObjectiveFunction (PopulationContext context, SeroObservation observation, TransmissionModel model, CompartmentalIntegrator integrator, double latentRate, double recoveryRate, double epsilon, double surveyTime, double[][] bounds) {
		int numGroups = context.getNumGroups();
		if (observation.getNumGroups() != numGroups) {
			throw new InvalidParameterException ("Observation has " + observation.getNumGroups() + " groups, population has " + numGroups + ".");
		}
		if (bounds == null || bounds.length != numGroups) {
			throw new InvalidParameterException ("Need bounds for each of the " + numGroups + " groups.");
		}
		for (int i=0; i<numGroups; i++) {
			if (bounds[i] == null || bounds[i].length != 2 || !(0d < bounds[i][0]) || !(bounds[i][0] < bounds[i][1]) || Double.isInfinite (bounds[i][1])) {
				throw new InvalidParameterException ("Bounds of group " + i + " have to be a finite pair 0 < lower < upper.");
			}
		}
		this.context = context;
		this.observation = observation;
		this.model = model;
		this.integrator = integrator;
		this.latentRate = latentRate;
		this.recoveryRate = recoveryRate;
		this.epsilon = epsilon;
		this.surveyTime = surveyTime;
		this.logBounds = new double[bounds.length][2];
		for (int i=0; i<bounds.length; i++) {
			this.logBounds[i][0] = Math.log (bounds[i][0]);
			this.logBounds[i][1] = Math.log (bounds[i][1]);
		}
		this.initialState = CompartmentState.initialState (context);
		this.groupSizes = context.groupSizes();
		this.positives = observation.positives();
	}

	@Override
	public double value (double[] logPoint) {
		this.evaluations++;
		
		// out of bounds?
		double[] point = new double[logPoint.length];
		for (int i=0; i<logPoint.length; i++) {
			if (Double.isNaN (logPoint[i]) || (logPoint[i] < this.logBounds[i][0]) || (this.logBounds[i][1] < logPoint[i])) {
				return PENALTY;
			}
			point[i] = Math.exp (logPoint[i]);
		}
		
		try {
			return negLogLikelihood (predictedSeroprevalence (point));
		}
		catch (DegenerateSpectrumException e) {
			return PENALTY;
		}
		catch (TrajectoryFailureException e) {
			return PENALTY;
		}
	}
	
	/// R_i(surveyTime) / N_i under the given (not log) parameters
	public double[] predictedSeroprevalence (double[] point) {
		// the scaling factor is one here, the parameter scale takes the role of R0
		double[][] beta = this.model.transmissionMatrix (point, this.context, this.epsilon);
		CompartmentState atSurvey = this.integrator.integrate (this.initialState, this.latentRate, this.recoveryRate, beta, new double[] {0d, this.surveyTime}).getLastState();
		double[] prevalence = new double[point.length];
		for (int i=0; i<prevalence.length; i++) {
			prevalence[i] = atSurvey.getRemoved (i) / this.groupSizes[i];
		}
		return prevalence;
	}
	
	/// - sum_i log Binom (positive_i; tested_i, p_i)
	public double negLogLikelihood (double[] prevalence) {
		double logLikelihood = 0d;
		for (int i=0; i<prevalence.length; i++) {
			double p = Math.min (Math.max (prevalence[i], PROBABILITY_EPSILON), 1d - PROBABILITY_EPSILON);
			BinomialDistribution binomial = new BinomialDistribution (null, this.observation.getTested (i), p);
			logLikelihood += binomial.logProbability (this.positives[i]);
		}
		return - logLikelihood;
	}
	
	/// compartment values the integrator clamped to zero, over all evaluations
	public int getNumClamped () {
		return this.integrator.getNumClamped();
	}
	
	public int getEvaluations () {
		return this.evaluations;
	}
}
