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

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;
import com.martiansoftware.jsap.Switch;

import edu.berkeley.hetSEIR.demography.PopulationContext;
import edu.berkeley.hetSEIR.demography.SeroObservation;
import edu.berkeley.hetSEIR.epidemic.IntegratorSettings;

/**
 * Command line parameters of a calibration run. A scenario is given directly as numeric vectors
 * (comma separated, one entry per group); reading census or survey tables is left to whoever
 * calls us.
 */
public class SeroParamSet {

	public JSAPResult jsapParams;
	
	/// false if parsing failed or only help was requested (JSAP printed something then)
	public boolean valid;
	
	public double totalPopulation;
	public double[] fractions;
	public int[] tested;
	public double[] seroFractions;
	public double[] initialInfected;
	public double latentRate;
	public double recoveryRate;
	public double epsilon;
	public double surveyTime;
	public ParameterizationMode mode;
	public double r0Target;
	public double[][] bounds;
	public double[] startPoint;
	public double samplingStep;
	public double maxTime;
	public OptimizerSettings optimizerSettings;
	public IntegratorSettings integratorSettings;
	
	public static Parameter[] getParameters () {
		return new Parameter[] {
				new FlaggedOption ("totalPopulation", JSAP.DOUBLE_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, JSAP.NO_SHORTFLAG, "totalPopulation", "Total population size N."),
				new FlaggedOption ("fractions", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, JSAP.NO_SHORTFLAG, "fractions", "Comma separated population fractions of the groups (have to sum to one)."),
				new FlaggedOption ("tested", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, JSAP.NO_SHORTFLAG, "tested", "Comma separated serosurvey sample sizes."),
				new FlaggedOption ("seroFractions", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, JSAP.NO_SHORTFLAG, "seroFractions", "Comma separated fractions that tested seropositive."),
				new FlaggedOption ("surveyTime", JSAP.DOUBLE_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, JSAP.NO_SHORTFLAG, "surveyTime", "Time of the serosurvey, in days since the start of the outbreak."),
				new FlaggedOption ("initialInfected", JSAP.STRING_PARSER, "10", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "initialInfected", "Initially infectious individuals: one number (spread over the groups by population fraction), or one per group."),
				new FlaggedOption ("latentPeriod", JSAP.DOUBLE_PARSER, "3", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "latentPeriod", "Mean latent period in days (r = 1/latentPeriod)."),
				new FlaggedOption ("infectiousPeriod", JSAP.DOUBLE_PARSER, "4", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "infectiousPeriod", "Mean infectious period in days (gamma = 1/infectiousPeriod)."),
				new FlaggedOption ("epsilon", JSAP.DOUBLE_PARSER, "0", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "epsilon", "Assortativity of the mixing, in [0,1]."),
				new FlaggedOption ("mode", JSAP.STRING_PARSER, "activity", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "mode", "What the fitted parameters multiply: activity or susceptibility."),
				new FlaggedOption ("r0", JSAP.DOUBLE_PARSER, "3", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "r0", "Basic reproduction number for the forward run with the fitted parameters."),
				new FlaggedOption ("bounds", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "bounds", "Bounds for the parameters: one pair 'lo,hi' for all groups, or one pair per group separated by semi-colons."),
				new FlaggedOption ("startPoint", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "startPoint", "Comma separated starting point of the optimization (default all ones)."),
				new FlaggedOption ("samplingStep", JSAP.DOUBLE_PARSER, "0.1", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "samplingStep", "Spacing of the time grid for the forward run."),
				new FlaggedOption ("maxTime", JSAP.DOUBLE_PARSER, "2000", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "maxTime", "Give up the forward run if no equilibrium is reached by this time."),
				new FlaggedOption ("maxIterations", JSAP.INTEGER_PARSER, Integer.toString (OptimizerSettings.MAX_ITERATIONS), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "maxIterations", "Maximal number of Nelder-Mead iterations."),
				new FlaggedOption ("maxEvaluations", JSAP.INTEGER_PARSER, Integer.toString (OptimizerSettings.MAX_EVALUATIONS), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "maxEvaluations", "Maximal number of likelihood evaluations."),
				new FlaggedOption ("absTolerance", JSAP.DOUBLE_PARSER, Double.toString (IntegratorSettings.ABS_TOLERANCE), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "absTolerance", "Absolute tolerance of the ODE solver."),
				new FlaggedOption ("relTolerance", JSAP.DOUBLE_PARSER, Double.toString (IntegratorSettings.REL_TOLERANCE), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "relTolerance", "Relative tolerance of the ODE solver."),
				new Switch ("verbose", JSAP.NO_SHORTFLAG, "verbose", "Print the progress of the optimization.")
		};
	}
	
	public SeroParamSet (String[] args) throws JSAPException, IOException {
		
		List<Parameter> paramList = new ArrayList<Parameter>(Arrays.asList (getParameters()));
		paramList.sort (Comparator.comparing (Parameter::getID));
		SimpleJSAP jsap = new SimpleJSAP (
				"SeroEstimation",
				"Fits group activities of a stratified SEIR model to serosurvey data",
				paramList.toArray (new Parameter[0])
				);
		
		this.jsapParams = jsap.parse (args);
		if (jsap.messagePrinted() || !this.jsapParams.success()) {
			this.valid = false;
			return;
		}
		
		this.totalPopulation = this.jsapParams.getDouble ("totalPopulation");
		this.fractions = parseDoubles (this.jsapParams.getString ("fractions"), "fractions");
		int numGroups = this.fractions.length;
		
		double[] testedDoubles = parseDoubles (this.jsapParams.getString ("tested"), "tested");
		if (testedDoubles.length != numGroups) throw new IOException ("Need one sample size per group (" + numGroups + "), got " + testedDoubles.length + ".");
		this.tested = new int[numGroups];
		for (int i=0; i<numGroups; i++) {
			if (testedDoubles[i] != Math.rint (testedDoubles[i])) throw new IOException ("Sample sizes have to be integers.");
			this.tested[i] = (int) testedDoubles[i];
		}
		
		this.seroFractions = parseDoubles (this.jsapParams.getString ("seroFractions"), "seroFractions");
		if (this.seroFractions.length != numGroups) throw new IOException ("Need one seropositive fraction per group (" + numGroups + "), got " + this.seroFractions.length + ".");
		
		// one total, or one per group
		double[] infected = parseDoubles (this.jsapParams.getString ("initialInfected"), "initialInfected");
		if (infected.length == 1) {
			this.initialInfected = new double[numGroups];
			for (int i=0; i<numGroups; i++) this.initialInfected[i] = infected[0] * this.fractions[i];
		}
		else if (infected.length == numGroups) {
			this.initialInfected = infected;
		}
		else {
			throw new IOException ("initialInfected has to be one number or one per group.");
		}
		
		double latentPeriod = this.jsapParams.getDouble ("latentPeriod");
		double infectiousPeriod = this.jsapParams.getDouble ("infectiousPeriod");
		if (latentPeriod <= 0d || infectiousPeriod <= 0d) throw new IOException ("Latent and infectious period have to be positive.");
		this.latentRate = 1d / latentPeriod;
		this.recoveryRate = 1d / infectiousPeriod;
		
		this.epsilon = this.jsapParams.getDouble ("epsilon");
		if (this.epsilon < 0d || this.epsilon > 1d) throw new IOException ("epsilon has to be in [0,1].");
		this.surveyTime = this.jsapParams.getDouble ("surveyTime");
		if (this.surveyTime <= 0d) throw new IOException ("surveyTime has to be positive.");
		this.mode = ParameterizationMode.fromString (this.jsapParams.getString ("mode"));
		this.r0Target = this.jsapParams.getDouble ("r0");
		if (this.r0Target <= 0d) throw new IOException ("r0 has to be positive.");
		
		// see whether we have bounds
		this.bounds = null;
		if (this.jsapParams.contains ("bounds")) {
			// pairs are separated by semi-colons
			String[] boundPairs = this.jsapParams.getString ("bounds").split (";");
			if (boundPairs.length != 1 && boundPairs.length != numGroups) throw new IOException ("Give one pair of bounds, or one per group.");
			this.bounds = new double[numGroups][2];
			for (int i=0; i<numGroups; i++) {
				double[] thisPair = parseDoubles (boundPairs[boundPairs.length == 1 ? 0 : i], "bounds");
				if (thisPair.length != 2) throw new IOException ("Each pair in bounds has to be two doubles separated by a comma");
				this.bounds[i] = thisPair;
			}
		}
		
		this.startPoint = null;
		if (this.jsapParams.contains ("startPoint")) {
			this.startPoint = parseDoubles (this.jsapParams.getString ("startPoint"), "startPoint");
			if (this.startPoint.length != numGroups) throw new IOException ("Dimension of starting point does not match number of groups.");
		}
		
		this.samplingStep = this.jsapParams.getDouble ("samplingStep");
		this.maxTime = this.jsapParams.getDouble ("maxTime");
		if (this.samplingStep <= 0d || this.maxTime <= this.samplingStep) throw new IOException ("Need 0 < samplingStep < maxTime.");
		
		boolean verbose = this.jsapParams.getBoolean ("verbose");
		this.optimizerSettings = OptimizerSettings.DEFAULT.withLimits (this.jsapParams.getInt ("maxIterations"), this.jsapParams.getInt ("maxEvaluations")).withVerbose (verbose);
		this.integratorSettings = IntegratorSettings.DEFAULT.withTolerances (this.jsapParams.getDouble ("absTolerance"), this.jsapParams.getDouble ("relTolerance"));
		
		this.valid = true;
	}
	
	public PopulationContext getPopulationContext () {
		// activities are what we fit, start them at one
		double[] ones = new double[this.fractions.length];
		Arrays.fill (ones, 1d);
		return PopulationContext.fromVectors (this.totalPopulation, this.fractions, ones, this.initialInfected);
	}
	
	public SeroObservation getObservation () {
		return new SeroObservation (this.tested, this.seroFractions);
	}
	
	public void print (PrintStream outStream) {
		outStream.println ("# Parameter values:");
		outStream.println ("# totalPopulation = " + this.totalPopulation);
		outStream.println ("# fractions = " + Arrays.toString (this.fractions));
		outStream.println ("# tested = " + Arrays.toString (this.tested));
		outStream.println ("# seroFractions = " + Arrays.toString (this.seroFractions));
		outStream.println ("# initialInfected = " + Arrays.toString (this.initialInfected));
		outStream.println ("# r = " + this.latentRate + ", gamma = " + this.recoveryRate + ", epsilon = " + this.epsilon);
		outStream.println ("# surveyTime = " + this.surveyTime + ", mode = " + this.mode.label + ", r0 = " + this.r0Target);
		outStream.println ("# integrator: " + this.integratorSettings);
	}
	
	static double[] parseDoubles (String valueString, String name) throws IOException {
		String[] fields = valueString.trim().split ("\\s*,\\s*");
		double[] values = new double[fields.length];
		for (int i=0; i<fields.length; i++) {
			try {
				values[i] = Double.parseDouble (fields[i]);
			}
			catch (NumberFormatException e) {
				throw new IOException ("Could not read entry '" + fields[i] + "' of " + name + ".", e);
			}
		}
		return values;
	}
}
