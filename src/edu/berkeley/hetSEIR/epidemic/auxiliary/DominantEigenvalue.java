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

package edu.berkeley.hetSEIR.epidemic.auxiliary;

import org.netlib.lapack.Dgeev;
import org.netlib.util.intW;

import edu.berkeley.hetSEIR.demography.InvalidParameterException;

/**
 * Dominant eigenvalue of a general (not necessarily symmetric) real matrix, via LAPACK DGEEV.
 * <p>
 * The matrices we feed in are next-generation matrices, so entrywise nonnegative, and by
 * Perron-Frobenius their spectral radius is itself a real nonnegative eigenvalue. We do not
 * trust the order LAPACK returns the eigenvalues in, but pick the one with the largest modulus
 * (larger real part on ties) and check that it really is real.
 */
public class DominantEigenvalue {

	/// relative size of an imaginary part that we still consider roundoff
	public static final double IMAGINARY_EPSILON = 1e-8;
	
	/// moduli closer than this (relative) count as a tie
	public static final double TIE_EPSILON = 1e-12;
	
	/// the eigenvalue of largest modulus; has to be real, but may be zero or negative
	public static double compute (double[][] origMatrix) {
		
		int matDim = origMatrix.length;
		if (matDim == 0) {
			throw new DegenerateSpectrumException ("Empty matrix has no eigenvalues.");
		}
		
		// LAPACK wants it flat and column-major, and overwrites it, so copy (and check on the way)
		double[] matrix = new double[matDim*matDim];
		for (int i=0; i<matDim; i++) {
			if (origMatrix[i] == null || origMatrix[i].length != matDim) {
				throw new InvalidParameterException ("Matrix is not square (row " + i + ").");
			}
			for (int j=0; j<matDim; j++) {
				if (Double.isNaN (origMatrix[i][j]) || Double.isInfinite (origMatrix[i][j])) {
					throw new DegenerateSpectrumException ("Non-finite entry " + origMatrix[i][j] + " at (" + i + "," + j + ").");
				}
				matrix[j*matDim + i] = origMatrix[i][j];
			}
		}
		
		// the sandboxes for the eigenstuff
		double[] realValues = new double[matDim];
		double[] imaginaryValues = new double[matDim];
		// no vectors wanted, so leading dimension one is enough
		double[] leftVectors = new double[1];
		double[] rightVectors = new double[1];
		double[] sandBox = new double[5*matDim];
		intW returnInt = new intW(0);
		Dgeev.dgeev ("N", "N", matDim, matrix, 0, matDim, realValues, 0, imaginaryValues, 0, leftVectors, 0, 1, rightVectors, 0, 1, sandBox, 0, sandBox.length, returnInt);
		
		if (returnInt.val != 0) {
			throw new DegenerateSpectrumException ("DGEEV failed with info = " + returnInt.val + ".");
		}
		
		// find the dominant one
		int bestIdx = 0;
		double bestModulus = Math.hypot (realValues[0], imaginaryValues[0]);
		for (int k=1; k<matDim; k++) {
			double modulus = Math.hypot (realValues[k], imaginaryValues[k]);
			double tieWindow = TIE_EPSILON * Math.max (1d, bestModulus);
			if ((modulus > bestModulus + tieWindow) || ((Math.abs (modulus - bestModulus) <= tieWindow) && (realValues[k] > realValues[bestIdx]))) {
				bestIdx = k;
				bestModulus = modulus;
			}
		}
		
		// should be real
		if (Math.abs (imaginaryValues[bestIdx]) > IMAGINARY_EPSILON * Math.max (1d, bestModulus)) {
			throw new DegenerateSpectrumException ("Dominant eigenvalue " + realValues[bestIdx] + " + i* " + imaginaryValues[bestIdx] + " is not real.");
		}
		
		return realValues[bestIdx];
	}
	
	/// the dominant eigenvalue, additionally required to be strictly positive
	public static double computePositive (double[][] matrix) {
		double lambda = compute (matrix);
		if (!(lambda > 0d)) {
			throw new DegenerateSpectrumException ("Dominant eigenvalue " + lambda + " is not positive.");
		}
		return lambda;
	}
}
