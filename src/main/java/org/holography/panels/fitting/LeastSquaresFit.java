/**
 **
 ** LeastSquaresFit - linear least squares through the SVD of the design matrix
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LeastSquaresFit.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package org.holography.panels.fitting;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

public class LeastSquaresFit {
	private final double [] solution;
	private final double [] singular_values;
	private final int       rank;
	private final double    residual_sum; // sum of squared residuals

	private LeastSquaresFit(double [] solution, double [] singular_values, int rank, double residual_sum) {
		this.solution =        solution;
		this.singular_values = singular_values;
		this.rank =            rank;
		this.residual_sum =    residual_sum;
	}

	/**
	 * Minimum-norm least squares solution of design * x = values. Singular values
	 * below eps * max(rows, cols) * s_max are discarded, so rank deficient systems
	 * still produce a solution.
	 * @param design design matrix [rows][cols], rows >= cols
	 * @param values measured values [rows]
	 * @return fit result
	 */
	public static LeastSquaresFit solve(
			double [][] design,
			double []   values) {
		int rows = design.length;
		if (rows != values.length) {
			throw new IllegalArgumentException("Design matrix has "+rows+" rows, got "+values.length+" values");
		}
		if (rows == 0) {
			throw new IllegalArgumentException("Empty design matrix");
		}
		int cols = design[0].length;
		if (rows < cols) {
			throw new IllegalArgumentException("Under-determined system: "+rows+" equations for "+cols+" unknowns");
		}
		for (int i = 0; i < rows; i++) { // Jama SVD does not terminate on NaN input
			if (!Double.isFinite(values[i])) {
				throw new SingularMatrixException("Non-finite value at row "+i);
			}
			for (int j = 0; j < cols; j++) {
				if (!Double.isFinite(design[i][j])) {
					throw new SingularMatrixException("Non-finite design matrix element at ("+i+","+j+")");
				}
			}
		}
		Matrix a = new Matrix(design);
		Matrix b = new Matrix(values, rows);
		SingularValueDecomposition svd = a.svd();
		double [] s = svd.getSingularValues();
		Matrix u = svd.getU(); // rows x cols
		Matrix v = svd.getV(); // cols x cols
		double rcond = Math.ulp(1.0) * Math.max(rows, cols);
		double threshold = rcond * s[0];
		Matrix utb = u.transpose().times(b);
		double [] w = new double [cols];
		int rank = 0;
		for (int i = 0; i < cols; i++) {
			if (s[i] > threshold) {
				w[i] = utb.get(i, 0) / s[i];
				rank++;
			}
		}
		double [] x = v.times(new Matrix(w, cols)).getColumnPackedCopy();
		for (double d : x) {
			if (Double.isNaN(d)) {
				throw new SingularMatrixException("Least squares solution contains NaN");
			}
		}
		Matrix residual = a.times(new Matrix(x, cols)).minus(b);
		double rsum = 0.0;
		for (int i = 0; i < rows; i++) {
			double d = residual.get(i, 0);
			rsum += d * d;
		}
		return new LeastSquaresFit(x, s, rank, rsum);
	}

	public double [] getSolution()       { return solution; }
	public double [] getSingularValues() { return singular_values; }
	public int getRank()                 { return rank; }
	public double getResidualSum()       { return residual_sum; }
}
