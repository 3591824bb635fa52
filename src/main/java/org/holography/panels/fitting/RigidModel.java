/**
 **
 ** RigidModel - tilted plane panel fitted through 3x3 normal equations
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RigidModel.java is free software: you can redistribute it and/or modify
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

import Jama.LUDecomposition;
import Jama.Matrix;

/*
 * z = a * x + b * y + c
 * Samples with zero deviation are blanked pixels and are ignored.
 */
public class RigidModel implements PanelModel {
	static final double PIVOT_TOLERANCE = 1e-14; // relative to the largest element of the normal matrix

	@Override
	public int getNumParameters() {
		return 3;
	}

	@Override
	public double [] solve(double [] x, double [] y, double [] values) {
		double [][] system = new double [3][3];
		double []   vector = new double [3];
		for (int i = 0; i < values.length; i++) {
			if (values[i] != 0.0) {
				system[0][0] += x[i] * x[i];
				system[0][1] += x[i] * y[i];
				system[0][2] += x[i];
				system[1][1] += y[i] * y[i];
				system[1][2] += y[i];
				system[2][2] += 1.0;
				vector[0] += values[i] * x[i];
				vector[1] += values[i] * y[i];
				vector[2] += values[i];
			}
		}
		system[1][0] = system[0][1];
		system[2][0] = system[0][2];
		system[2][1] = system[1][2];
		return solveNormal(system, vector);
	}

	/**
	 * Solve the normal equations through LU decomposition with partial pivoting
	 * @param system square matrix, not modified
	 * @param vector right-hand side
	 * @return solution
	 * @throws SingularMatrixException if the matrix is singular or nearly so
	 */
	static double [] solveNormal(
			double [][] system,
			double []   vector) {
		int n = vector.length;
		if (system.length != n) {
			throw new IllegalArgumentException("System has "+system.length+" rows, vector has "+n+" elements");
		}
		double scale = 0.0;
		for (int i = 0; i < n; i++) {
			if (system[i].length != n) {
				throw new IllegalArgumentException("System matrix is not square");
			}
			for (int j = 0; j < n; j++) {
				scale = Math.max(scale, Math.abs(system[i][j]));
			}
		}
		if (!(scale > 0.0)) { // also catches NaN
			throw new SingularMatrixException("Singular matrix (all zero or NaN)");
		}
		Matrix m = new Matrix(system); // copies
		LUDecomposition lu = new LUDecomposition(m);
		if (!lu.isNonsingular()) {
			throw new SingularMatrixException("Singular matrix "+n+"x"+n);
		}
		double [][] u = lu.getU().getArray();
		for (int i = 0; i < n; i++) {
			if (!(Math.abs(u[i][i]) > scale * PIVOT_TOLERANCE)) {
				throw new SingularMatrixException("Singular matrix at column "+i);
			}
		}
		return m.solve(new Matrix(vector, n)).getColumnPackedCopy();
	}

	@Override
	public double correctionAt(double [] parameters, double x, double y) {
		return x * parameters[0] + y * parameters[1] + parameters[2];
	}
}
