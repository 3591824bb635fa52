/**
 **
 ** LeastSquaresParaboloidModel - linear least squares paraboloid panels
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LeastSquaresParaboloidModel.java is free software: you can redistribute it and/or modify
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

/*
 * FULL:      z = a x^2y^2 + b x^2y + c xy^2 + d x^2 + e y^2 + g xy + h x + i y + j
 * COROTATED: z = a u^2 + b v^2 + c, (u, v) measured from the panel center and
 *            rotated by the panel center angle zeta
 */
public class LeastSquaresParaboloidModel implements PanelModel {
	public enum Form {FULL, COROTATED}

	private final Form   form;
	private final double xc;
	private final double yc;
	private final double cos_zeta;
	private final double sin_zeta;

	public LeastSquaresParaboloidModel(
			Form      form,
			double [] center,
			double    zeta) {
		this.form =     form;
		this.xc =       center[0];
		this.yc =       center[1];
		this.cos_zeta = Math.cos(zeta);
		this.sin_zeta = Math.sin(zeta);
	}

	public Form getForm() {
		return form;
	}

	@Override
	public int getNumParameters() {
		return (form == Form.FULL) ? 9 : 3;
	}

	double [] designRow(double x, double y) {
		if (form == Form.FULL) {
			double x2 = x * x;
			double y2 = y * y;
			return new double [] {x2 * y2, x2 * y, y2 * x, x2, y2, x * y, x, y, 1.0};
		}
		double dx = x - xc;
		double dy = y - yc;
		double u =  dx * cos_zeta + dy * sin_zeta;
		double v = -dx * sin_zeta + dy * cos_zeta;
		return new double [] {u * u, v * v, 1.0};
	}

	@Override
	public double [] solve(double [] x, double [] y, double [] values) {
		double [][] design = new double [values.length][];
		for (int i = 0; i < values.length; i++) {
			design[i] = designRow(x[i], y[i]);
		}
		return LeastSquaresFit.solve(design, values).getSolution();
	}

	@Override
	public double correctionAt(double [] parameters, double x, double y) {
		double [] row = designRow(x, y);
		double d = 0.0;
		for (int i = 0; i < row.length; i++) {
			d += row[i] * parameters[i];
		}
		return d;
	}
}
