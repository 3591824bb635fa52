/**
 **
 ** ParaboloidModel - paraboloid panels fitted with the bounded LMA
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParaboloidModel.java is free software: you can redistribute it and/or modify
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
 * z = a * u^2 + b * v^2 + c, u and v measured from the panel center.
 * AXES:      u = x - xc, v = y - yc, parameters {a, b, c}
 * ROTATED:   (u, v) rotated by theta, parameters {a, b, c, theta}, theta in [0, pi]
 * COROTATED: (u, v) rotated by the panel center angle zeta, parameters {a, b, c}
 * Curvatures a and b are kept non-negative. The rotated form is degenerate
 * (a <-> b with theta + pi/2), only the surface is meaningful.
 */
public class ParaboloidModel implements PanelModel {
	public enum Orientation {AXES, ROTATED, COROTATED}

	static final double INITIAL_CURVATURE = 100.0;

	private final Orientation        orientation;
	private final double             xc;
	private final double             yc;
	private final double             zeta;
	private final PanelLmaParameters plp;

	public ParaboloidModel(
			Orientation        orientation,
			double []          center,
			double             zeta,
			PanelLmaParameters plp) {
		this.orientation = orientation;
		this.xc =          center[0];
		this.yc =          center[1];
		this.zeta =        zeta;
		this.plp =         plp;
	}

	public Orientation getOrientation() {
		return orientation;
	}

	@Override
	public int getNumParameters() {
		return (orientation == Orientation.ROTATED) ? 4 : 3;
	}

	double getAngle(double [] vector) {
		switch (orientation) {
		case ROTATED:   return vector[3];
		case COROTATED: return zeta;
		default:        return 0.0;
		}
	}

	double value(double [] vector, double x, double y, double [] derivs) {
		double dx = x - xc;
		double dy = y - yc;
		double u, v;
		if (orientation == Orientation.AXES) {
			u = dx;
			v = dy;
		} else {
			double angle = getAngle(vector);
			double cos = Math.cos(angle);
			double sin = Math.sin(angle);
			u =  dx * cos + dy * sin;
			v = -dx * sin + dy * cos;
		}
		double u2 = u * u;
		double v2 = v * v;
		if (derivs != null) {
			derivs[0] = u2;
			derivs[1] = v2;
			derivs[2] = 1.0;
			if (orientation == Orientation.ROTATED) { // du/dtheta = v, dv/dtheta = -u
				derivs[3] = 2.0 * u * v * (vector[0] - vector[1]);
			}
		}
		return vector[0] * u2 + vector[1] * v2 + vector[2];
	}

	@Override
	public double [] solve(double [] x, double [] y, double [] values) {
		int num_pars = getNumParameters();
		double [] lower =   new double [num_pars];
		double [] upper =   new double [num_pars];
		double [] initial = new double [num_pars];
		double mean = 0.0;
		for (double d : values) mean += d;
		mean = (values.length > 0) ? (mean / values.length) : 0.0;

		lower[0] = 0.0; upper[0] = Double.POSITIVE_INFINITY; initial[0] = INITIAL_CURVATURE;
		lower[1] = 0.0; upper[1] = Double.POSITIVE_INFINITY; initial[1] = INITIAL_CURVATURE;
		lower[2] = Double.NEGATIVE_INFINITY; upper[2] = Double.POSITIVE_INFINITY; initial[2] = mean;
		if (orientation == Orientation.ROTATED) {
			lower[3] = 0.0; upper[3] = Math.PI; initial[3] = 0.0;
		}
		BoundedLMA lma = new BoundedLMA(
				this::value, // SurfaceFunction function,
				x,           // double []       x,
				y,           // double []       y,
				values,      // double []       values,
				lower,       // double []       lower,
				upper);      // double []       upper)
		return lma.fitWithRetries(initial, plp);
	}

	@Override
	public double correctionAt(double [] parameters, double x, double y) {
		return value(parameters, x, y, null);
	}
}
