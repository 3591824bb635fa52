/**
 **
 ** BoundedLMA - Levenberg-Marquardt fitting of a surface z(x,y) with box-bounded parameters
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BoundedLMA.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import Jama.Matrix;

/*
 * Fits z = f(vector, x, y) to the samples minimizing the unweighted RMS.
 * Each parameter is kept inside [lower, upper]; a parameter sitting on its
 * bound while the gradient pulls it outside is frozen for that step, the
 * remaining step is clipped to the box.
 * Damping is the Marquardt one, JtJ + lambda * diag(JtJ), with the diagonal
 * floored so that parameters the data does not (yet) constrain stay put.
 */
public class BoundedLMA {
	private static final Logger LOGGER = LoggerFactory.getLogger(BoundedLMA.class);

	static final double DIAG_FLOOR = 1.0E-12; // relative to the largest diagonal element of JtJ

	public interface SurfaceFunction {
		/**
		 * @param vector parameters
		 * @param x sample X coordinate
		 * @param y sample Y coordinate
		 * @param derivs null or array [vector.length] to receive the partial derivatives
		 * @return function value
		 */
		double value(double [] vector, double x, double y, double [] derivs);
	}

	private final SurfaceFunction function;
	private final double []       x;
	private final double []       y;
	private final double []       values;
	private final double []       lower;
	private final double []       upper;

	private double []   vector;
	private double [][] last_jt =     null;
	private double []   last_ymfx =   null;
	private double      last_rms =    Double.NaN;
	private double      initial_rms = Double.NaN;
	private boolean     singular =    false;
	private int         num_steps =   0;

	public BoundedLMA(
			SurfaceFunction function,
			double []       x,
			double []       y,
			double []       values,
			double []       lower,
			double []       upper) {
		if ((x.length != values.length) || (y.length != values.length)) {
			throw new IllegalArgumentException("Sample coordinates and values have different lengths");
		}
		if (lower.length != upper.length) {
			throw new IllegalArgumentException("Lower and upper bounds have different lengths");
		}
		for (int i = 0; i < lower.length; i++) {
			if (lower[i] > upper[i]) {
				throw new IllegalArgumentException("Lower bound "+lower[i]+" exceeds upper bound "+upper[i]+" for parameter "+i);
			}
		}
		this.function = function;
		this.x =        x;
		this.y =        y;
		this.values =   values;
		this.lower =    lower;
		this.upper =    upper;
	}

	public void setVector(double [] initial) {
		if (initial.length != lower.length) {
			throw new IllegalArgumentException("Expected "+lower.length+" parameters, got "+initial.length);
		}
		this.vector =      clip(initial.clone());
		this.last_jt =     null;
		this.last_ymfx =   null;
		this.last_rms =    Double.NaN;
		this.initial_rms = Double.NaN;
		this.singular =    false;
	}

	public double [] getVector()    { return vector.clone(); }
	public double getRms()          { return last_rms; }
	public double getInitialRms()   { return initial_rms; }
	public int getNumSteps()        { return num_steps; }

	private double [] clip(double [] v) {
		for (int i = 0; i < v.length; i++) {
			if      (v[i] < lower[i]) v[i] = lower[i];
			else if (v[i] > upper[i]) v[i] = upper[i];
		}
		return v;
	}

	/**
	 * @param vector parameters
	 * @param jt null or [vector.length][values.length] to be filled with the transposed Jacobian
	 * @return function values at the samples
	 */
	double [] getFxAndJacobian(
			double []   vector,
			double [][] jt) {
		int num_points = values.length;
		double [] fx = new double [num_points];
		double [] derivs = (jt != null) ? new double [vector.length] : null;
		for (int i = 0; i < num_points; i++) {
			fx[i] = function.value(vector, x[i], y[i], derivs);
			if (jt != null) {
				for (int np = 0; np < vector.length; np++) {
					jt[np][i] = derivs[np];
				}
			}
		}
		return fx;
	}

	double getYMinusFx(
			double [] fx,
			double [] ymfx) {
		double swd2 = 0.0;
		for (int i = 0; i < fx.length; i++) {
			double d = values[i] - fx[i];
			ymfx[i] = d;
			swd2 += d * d;
		}
		return Math.sqrt(swd2 / fx.length);
	}

	double [][] getJtJlambda(
			double      lambda,
			double [][] jt,
			boolean []  fixed) {
		int num_pars = jt.length;
		int num_points = jt[0].length;
		double [][] jtjl = new double [num_pars][num_pars];
		double max_diag = 0.0;
		for (int i = 0; i < num_pars; i++) if (!fixed[i]) {
			for (int j = i; j < num_pars; j++) if (!fixed[j]) {
				double d = 0.0;
				for (int k = 0; k < num_points; k++) {
					d += jt[i][k] * jt[j][k];
				}
				jtjl[i][j] = d;
				jtjl[j][i] = d;
			}
			max_diag = Math.max(max_diag, jtjl[i][i]);
		}
		double floor = (max_diag > 0.0) ? (max_diag * DIAG_FLOOR) : 1.0;
		for (int i = 0; i < num_pars; i++) {
			if (fixed[i]) {
				jtjl[i][i] = 1.0;
			} else {
				jtjl[i][i] += lambda * Math.max(jtjl[i][i], floor);
			}
		}
		return jtjl;
	}

	double [] getJtYmfx(
			double []   ymfx,
			double [][] jt) {
		int num_pars = jt.length;
		double [] jtymfx = new double [num_pars];
		for (int i = 0; i < num_pars; i++) {
			double d = 0;
			for (int j = 0; j < ymfx.length; j++) d += ymfx[j] * jt[i][j];
			jtymfx[i] = d;
		}
		return jtymfx;
	}

	/**
	 * One damped Gauss-Newton step
	 * @param lambda damping
	 * @param rms_diff relative RMS improvement below which the fit is considered done
	 * @param debug_level debug level
	 * @return {improved, done}
	 */
	public boolean [] lmaStep(
			double lambda,
			double rms_diff,
			int    debug_level) {
		int num_pars = vector.length;
		int num_points = values.length;
		boolean [] rslt = {false,false};
		if (Double.isNaN(this.last_rms)) { //first time, need to calculate all (vector is valid)
			this.last_jt = new double [num_pars][num_points];
			double [] fx = getFxAndJacobian(
					this.vector,   // double []   vector,
					this.last_jt); // double [][] jt)
			this.last_ymfx = new double [num_points];
			this.last_rms = getYMinusFx(fx, this.last_ymfx);
			this.initial_rms = this.last_rms;
		}
		if (this.last_rms == 0.0) { // exact fit, nothing to improve
			rslt[1] = true;
			return rslt;
		}
		double [] jty = getJtYmfx(this.last_ymfx, this.last_jt);
		boolean [] fixed = new boolean [num_pars];
		for (int i = 0; i < num_pars; i++) {
			fixed[i] = ((vector[i] <= lower[i]) && (jty[i] < 0.0)) || ((vector[i] >= upper[i]) && (jty[i] > 0.0));
			if (fixed[i]) {
				jty[i] = 0.0;
			}
		}
		Matrix wjtjlambda = new Matrix(getJtJlambda(
				lambda,       // double      lambda,
				this.last_jt, // double [][] jt
				fixed));      // boolean []  fixed
		double [] delta;
		try {
			delta = wjtjlambda.solve(new Matrix(jty, num_pars)).getColumnPackedCopy();
		} catch (RuntimeException e) {
			this.singular = true;
			rslt[1] = true;
			if (debug_level > 0) {
				LOGGER.debug("Singular matrix: "+e.getMessage());
			}
			return rslt;
		}
		double [] new_vector = this.vector.clone();
		for (int i = 0; i < num_pars; i++) if (!fixed[i]) new_vector[i] += delta[i];
		clip(new_vector);

		double [][] new_jt = new double [num_pars][num_points];
		double [] fx = getFxAndJacobian(
				new_vector, // double []   vector,
				new_jt);    // double [][] jt)
		double [] new_ymfx = new double [num_points];
		double rms = getYMinusFx(fx, new_ymfx);
		if (rms < this.last_rms) { // improved
			rslt[0] = true;
			rslt[1] = rms >= (this.last_rms * (1.0 - rms_diff));
			this.last_rms =  rms;
			this.last_jt =   new_jt;
			this.last_ymfx = new_ymfx;
			this.vector =    new_vector;
		} else { // worsened (or NaN), keep the old state
			rslt[0] = false;
			rslt[1] = false; // caller will decide
		}
		return rslt;
	}

	/**
	 * Run LMA from the current vector
	 * @param lambda initial damping, 0.1
	 * @param lambda_scale_good damping multiplier after an improving step, 0.5
	 * @param lambda_scale_bad damping multiplier after a failed step, 8.0
	 * @param lambda_max give up improving when damping exceeds this
	 * @param rms_diff relative RMS improvement to stop at
	 * @param num_iter maximal number of steps
	 * @param debug_level debug level
	 * @return true if converged within num_iter steps
	 */
	public boolean runLma(
			double lambda,
			double lambda_scale_good,
			double lambda_scale_bad,
			double lambda_max,
			double rms_diff,
			int    num_iter,
			int    debug_level)
	{
		boolean [] rslt = {false,false};
		boolean converged = false;
		int iter = 0;
		for (iter = 0; iter < num_iter; iter++) {
			rslt =  lmaStep(
					lambda,
					rms_diff,
					debug_level);
			num_steps++;
			if (debug_level > 1) {
				LOGGER.debug("LMA step "+iter+": {"+rslt[0]+","+rslt[1]+"} RMS="+last_rms+
						" ("+initial_rms+"), lambda="+lambda);
			}
			if (this.singular) {
				break;
			}
			if (rslt[1]) {
				converged = true;
				break;
			}
			if (rslt[0]) { // good
				lambda *= lambda_scale_good;
			} else {
				lambda *= lambda_scale_bad;
				if (lambda > lambda_max) { // no step improves the fit any more
					converged = true;
					break;
				}
			}
		}
		if (debug_level > 0) {
			if (converged) {
				LOGGER.debug("Step "+iter+": LMA converged, RMS="+last_rms+" ("+initial_rms+")");
			} else if (singular) {
				LOGGER.debug("Step "+iter+": LMA stopped on a singular matrix, RMS="+last_rms+" ("+initial_rms+")");
			} else {
				LOGGER.debug("Step "+iter+": LMA failed to converge in "+num_iter+" steps, RMS="+last_rms+" ("+initial_rms+")");
			}
		}
		return converged;
	}

	/**
	 * Fit from the initial vector with escalating step budgets. Each tier restarts
	 * from the initial vector.
	 * @param initial initial parameters
	 * @param plp LMA settings with the iteration tiers
	 * @return fitted parameters or null if the last tier did not converge either
	 */
	public double [] fitWithRetries(
			double []          initial,
			PanelLmaParameters plp) {
		for (int tier = 0; tier < plp.plma_iteration_tiers.length; tier++) {
			int num_iter = plp.plma_iteration_tiers[tier];
			setVector(initial);
			boolean converged = runLma(
					plp.plma_lambda,            // double lambda,
					plp.plma_lambda_scale_good, // double lambda_scale_good,
					plp.plma_lambda_scale_bad,  // double lambda_scale_bad,
					plp.plma_lambda_max,        // double lambda_max,
					plp.plma_rms_diff,          // double rms_diff,
					num_iter,                   // int    num_iter,
					plp.plma_debug_level);      // int    debug_level)
			if (converged) {
				if (plp.plma_debug_level > 0) {
					LOGGER.debug("Converged with less than "+num_iter+" iterations");
				}
				return getVector();
			}
			if (plp.plma_debug_level > 0) {
				LOGGER.debug("Increasing number of iterations after "+num_iter);
			}
		}
		return null;
	}
}
