/**
 **
 ** Panel - reflector panel collecting aperture samples and fitting its surface model
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Panel.java is free software: you can redistribute it and/or modify
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

package org.holography.panels.surface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.holography.panels.fitting.PanelKind;
import org.holography.panels.fitting.PanelLmaParameters;
import org.holography.panels.fitting.PanelModel;
import org.holography.panels.fitting.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A panel owns the samples used to fit its model and the margin points that
 * are corrected with the fitted model but do not take part in the fit.
 * <p>
 * The kind is fixed at construction. When the model can not be fitted (too few
 * samples, singular linear system, nonlinear fit not converging) the panel
 * falls back to the MEAN kind for good and reports it with {@link #fellBack()}.
 */
public class Panel {
	private static final Logger LOGGER = LoggerFactory.getLogger(Panel.class);

	protected final String      label;
	protected final double []   center;
	protected final double      zeta;
	protected final double [][] screws;

	private final PanelKind         initial_kind;
	private PanelKind               kind;
	private PanelModel              model;
	private final List<PanelSample> samples = new ArrayList<>();
	private final List<PanelSample> margins = new ArrayList<>();
	private double []               parameters =      null;
	private boolean                 solved =          false;
	private boolean                 fell_back =       false;
	private String                  fallback_reason = null;

	/**
	 * @param kind surface model
	 * @param label panel label used in reports
	 * @param screws screw positions [nscrew][2] (x, y), m
	 * @param center panel center (x, y), m
	 * @param zeta panel center angle, radians
	 * @param plp LMA settings for the nonlinear models
	 */
	public Panel(
			PanelKind          kind,
			String             label,
			double [][]        screws,
			double []          center,
			double             zeta,
			PanelLmaParameters plp) {
		if (kind == null) {
			throw new IllegalArgumentException("Panel kind is not specified");
		}
		this.label =        label;
		this.screws =       copyScrews(screws);
		this.center =       (center == null) ? new double [] {0.0, 0.0} : center.clone();
		this.zeta =         zeta;
		this.initial_kind = kind;
		this.kind =         kind;
		this.model =        kind.createModel(this.center, zeta, plp);
	}

	public Panel(
			PanelKind   kind,
			String      label,
			double [][] screws) {
		this(kind, label, screws, null, 0.0, new PanelLmaParameters());
	}

	private static double [][] copyScrews(double [][] screws) {
		double [][] copy = new double [screws.length][];
		for (int i = 0; i < screws.length; i++) {
			copy[i] = screws[i].clone();
		}
		return copy;
	}

	public void addSample(PanelSample sample) {
		checkNotSolved();
		samples.add(sample);
	}

	public void addMargin(PanelSample sample) {
		checkNotSolved();
		margins.add(sample);
	}

	private void checkNotSolved() {
		if (solved) {
			throw new IllegalStateException("Panel "+label+" is already solved, no points can be added");
		}
	}

	/**
	 * Fit the panel model to its samples, falling back to the mean if the model
	 * can not be fitted.
	 */
	public void solve() {
		checkNotSolved();
		int nsamp = samples.size();
		double [] x = new double [nsamp];
		double [] y = new double [nsamp];
		double [] v = new double [nsamp];
		for (int i = 0; i < nsamp; i++) {
			PanelSample s = samples.get(i);
			x[i] = s.x;
			y[i] = s.y;
			v[i] = s.value;
		}
		if (kind != PanelKind.MEAN) {
			if (nsamp < kind.getNumParameters()) {
				fallbackSolve("only "+nsamp+" samples for "+kind.getNumParameters()+" parameters", x, y, v);
				return;
			}
			double [] par;
			try {
				par = model.solve(x, y, v);
			} catch (SingularMatrixException e) {
				fallbackSolve("linear algebra failure ("+e.getMessage()+")", x, y, v);
				return;
			}
			if (par == null) {
				fallbackSolve("nonlinear fit did not converge", x, y, v);
				return;
			}
			for (double d : par) {
				if (!Double.isFinite(d)) {
					fallbackSolve("non-finite fit parameters", x, y, v);
					return;
				}
			}
			parameters = par;
		} else {
			parameters = model.solve(x, y, v);
		}
		solved = true;
	}

	private void fallbackSolve(
			String    reason,
			double [] x,
			double [] y,
			double [] v) {
		LOGGER.warn("Panel "+label+" ("+kind+"): "+reason+", falling back to "+PanelKind.MEAN);
		kind =            PanelKind.MEAN;
		model =           PanelKind.MEAN.createModel(center, zeta, null);
		fell_back =       true;
		fallback_reason = reason;
		parameters =      model.solve(x, y, v);
		solved =          true;
	}

	public double correctionAt(double x, double y) {
		if (!solved) {
			throw new IllegalStateException("Cannot correct a panel that is not solved: "+label);
		}
		return model.correctionAt(parameters, x, y);
	}

	/**
	 * @return fitted value for every sample followed by every margin point
	 */
	public List<PanelCorrection> getCorrections() {
		if (!solved) {
			throw new IllegalStateException("Cannot correct a panel that is not solved: "+label);
		}
		List<PanelCorrection> corr = new ArrayList<>(samples.size() + margins.size());
		for (PanelSample s : samples) {
			corr.add(new PanelCorrection(s.ix, s.iy, model.correctionAt(parameters, s.x, s.y)));
		}
		for (PanelSample s : margins) {
			corr.add(new PanelCorrection(s.ix, s.iy, model.correctionAt(parameters, s.x, s.y)));
		}
		return corr;
	}

	/**
	 * @param unit output unit
	 * @return fitted deviation at each screw
	 */
	public double [] getScrewAdjustments(LengthUnit unit) {
		double [] adjustments = new double [screws.length];
		for (int i = 0; i < screws.length; i++) {
			adjustments[i] = unit.fromMeters(correctionAt(screws[i][0], screws[i][1]));
		}
		return adjustments;
	}

	/**
	 * One line of the screw adjustments table
	 */
	public String exportAdjustments(LengthUnit unit) {
		StringBuilder sb = new StringBuilder(String.format("%-20s", label));
		for (double d : getScrewAdjustments(unit)) {
			sb.append(String.format(" %10.2f", d));
		}
		return sb.toString();
	}

	public String getLabel()              { return label; }
	public double [] getCenter()          { return center.clone(); }
	public double getZeta()               { return zeta; }
	public double [][] getScrews()        { return copyScrews(screws); }
	public PanelKind getKind()            { return kind; }
	public PanelKind getInitialKind()     { return initial_kind; }
	public int getNumParameters()         { return kind.getNumParameters(); }
	public boolean isSolved()             { return solved; }
	public boolean fellBack()             { return fell_back; }
	public String getFallbackReason()     { return fallback_reason; }
	public List<PanelSample> getSamples() { return Collections.unmodifiableList(samples); }
	public List<PanelSample> getMargins() { return Collections.unmodifiableList(margins); }

	/**
	 * @return fitted parameters, null before solve()
	 */
	public double [] getParameters() {
		return (parameters == null) ? null : parameters.clone();
	}

	@Override
	public String toString() {
		return "Panel "+label+" ("+kind+(fell_back ? ", fell back" : "")+"), samples="+samples.size()+", margins="+margins.size();
	}
}
