/**
 **
 ** AntennaSurface - aperture surface of one antenna split into panels, fitted and corrected
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AntennaSurface.java is free software: you can redistribute it and/or modify
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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.holography.panels.common.MultiThreading;
import org.holography.panels.fitting.PanelKind;
import org.holography.panels.geometry.ApertureMetadata;
import org.holography.panels.geometry.PolarField;
import org.holography.panels.geometry.TelescopeGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the aperture amplitude and surface deviation of one antenna, assigns
 * the masked pixels to the reflector panels, fits each panel and produces the
 * residual and correction maps.
 * <p>
 * All grids are flat arrays of npix * npix, pixel (ix, iy) at iy * npix + ix.
 * Deviations are in meters, phases in radians. Lifecycle: construct,
 * {@link #compilePanelPoints()} (optional, done by the fit), {@link #fitSurface()},
 * {@link #correctSurface()}.
 */
public class AntennaSurface {
	private static final Logger LOGGER = LoggerFactory.getLogger(AntennaSurface.class);

	private final ApertureMetadata  metadata;
	private final TelescopeGeometry telescope;
	private final SurfaceParameters surface_parameters;
	private final PanelKind         panel_kind;
	private final PolarField        polar;
	private final double []         amplitude;
	private final double []         deviation;
	private final double []         phase;
	private final boolean []        mask;
	private final List<RingPanel>   panels;

	private boolean   compiled =          false;
	private boolean   fitted =            false;
	private double [] residuals =         null;
	private double [] corrections =       null;
	private double [] phase_residuals =   null;
	private double [] phase_corrections = null;

	/**
	 * @param amplitude aperture amplitude [npix * npix]
	 * @param deviation surface deviation in meters, or phase in radians when
	 *        surface_parameters.deviation_is_phase is set [npix * npix]
	 * @param metadata image geometry and observation parameters
	 * @param telescope reflector layout, must be ringed
	 * @param surface_parameters analysis settings
	 */
	public AntennaSurface(
			double []         amplitude,
			double []         deviation,
			ApertureMetadata  metadata,
			TelescopeGeometry telescope,
			SurfaceParameters surface_parameters) {
		int size = metadata.npix * metadata.npix;
		if ((amplitude.length != size) || (deviation.length != size)) {
			throw new IllegalArgumentException("Amplitude ("+amplitude.length+") and deviation ("+deviation.length+
					") sizes should both be "+metadata.npix+"*"+metadata.npix+"="+size);
		}
		if (!telescope.isRinged()) {
			throw new IllegalArgumentException("Telescope "+telescope.getName()+" does not have ringed panels, not supported");
		}
		this.metadata =           metadata;
		this.telescope =          telescope;
		this.surface_parameters = surface_parameters.clone();
		this.panel_kind =         this.surface_parameters.getPanelKind(telescope);
		this.polar =              PolarField.build(metadata.x_axis, metadata.y_axis);
		this.amplitude =          amplitude.clone();
		if (this.surface_parameters.deviation_is_phase) {
			this.phase =     deviation.clone();
			this.deviation = phaseToDeviation(this.phase);
		} else {
			this.deviation = deviation.clone();
			this.phase =     deviationToPhase(this.deviation);
		}
		this.mask =   buildMask();
		this.panels = buildRingPanels();
		LOGGER.info("Antenna "+metadata.antenna_name+" ("+telescope.getName()+"): "+getNumMasked()+" of "+size+
				" pixels in the mask, "+panels.size()+" panels of kind "+panel_kind);
	}

	/**
	 * @return true for pixels with amplitude of at least cutoff * maximal amplitude,
	 *         radius within the aperture limits and a defined deviation
	 */
	public boolean [] buildMask() {
		double max_amp = Double.NEGATIVE_INFINITY;
		for (double a : amplitude) {
			if (a > max_amp) max_amp = a; // NaN never compares
		}
		double threshold = surface_parameters.cutoff * max_amp;
		boolean [] mask = new boolean [amplitude.length];
		for (int i = 0; i < mask.length; i++) {
			double r = polar.getRadius(i);
			mask[i] = (amplitude[i] >= threshold) &&
					(r >= metadata.inner_limit) && (r <= metadata.outer_limit) &&
					!Double.isNaN(deviation[i]);
		}
		return mask;
	}

	/**
	 * @return panels ring by ring, in increasing azimuth within each ring
	 */
	public List<RingPanel> buildRingPanels() {
		List<RingPanel> ring_panels = new ArrayList<>(telescope.getTotalPanels());
		for (int iring = 0; iring < telescope.getNumRings(); iring++) {
			int npanel = telescope.getNumPanels(iring);
			for (int ipanel = 0; ipanel < npanel; ipanel++) {
				ring_panels.add(new RingPanel(
						panel_kind,                              // PanelKind kind,
						npanel,                                  // int npanel,
						iring,                                   // int iring,
						ipanel,                                  // int ipanel,
						telescope.getInnerRadius(iring),         // double inrad,
						telescope.getOuterRadius(iring),         // double ourad,
						surface_parameters.panel_margin,         // double margin,
						surface_parameters.lma));                // PanelLmaParameters plp
			}
		}
		return ring_panels;
	}

	/**
	 * Assign every masked pixel to the first panel containing it, as a sample or
	 * as a margin point. Done once, later calls are ignored.
	 */
	public void compilePanelPoints() {
		if (compiled) {
			return;
		}
		int npix = metadata.npix;
		int assigned = 0;
		for (int indx = 0; indx < mask.length; indx++) if (mask[indx]) {
			double rad = polar.getRadius(indx);
			double phi = polar.getAzimuth(indx);
			for (RingPanel panel : panels) {
				if (panel.isInside(rad, phi)) {
					panel.addPoint(
							new PanelSample(polar.getX(indx), polar.getY(indx), indx % npix, indx / npix, deviation[indx]),
							rad,
							phi);
					assigned++;
					break;
				}
			}
		}
		compiled = true;
		LOGGER.debug("Assigned "+assigned+" of "+getNumMasked()+" masked pixels to panels");
	}

	/**
	 * Fit all panels in parallel. Panels that can not be fitted with the
	 * configured kind fall back to the mean.
	 * @throws IllegalStateException if the surface is already fitted
	 */
	public void fitSurface() {
		if (fitted) {
			throw new IllegalStateException("Surface of "+metadata.antenna_name+" is already fitted");
		}
		compilePanelPoints();
		MultiThreading.forEachIndex(
				panels.size(),
				surface_parameters.threads_max,
				ipanel -> panels.get(ipanel).solve());
		fitted = true;
		int num_fallbacks = getNumFallbacks();
		if (num_fallbacks > 0) {
			LOGGER.info(num_fallbacks+" of "+panels.size()+" panels fell back to "+PanelKind.MEAN);
		}
	}

	/**
	 * Build corrections (negated panel fit) and residuals (deviation minus fit).
	 * Masked pixels outside of any panel get zero correction, pixels outside the
	 * mask are NaN in both maps.
	 * @throws UnsolvedSurfaceException if fitSurface() was not called
	 */
	public void correctSurface() {
		if (!fitted) {
			throw new UnsolvedSurfaceException("Surface of "+metadata.antenna_name+" is not fitted, run fitSurface() first");
		}
		int npix = metadata.npix;
		double [] fit = new double [deviation.length];
		Arrays.fill(fit, Double.NaN);
		for (int i = 0; i < fit.length; i++) if (mask[i]) {
			fit[i] = 0.0;
		}
		for (RingPanel panel : panels) {
			for (PanelCorrection pc : panel.getCorrections()) {
				fit[pc.iy * npix + pc.ix] = pc.value;
			}
		}
		double [] res =  new double [deviation.length];
		double [] corr = new double [deviation.length];
		for (int i = 0; i < res.length; i++) {
			if (mask[i]) {
				res[i] =  deviation[i] - fit[i];
				corr[i] = -fit[i];
			} else {
				res[i] =  Double.NaN;
				corr[i] = Double.NaN;
			}
		}
		residuals =         res;
		corrections =       corr;
		phase_residuals =   deviationToPhase(res);
		phase_corrections = deviationToPhase(corr);
	}

	/**
	 * Aperture efficiency estimates.
	 * @return {{gain_db, theoretical_gain_db}} for the measured phase, with a second
	 *         pair for the residual phase once the surface is corrected
	 */
	public double [][] gains() {
		double [][] result = new double [isCorrected() ? 2 : 1][];
		result[0] = gain(phase);
		if (isCorrected()) {
			result[1] = gain(phase_residuals);
		}
		return result;
	}

	private double [] gain(double [] phases) {
		double resolution = telescope.getDiameter() / metadata.num_points;
		double thgain = 4.0 * Math.PI * Math.pow(1000.0 * resolution / metadata.wavelength, 2);
		double sum_re = 0.0, sum_im = 0.0;
		int n = 0;
		for (int i = 0; i < phases.length; i++) if (mask[i]) {
			sum_re += Math.cos(phases[i]);
			sum_im += Math.sin(phases[i]);
			n++;
		}
		double scale = (n > 0) ? (Math.hypot(sum_re, sum_im) / n) : 0.0;
		return new double [] {10.0 * Math.log10(thgain * scale), 10.0 * Math.log10(thgain)};
	}

	/**
	 * @return {deviation_rms} in mm, with residual RMS appended once corrected
	 */
	public double [] getRms() {
		if (isCorrected()) {
			return new double [] {rms(deviation), rms(residuals)};
		}
		return new double [] {rms(deviation)};
	}

	private double rms(double [] data) {
		double s2 = 0.0;
		int n = 0;
		for (int i = 0; i < data.length; i++) if (mask[i]) {
			s2 += data[i] * data[i];
			n++;
		}
		return (n > 0) ? (1000.0 * Math.sqrt(s2 / n)) : 0.0;
	}

	/**
	 * @param ring ring number, 1-based
	 * @param panel panel number in the ring, 1-based
	 * @return the panel
	 */
	public RingPanel fetchPanel(int ring, int panel) {
		if ((ring < 1) || (ring > telescope.getNumRings())) {
			throw new IllegalArgumentException("Ring "+ring+" is out of range 1.."+telescope.getNumRings());
		}
		if ((panel < 1) || (panel > telescope.getNumPanels(ring - 1))) {
			throw new IllegalArgumentException("Panel "+panel+" is out of range 1.."+telescope.getNumPanels(ring - 1)+
					" for ring "+ring);
		}
		int indx = panel - 1;
		for (int iring = 0; iring < ring - 1; iring++) {
			indx += telescope.getNumPanels(iring);
		}
		return panels.get(indx);
	}

	/**
	 * Convert aperture phase (radians) to surface deviation (m) pixel by pixel.
	 */
	public double [] phaseToDeviation(double [] phases) {
		double [] result = new double [phases.length];
		for (int i = 0; i < result.length; i++) {
			result[i] = phases[i] * conversionFactor(polar.getRadius(i));
		}
		return result;
	}

	/**
	 * Convert surface deviation (m) to aperture phase (radians) pixel by pixel.
	 */
	public double [] deviationToPhase(double [] deviations) {
		double [] result = new double [deviations.length];
		for (int i = 0; i < result.length; i++) {
			result[i] = deviations[i] / conversionFactor(polar.getRadius(i));
		}
		return result;
	}

	// deviation / phase at radius r
	private double conversionFactor(double r) {
		double f4 = 4.0 * telescope.getFocus();
		return metadata.wavelength / (4.0 * Math.PI * f4) * Math.sqrt(r * r + f4 * f4);
	}

	public int getNumFallbacks() {
		int n = 0;
		for (Panel panel : panels) {
			if (panel.fellBack()) n++;
		}
		return n;
	}

	public int getNumMasked() {
		int n = 0;
		for (boolean b : mask) {
			if (b) n++;
		}
		return n;
	}

	public ApertureMetadata getMetadata()           { return metadata; }
	public TelescopeGeometry getTelescope()         { return telescope; }
	public SurfaceParameters getSurfaceParameters() { return surface_parameters.clone(); }
	public PanelKind getPanelKind()                 { return panel_kind; }
	public PolarField getPolarField()               { return polar; }
	public List<RingPanel> getPanels()              { return Collections.unmodifiableList(panels); }
	public boolean isCompiled()                     { return compiled; }
	public boolean isFitted()                       { return fitted; }
	public boolean isCorrected()                    { return residuals != null; }

	public double [] getAmplitude() { return amplitude.clone(); }
	public double [] getDeviation() { return deviation.clone(); }
	public double [] getPhase()     { return phase.clone(); }
	public boolean [] getMask()     { return mask.clone(); }

	public double [] getResiduals()        { return copyCorrected(residuals); }
	public double [] getCorrections()      { return copyCorrected(corrections); }
	public double [] getPhaseResiduals()   { return copyCorrected(phase_residuals); }
	public double [] getPhaseCorrections() { return copyCorrected(phase_corrections); }

	private double [] copyCorrected(double [] data) {
		if (data == null) {
			throw new UnsolvedSurfaceException("Surface of "+metadata.antenna_name+" is not corrected, run correctSurface() first");
		}
		return data.clone();
	}
}
