/**
 **
 ** SurfaceImages - ImageJ stack of the surface maps for the image writers
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SurfaceImages.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;
import ij.ImageStack;

public class SurfaceImages {
	public static final String [] TITLES_DEVIATION = {"amplitude", "mask", "deviation_mm", "corrections_mm", "residuals_mm"};
	public static final String [] TITLES_PHASE =     {"amplitude", "mask", "phase_deg",    "corrections_deg", "residuals_deg"};

	private SurfaceImages() {
	}

	/**
	 * Float stack of amplitude, mask and deviation (mm) or phase (degrees),
	 * followed by the corrections and residuals if the surface is corrected.
	 * @param surface antenna surface
	 * @param phase true for phase maps in degrees, false for deviation maps in mm
	 * @return image titled after the antenna
	 */
	public static ImagePlus makeStack(
			AntennaSurface surface,
			boolean        phase) {
		int npix = surface.getMetadata().npix;
		String [] titles = phase ? TITLES_PHASE : TITLES_DEVIATION;
		double scale = phase ? (180.0 / Math.PI) : 1000.0;
		ImageStack stack = new ImageStack(npix, npix);
		stack.addSlice(titles[0], toFloat(surface.getAmplitude(), 1.0));
		boolean [] mask = surface.getMask();
		float [] fmask = new float [mask.length];
		for (int i = 0; i < mask.length; i++) {
			fmask[i] = mask[i] ? 1.0f : 0.0f;
		}
		stack.addSlice(titles[1], fmask);
		stack.addSlice(titles[2], toFloat(phase ? surface.getPhase() : surface.getDeviation(), scale));
		if (surface.isCorrected()) {
			stack.addSlice(titles[3], toFloat(phase ? surface.getPhaseCorrections() : surface.getCorrections(), scale));
			stack.addSlice(titles[4], toFloat(phase ? surface.getPhaseResiduals()   : surface.getResiduals(),   scale));
		}
		String title = surface.getMetadata().antenna_name+(phase ? "-phase" : "-deviation");
		return new ImagePlus(title, stack);
	}

	static float [] toFloat(double [] data, double scale) {
		float [] fpixels = new float [data.length];
		for (int i = 0; i < data.length; i++) {
			fpixels[i] = (float) (data[i] * scale);
		}
		return fpixels;
	}
}
