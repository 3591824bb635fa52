/**
 **
 ** ScrewAdjustments - text table of panel screw adjustments
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ScrewAdjustments.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ScrewAdjustments {
	private static final Logger LOGGER = LoggerFactory.getLogger(ScrewAdjustments.class);

	private ScrewAdjustments() {
	}

	/**
	 * @param surface corrected surface
	 * @param unit adjustment unit
	 * @return screw adjustments [panel][screw], panels in ring order
	 */
	public static double [][] getAdjustments(
			AntennaSurface surface,
			LengthUnit     unit) {
		checkCorrected(surface);
		double [][] adjustments = new double [surface.getPanels().size()][];
		for (int i = 0; i < adjustments.length; i++) {
			adjustments[i] = surface.getPanels().get(i).getScrewAdjustments(unit);
		}
		return adjustments;
	}

	/**
	 * Screw table: header followed by one line per panel
	 * ("ring panel inner-left inner-right outer-left outer-right").
	 */
	public static String format(
			AntennaSurface surface,
			LengthUnit     unit) {
		checkCorrected(surface);
		StringBuilder sb = new StringBuilder();
		sb.append("# Screw adjustments for ").append(surface.getMetadata().telescope_name)
			.append(" ").append(surface.getMetadata().antenna_name).append(" antenna\n");
		sb.append("# Adjustments are in ").append(unit.getName()).append("\n");
		sb.append("# Lower means away from subreflector\n");
		sb.append("# Raise means toward the subreflector\n");
		sb.append("# LOWER the panel if the number is POSITIVE\n");
		sb.append("# RAISE the panel if the number is NEGATIVE\n");
		sb.append("\n\n");
		sb.append(String.format("%-21s%-22s%s\n", "", "Inner Edge", "Outer Edge"));
		sb.append(String.format("%-8s%-8s%11s%11s%11s%11s\n", "Ring", "panel", "left", "right", "left", "right"));
		for (RingPanel panel : surface.getPanels()) {
			sb.append(panel.exportAdjustments(unit)).append("\n");
		}
		return sb.toString();
	}

	public static void write(
			AntennaSurface surface,
			LengthUnit     unit,
			Path           path) throws IOException {
		String table = format(surface, unit);
		Files.write(path, table.getBytes(StandardCharsets.UTF_8));
		LOGGER.info("Wrote screw adjustments of "+surface.getPanels().size()+" panels to "+path);
	}

	private static void checkCorrected(AntennaSurface surface) {
		if (!surface.isCorrected()) {
			throw new IllegalStateException("Screw adjustments require a corrected surface");
		}
	}
}
