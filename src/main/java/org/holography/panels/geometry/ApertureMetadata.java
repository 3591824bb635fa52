/**
 **
 ** ApertureMetadata - observation metadata accompanying a pair of aperture images
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ApertureMetadata.java is free software: you can redistribute it and/or modify
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

package org.holography.panels.geometry;

public class ApertureMetadata {
	public final int         npix;          // pixels per side
	public final AxisMapping x_axis;
	public final AxisMapping y_axis;
	public final double      wavelength;    // m
	public final double      inner_limit;   // m, mask inner radius
	public final double      outer_limit;   // m, mask outer radius
	public final double      num_points;    // aperture sampling points per side, defines the resolution
	public final String      telescope_name;
	public final String      antenna_name;

	public ApertureMetadata(
			int         npix,
			AxisMapping x_axis,
			AxisMapping y_axis,
			double      wavelength,
			double      inner_limit,
			double      outer_limit,
			double      num_points,
			String      telescope_name,
			String      antenna_name) {
		if (x_axis.getCount() != npix || y_axis.getCount() != npix) {
			throw new IllegalArgumentException("Axes lengths ("+x_axis.getCount()+", "+y_axis.getCount()+
					") do not match image size "+npix);
		}
		if (wavelength <= 0) {
			throw new IllegalArgumentException("Wavelength must be positive, got "+wavelength);
		}
		this.npix =           npix;
		this.x_axis =         x_axis;
		this.y_axis =         y_axis;
		this.wavelength =     wavelength;
		this.inner_limit =    Math.abs(inner_limit);
		this.outer_limit =    Math.abs(outer_limit);
		this.num_points =     num_points;
		this.telescope_name = telescope_name;
		this.antenna_name =   antenna_name;
	}

	/**
	 * Square image of npix pixels per side centered at the origin, with the
	 * number of sampling points equal to npix.
	 */
	public static ApertureMetadata centered(
			int    npix,
			double cell,
			double wavelength,
			double inner_limit,
			double outer_limit,
			String telescope_name,
			String antenna_name) {
		AxisMapping axis = new AxisMapping(npix, npix / 2.0, 0.0, cell);
		return new ApertureMetadata(
				npix,
				axis,
				axis,
				wavelength,
				inner_limit,
				outer_limit,
				npix,
				telescope_name,
				antenna_name);
	}
}
