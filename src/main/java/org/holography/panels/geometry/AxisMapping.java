/**
 **
 ** AxisMapping - linear mapping between pixel index and physical coordinate
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AxisMapping.java is free software: you can redistribute it and/or modify
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

public class AxisMapping {
	private final int    count;
	private final double reference_pixel;
	private final double reference_value;
	private final double increment;

	/**
	 * @param count number of pixels along the axis
	 * @param reference_pixel pixel index where the axis has reference_value
	 * @param reference_value physical coordinate at reference_pixel (m)
	 * @param increment physical step per pixel (m), must not be 0
	 */
	public AxisMapping(
			int    count,
			double reference_pixel,
			double reference_value,
			double increment) {
		if (increment == 0.0) {
			throw new IllegalArgumentException("Axis increment can not be 0");
		}
		if (count < 0) {
			throw new IllegalArgumentException("Negative axis length: "+count);
		}
		this.count =           count;
		this.reference_pixel = reference_pixel;
		this.reference_value = reference_value;
		this.increment =       increment;
	}

	public double coordinate(double index) {
		return reference_value + (index - reference_pixel) * increment;
	}

	public double index(double coordinate) {
		return reference_pixel + (coordinate - reference_value) / increment;
	}

	/** Physical coordinate of the center of pixel index */
	public double pixelCenter(int index) {
		return coordinate(index + 0.5);
	}

	public int getCount() {
		return count;
	}

	public double getReferencePixel() {
		return reference_pixel;
	}

	public double getReferenceValue() {
		return reference_value;
	}

	public double getIncrement() {
		return increment;
	}

	@Override
	public String toString() {
		return "AxisMapping{n="+count+", crpix="+reference_pixel+", crval="+reference_value+", cdelt="+increment+"}";
	}
}
