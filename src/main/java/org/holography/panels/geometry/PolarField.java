/**
 **
 ** PolarField - per-pixel radius and azimuth of the aperture plane
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PolarField.java is free software: you can redistribute it and/or modify
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

/*
 * Pixels are stored row by row: index = iy * width + ix, with x along the first
 * axis. Coordinates are taken at the pixel centers.
 */
public class PolarField {
	public static final double TWO_PI = 2.0 * Math.PI;

	private final int       width;
	private final int       height;
	private final double [] x;
	private final double [] y;
	private final double [] radius;
	private final double [] azimuth;

	private PolarField(int width, int height) {
		this.width =   width;
		this.height =  height;
		int len = width * height;
		this.x =       new double [len];
		this.y =       new double [len];
		this.radius =  new double [len];
		this.azimuth = new double [len];
	}

	public static PolarField build(
			AxisMapping x_axis,
			AxisMapping y_axis) {
		PolarField field = new PolarField(x_axis.getCount(), y_axis.getCount());
		for (int iy = 0; iy < field.height; iy++) {
			double ycoor = y_axis.pixelCenter(iy);
			for (int ix = 0; ix < field.width; ix++) {
				double xcoor = x_axis.pixelCenter(ix);
				int indx = iy * field.width + ix;
				field.x[indx] =       xcoor;
				field.y[indx] =       ycoor;
				field.radius[indx] =  Math.sqrt(xcoor * xcoor + ycoor * ycoor);
				field.azimuth[indx] = normalizeAngle(Math.atan2(ycoor, xcoor));
			}
		}
		return field;
	}

	/**
	 * Bring angle into [0, 2*pi)
	 */
	public static double normalizeAngle(double angle) {
		double a = angle % TWO_PI;
		if (a < 0) {
			a += TWO_PI;
		}
		if (a >= TWO_PI) { // -tiny % 2pi + 2pi rounds up to 2pi
			a = 0.0;
		}
		return a;
	}

	public int getWidth()  { return width; }
	public int getHeight() { return height; }
	public int size()      { return radius.length; }

	public double getX(int indx)       { return x[indx]; }
	public double getY(int indx)       { return y[indx]; }
	public double getRadius(int indx)  { return radius[indx]; }
	public double getAzimuth(int indx) { return azimuth[indx]; }

	/** @return copy of the per-pixel radii */
	public double [] getRadius() {
		return radius.clone();
	}

	/** @return copy of the per-pixel azimuths */
	public double [] getAzimuth() {
		return azimuth.clone();
	}
}
