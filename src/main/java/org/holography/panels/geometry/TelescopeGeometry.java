/**
 **
 ** TelescopeGeometry - read-only description of a reflector and its panel rings
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TelescopeGeometry.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;
import java.util.Properties;

import org.holography.panels.common.EProperties;

public class TelescopeGeometry {
	private final String    name;
	private final double    diameter; // m
	private final double    focus;    // m, focal length of the primary
	private final boolean   ringed;
	private final double [] inrad;    // m, inner radius of each ring
	private final double [] ourad;    // m, outer radius of each ring
	private final int    [] npanel;   // number of panels in each ring

	public TelescopeGeometry(
			String    name,
			double    diameter,
			double    focus,
			boolean   ringed,
			double [] inrad,
			double [] ourad,
			int    [] npanel) {
		if (inrad.length != ourad.length || inrad.length != npanel.length) {
			throw new IllegalArgumentException("Ring descriptions have different lengths: inrad="+inrad.length+
					", ourad="+ourad.length+", npanel="+npanel.length);
		}
		for (int iring = 0; iring < npanel.length; iring++) {
			if (npanel[iring] <= 0) {
				throw new IllegalArgumentException("Ring "+iring+" has no panels");
			}
			if (ourad[iring] <= inrad[iring]) {
				throw new IllegalArgumentException("Ring "+iring+" outer radius "+ourad[iring]+
						" is not larger than inner radius "+inrad[iring]);
			}
		}
		if (focus <= 0 || diameter <= 0) {
			throw new IllegalArgumentException("Focus and diameter must be positive");
		}
		this.name =     name;
		this.diameter = diameter;
		this.focus =    focus;
		this.ringed =   ringed;
		this.inrad =    inrad.clone();
		this.ourad =    ourad.clone();
		this.npanel =   npanel.clone();
	}

	/**
	 * Nominal layout of a VLA antenna: 25 m dish, 6 rings of panels.
	 */
	public static TelescopeGeometry vla() {
		return new TelescopeGeometry(
				"VLA",
				25.0,
				8.8,
				true,
				new double [] {1.983, 3.683, 5.563, 7.391, 9.144, 10.87},
				new double [] {3.683, 5.563, 7.391, 9.144, 10.87, 12.5},
				new int []    {12,    16,    24,    40,    40,    40});
	}

	public String getName()        { return name; }
	public double getDiameter()    { return diameter; }
	public double getFocus()       { return focus; }
	public boolean isRinged()      { return ringed; }
	public int getNumRings()       { return npanel.length; }
	public double getInnerRadius(int iring) { return inrad[iring]; }
	public double getOuterRadius(int iring) { return ourad[iring]; }
	public int getNumPanels(int iring)      { return npanel[iring]; }

	public int getTotalPanels() {
		int n = 0;
		for (int np : npanel) n += np;
		return n;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"name",     this.name);
		properties.setProperty(prefix+"diameter", this.diameter+"");                  // double
		properties.setProperty(prefix+"focus",    this.focus+"");                     // double
		properties.setProperty(prefix+"ringed",   this.ringed+"");                    // boolean
		properties.setProperty(prefix+"inrad",    EProperties.join(this.inrad));      // double[]
		properties.setProperty(prefix+"ourad",    EProperties.join(this.ourad));      // double[]
		properties.setProperty(prefix+"npanel",   EProperties.join(this.npanel));     // int[]
	}

	/**
	 * Build a geometry from properties written by setProperties()
	 * @param prefix key prefix
	 * @param properties source properties
	 * @return new geometry
	 * @throws IllegalArgumentException if any of the keys is missing
	 */
	public static TelescopeGeometry getProperties(String prefix,Properties properties){
		EProperties eprops = (properties instanceof EProperties) ? ((EProperties) properties) : new EProperties(properties);
		for (String key : new String [] {"name", "diameter", "focus", "inrad", "ourad", "npanel"}) {
			if (eprops.getProperty(prefix+key) == null) {
				throw new IllegalArgumentException("Missing telescope property "+prefix+key);
			}
		}
		return new TelescopeGeometry(
				eprops.getProperty(prefix+"name"),
				eprops.getProperty(prefix+"diameter", 0.0),
				eprops.getProperty(prefix+"focus",    0.0),
				eprops.getProperty(prefix+"ringed",   true),
				eprops.getProperty(prefix+"inrad",    new double[0]),
				eprops.getProperty(prefix+"ourad",    new double[0]),
				eprops.getProperty(prefix+"npanel",   new int[0]));
	}

	@Override
	public String toString() {
		return name+": diameter="+diameter+"m, focus="+focus+"m, rings="+npanel.length+
				", panels="+Arrays.toString(npanel);
	}
}
