/**
 **
 ** RingPanel - annular sector panel of an axially symmetric reflector
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RingPanel.java is free software: you can redistribute it and/or modify
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

import org.holography.panels.fitting.PanelKind;
import org.holography.panels.fitting.PanelLmaParameters;

/*
 * Panel ipanel of a ring with npanel panels covers azimuths
 * [2*pi*ipanel/npanel, 2*pi*(ipanel+1)/npanel) and radii [inrad, ourad).
 * Screws are inset SCREW_INSET of the radial width and of the angular span
 * from the panel corners, ordered inner-left, inner-right, outer-left, outer-right
 * (left is the lower azimuth).
 */
public class RingPanel extends Panel {
	public static final double SCREW_INSET = 0.1;
	public static final int    NUM_SCREWS =  4;

	private final int    iring;   // 1-based
	private final int    ipanel;  // 1-based
	private final double inrad;
	private final double ourad;
	private final double theta1;
	private final double theta2;
	private final double margin_inrad;
	private final double margin_ourad;
	private final double margin_theta1;
	private final double margin_theta2;

	/**
	 * @param kind surface model
	 * @param npanel number of panels in the ring
	 * @param iring ring index, 0-based
	 * @param ipanel panel index in the ring, 0-based
	 * @param inrad inner radius, m
	 * @param ourad outer radius, m
	 * @param margin fraction of the panel size on each side treated as margin, [0, 0.5)
	 * @param plp LMA settings
	 */
	public RingPanel(
			PanelKind          kind,
			int                npanel,
			int                iring,
			int                ipanel,
			double             inrad,
			double             ourad,
			double             margin,
			PanelLmaParameters plp) {
		super(
				kind,
				(iring + 1)+"-"+(ipanel + 1),
				screwPositions(npanel, ipanel, inrad, ourad),
				centerPosition(npanel, ipanel, inrad, ourad),
				centerAngle(npanel, ipanel),
				plp);
		if ((margin < 0.0) || (margin >= 0.5)) {
			throw new IllegalArgumentException("Panel margin should be in [0, 0.5), got "+margin);
		}
		this.iring =  iring + 1;
		this.ipanel = ipanel + 1;
		this.inrad =  inrad;
		this.ourad =  ourad;
		this.theta1 = 2.0 * Math.PI * ipanel / npanel;
		this.theta2 = 2.0 * Math.PI * (ipanel + 1) / npanel;
		double dr =     ourad - inrad;
		double dtheta = theta2 - theta1;
		this.margin_inrad =  inrad +  margin * dr;
		this.margin_ourad =  ourad -  margin * dr;
		this.margin_theta1 = theta1 + margin * dtheta;
		this.margin_theta2 = theta2 - margin * dtheta;
	}

	static double centerAngle(int npanel, int ipanel) {
		return 2.0 * Math.PI * (ipanel + 0.5) / npanel;
	}

	static double [] centerPosition(int npanel, int ipanel, double inrad, double ourad) {
		double rt = (inrad + ourad) / 2.0;
		double zeta = centerAngle(npanel, ipanel);
		return new double [] {rt * Math.cos(zeta), rt * Math.sin(zeta)};
	}

	static double [][] screwPositions(int npanel, int ipanel, double inrad, double ourad) {
		double theta1 = 2.0 * Math.PI * ipanel / npanel;
		double theta2 = 2.0 * Math.PI * (ipanel + 1) / npanel;
		double rscale = SCREW_INSET * (ourad - inrad);
		double tscale = SCREW_INSET * (theta2 - theta1);
		double [] radii =  {inrad + rscale, inrad + rscale, ourad - rscale, ourad - rscale};
		double [] angles = {theta1 + tscale, theta2 - tscale, theta1 + tscale, theta2 - tscale};
		double [][] screws = new double [NUM_SCREWS][2];
		for (int i = 0; i < NUM_SCREWS; i++) {
			screws[i][0] = radii[i] * Math.cos(angles[i]);
			screws[i][1] = radii[i] * Math.sin(angles[i]);
		}
		return screws;
	}

	/**
	 * @param rad radius, m
	 * @param phi azimuth in [0, 2*pi)
	 * @return true if the point belongs to this panel (lower bounds inclusive, upper exclusive)
	 */
	public boolean isInside(double rad, double phi) {
		return (phi >= theta1) && (phi < theta2) && (rad >= inrad) && (rad < ourad);
	}

	/**
	 * @return true if the point belongs to the panel and is not in its margin
	 */
	public boolean isSample(double rad, double phi) {
		return isInside(rad, phi) &&
				(phi >= margin_theta1) && (phi <= margin_theta2) &&
				(rad >= margin_inrad) && (rad <= margin_ourad);
	}

	/**
	 * Add a point that passed isInside() as a sample or as a margin point
	 */
	public void addPoint(PanelSample point, double rad, double phi) {
		if (isSample(rad, phi)) {
			addSample(point);
		} else {
			addMargin(point);
		}
	}

	@Override
	public String exportAdjustments(LengthUnit unit) {
		StringBuilder sb = new StringBuilder(String.format("     %-8d%-8d", iring, ipanel));
		for (double d : getScrewAdjustments(unit)) {
			sb.append(String.format(" %10.2f", d));
		}
		return sb.toString();
	}

	public int getRing()             { return iring; }
	public int getPanelNumber()      { return ipanel; }
	public double getInnerRadius()   { return inrad; }
	public double getOuterRadius()   { return ourad; }
	public double getStartAngle()    { return theta1; }
	public double getEndAngle()      { return theta2; }
}
