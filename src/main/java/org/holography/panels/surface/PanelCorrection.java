package org.holography.panels.surface;

/** Fitted model value at one pixel of a panel */
public class PanelCorrection {
	public final int    ix;
	public final int    iy;
	public final double value;

	public PanelCorrection(int ix, int iy, double value) {
		this.ix =    ix;
		this.iy =    iy;
		this.value = value;
	}
}
