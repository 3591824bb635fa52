package org.holography.panels.surface;

/**
 * Aperture point collected by a panel: coordinates (m), pixel indices and deviation (m).
 */
public class PanelSample {
	public final double x;
	public final double y;
	public final int    ix;
	public final int    iy;
	public final double value;

	public PanelSample(double x, double y, int ix, int iy, double value) {
		this.x =     x;
		this.y =     y;
		this.ix =    ix;
		this.iy =    iy;
		this.value = value;
	}

	@Override
	public String toString() {
		return "PanelSample{x="+x+", y="+y+", ix="+ix+", iy="+iy+", value="+value+"}";
	}
}
