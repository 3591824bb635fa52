package org.holography.panels.fitting;

/** Rigid vertical shift only: z = c */
public class MeanModel implements PanelModel {

	@Override
	public int getNumParameters() {
		return 1;
	}

	@Override
	public double [] solve(double [] x, double [] y, double [] values) {
		if (values.length == 0) {
			return new double [] {0.0};
		}
		double s = 0.0;
		for (double v : values) s += v;
		return new double [] {s / values.length};
	}

	@Override
	public double correctionAt(double [] parameters, double x, double y) {
		return parameters[0];
	}
}
