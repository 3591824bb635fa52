package org.holography.panels.fitting;

/**
 * Deformation model of a single panel: z(x, y) in aperture coordinates.
 */
public interface PanelModel {

	int getNumParameters();

	/**
	 * Fit the model to the samples.
	 * @param x sample X coordinates (m)
	 * @param y sample Y coordinates (m)
	 * @param values sample deviations (m)
	 * @return fitted parameters, or null if an iterative solver did not converge
	 * @throws SingularMatrixException if a linear solver meets a singular system
	 */
	double [] solve(double [] x, double [] y, double [] values);

	double correctionAt(double [] parameters, double x, double y);
}
