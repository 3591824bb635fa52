package org.holography.panels.fitting;

/**
 * Linear system has no unique solution.
 */
public class SingularMatrixException extends RuntimeException {
	private static final long serialVersionUID = -2281350939817165820L;

	public SingularMatrixException(String message) {
		super(message);
	}
}
