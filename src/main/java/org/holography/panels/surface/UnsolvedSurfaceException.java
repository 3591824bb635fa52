package org.holography.panels.surface;

/**
 * Corrections were requested before the panels of the surface were fitted.
 */
public class UnsolvedSurfaceException extends IllegalStateException {
	private static final long serialVersionUID = 6046932412208394627L;

	public UnsolvedSurfaceException(String message) {
		super(message);
	}
}
