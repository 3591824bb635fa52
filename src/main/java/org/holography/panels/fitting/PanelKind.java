package org.holography.panels.fitting;

/**
 * Panel surface models. The name is the one used in configuration files.
 */
public enum PanelKind {
	RIGID                ("rigid",               3),
	MEAN                 ("mean",                1),
	XY_PARABOLOID        ("xyparaboloid",        3),
	ROTATED_PARABOLOID   ("rotatedparaboloid",   4),
	COROTATED_PARABOLOID ("corotatedparaboloid", 3),
	LEAST_SQUARES        ("least_squares",       9),
	COROTATED_LST_SQ     ("corotated_lst_sq",    3);

	private final String name;
	private final int    npar;

	PanelKind(String name, int npar) {
		this.name = name;
		this.npar = npar;
	}

	public String getName() {
		return name;
	}

	public int getNumParameters() {
		return npar;
	}

	/**
	 * @param name configuration name, case-insensitive ("rigid", "xyparaboloid", ...)
	 * @return matching kind
	 * @throws IllegalArgumentException for an unknown name
	 */
	public static PanelKind fromName(String name) {
		if (name != null) {
			String trimmed = name.trim();
			for (PanelKind kind : values()) {
				if (kind.name.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
					return kind;
				}
			}
		}
		throw new IllegalArgumentException("Unknown panel kind: "+name);
	}

	/**
	 * @param center panel center (x, y), m
	 * @param zeta panel center angle, used by the co-rotated models
	 * @param plp LMA settings for the nonlinear models
	 * @return new model instance
	 */
	public PanelModel createModel(
			double []          center,
			double             zeta,
			PanelLmaParameters plp) {
		switch (this) {
		case RIGID:                return new RigidModel();
		case MEAN:                 return new MeanModel();
		case XY_PARABOLOID:        return new ParaboloidModel(ParaboloidModel.Orientation.AXES,      center, zeta, plp);
		case ROTATED_PARABOLOID:   return new ParaboloidModel(ParaboloidModel.Orientation.ROTATED,   center, zeta, plp);
		case COROTATED_PARABOLOID: return new ParaboloidModel(ParaboloidModel.Orientation.COROTATED, center, zeta, plp);
		case LEAST_SQUARES:        return new LeastSquaresParaboloidModel(LeastSquaresParaboloidModel.Form.FULL,      center, zeta);
		case COROTATED_LST_SQ:     return new LeastSquaresParaboloidModel(LeastSquaresParaboloidModel.Form.COROTATED, center, zeta);
		default:
			throw new IllegalArgumentException("Unknown panel kind: "+this);
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
