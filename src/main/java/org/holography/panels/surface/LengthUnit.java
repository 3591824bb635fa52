package org.holography.panels.surface;

/**
 * Units for screw adjustments, converted from meters.
 */
public enum LengthUnit {
	MM   ("mm",   1000.0),
	MILS ("mils", 1000.0 / 0.0254); // thousandths of an inch

	private final String name;
	private final double factor;

	LengthUnit(String name, double factor) {
		this.name =   name;
		this.factor = factor;
	}

	public String getName() {
		return name;
	}

	public double getFactor() {
		return factor;
	}

	public double fromMeters(double meters) {
		return meters * factor;
	}

	public static LengthUnit fromName(String name) {
		if (name != null) {
			String s = name.trim().toLowerCase();
			switch (s) {
			case "mm":         return MM;
			case "mils":
			case "miliinches": return MILS;
			default:           break;
			}
		}
		throw new IllegalArgumentException("Unknown unit: "+name);
	}

	@Override
	public String toString() {
		return name;
	}
}
