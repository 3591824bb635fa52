package org.holography.panels.common;

import java.util.Properties;

/**
 * Properties with typed getters, default returned when the key is absent.
 */
public class EProperties extends Properties{
	private static final long serialVersionUID = 3817249105331270461L;

	public EProperties() {
		super();
	}

	public EProperties(Properties defaults) {
		super();
		if (defaults != null) {
			putAll(defaults);
		}
	}

	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value).trim());
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}

	/** Comma-separated list of doubles */
	public double [] getProperty(String key, double [] value){
		String s = getProperty(key);
		if (s == null) return value;
		return parseDoubles(s);
	}

	/** Comma-separated list of integers */
	public int [] getProperty(String key, int [] value){
		String s = getProperty(key);
		if (s == null) return value;
		String [] items = split(s);
		int [] result = new int [items.length];
		for (int i = 0; i < items.length; i++) {
			result[i] = Integer.parseInt(items[i]);
		}
		return result;
	}

	public static double [] parseDoubles(String s) {
		String [] items = split(s);
		double [] result = new double [items.length];
		for (int i = 0; i < items.length; i++) {
			result[i] = Double.parseDouble(items[i]);
		}
		return result;
	}

	public static String join(double [] data) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < data.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(data[i]);
		}
		return sb.toString();
	}

	public static String join(int [] data) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < data.length; i++) {
			if (i > 0) sb.append(",");
			sb.append(data[i]);
		}
		return sb.toString();
	}

	private static String [] split(String s) {
		String trimmed = s.trim();
		if (trimmed.isEmpty()) return new String[0];
		String [] items = trimmed.split(",");
		for (int i = 0; i < items.length; i++) items[i] = items[i].trim();
		return items;
	}
}
