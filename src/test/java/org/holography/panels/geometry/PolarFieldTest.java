package org.holography.panels.geometry;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class PolarFieldTest {

	@Test
	public void testPixelCenters() {
		AxisMapping axis = new AxisMapping(4, 2.0, 0.0, 1.0);
		PolarField polar = PolarField.build(axis, axis);
		assertEquals(16, polar.size());
		assertEquals(4,  polar.getWidth());
		// pixel (ix=3, iy=1) at index 1 * 4 + 3
		int indx = 7;
		assertEquals(1.5,  polar.getX(indx), 1e-12);
		assertEquals(-0.5, polar.getY(indx), 1e-12);
		assertEquals(Math.hypot(1.5, 0.5), polar.getRadius(indx), 1e-12);
		assertEquals(2.0 * Math.PI - Math.atan2(0.5, 1.5), polar.getAzimuth(indx), 1e-12);
		for (int i = 0; i < polar.size(); i++) {
			double az = polar.getAzimuth(i);
			assertTrue((az >= 0.0) && (az < PolarField.TWO_PI));
		}
	}

	@Test
	public void testArraysAreCopies() {
		AxisMapping axis = new AxisMapping(4, 2.0, 0.0, 1.0);
		PolarField polar = PolarField.build(axis, axis);
		double r0 = polar.getRadius(0);
		double a0 = polar.getAzimuth(0);
		Arrays.fill(polar.getRadius(), 0.0);
		Arrays.fill(polar.getAzimuth(), 0.0);
		assertEquals(r0, polar.getRadius(0),  0.0);
		assertEquals(a0, polar.getAzimuth(0), 0.0);
		assertEquals(r0, polar.getRadius()[0], 0.0);
	}

	@Test
	public void testNormalizeAngle() {
		assertEquals(0.0,             PolarField.normalizeAngle(0.0),             0.0);
		assertEquals(Math.PI,         PolarField.normalizeAngle(-Math.PI),        1e-12);
		assertEquals(0.5,             PolarField.normalizeAngle(0.5 + 4 * Math.PI), 1e-12);
		assertTrue(PolarField.normalizeAngle(-1e-300) < PolarField.TWO_PI);
	}
}
