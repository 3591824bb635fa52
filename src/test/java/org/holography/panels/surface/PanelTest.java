package org.holography.panels.surface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.holography.panels.fitting.PanelKind;
import org.junit.Test;

public class PanelTest {
	private static final double [][] SCREWS = {{0.0, 0.0}, {1.0, 0.0}, {0.0, 1.0}, {1.0, 1.0}};

	private static void addPlane(Panel panel, double a, double b, double c) {
		for (int iy = 0; iy < 5; iy++) {
			for (int ix = 0; ix < 5; ix++) {
				double x = 0.25 * ix;
				double y = 0.25 * iy;
				panel.addSample(new PanelSample(x, y, ix, iy, a * x + b * y + c));
			}
		}
	}

	@Test
	public void testRigidPlane() {
		Panel panel = new Panel(PanelKind.RIGID, "1-1", SCREWS);
		addPlane(panel, 0.001, -0.002, 0.003);
		assertNull(panel.getParameters());
		panel.solve();
		assertTrue(panel.isSolved());
		assertFalse(panel.fellBack());
		assertArrayEquals(new double [] {0.001, -0.002, 0.003}, panel.getParameters(), 1e-12);
		assertEquals(0.001 * 2 - 0.002 * 3 + 0.003, panel.correctionAt(2.0, 3.0), 1e-12);
	}

	@Test
	public void testMarginsCorrectedButNotFitted() {
		Panel panel = new Panel(PanelKind.RIGID, "1-2", SCREWS);
		addPlane(panel, 0.001, 0.0, 0.0);
		panel.addMargin(new PanelSample(2.0, 0.0, 10, 0, 5.0)); // far off the plane
		panel.solve();
		assertArrayEquals(new double [] {0.001, 0.0, 0.0}, panel.getParameters(), 1e-12);
		List<PanelCorrection> corrections = panel.getCorrections();
		assertEquals(26, corrections.size());
		PanelCorrection margin = corrections.get(25);
		assertEquals(10, margin.ix);
		assertEquals(0.002, margin.value, 1e-12);
	}

	@Test
	public void testFallbackTooFewSamples() {
		Panel panel = new Panel(PanelKind.XY_PARABOLOID, "2-3", SCREWS);
		panel.addSample(new PanelSample(0.0, 0.0, 0, 0, 0.001));
		panel.addSample(new PanelSample(1.0, 0.0, 1, 0, 0.003));
		panel.solve();
		assertTrue(panel.fellBack());
		assertNotNull(panel.getFallbackReason());
		assertEquals(PanelKind.MEAN, panel.getKind());
		assertEquals(PanelKind.XY_PARABOLOID, panel.getInitialKind());
		assertArrayEquals(new double [] {0.002}, panel.getParameters(), 1e-15);
	}

	@Test
	public void testFallbackNoSamples() {
		Panel panel = new Panel(PanelKind.ROTATED_PARABOLOID, "2-4", SCREWS);
		panel.solve();
		assertTrue(panel.fellBack());
		assertEquals(0.0, panel.correctionAt(0.5, 0.5), 0.0);
	}

	@Test
	public void testFallbackSingular() {
		// rigid ignores zero deviations, leaving an empty normal system
		Panel panel = new Panel(PanelKind.RIGID, "3-1", SCREWS);
		addPlane(panel, 0.0, 0.0, 0.0);
		panel.solve();
		assertTrue(panel.fellBack());
		assertEquals(PanelKind.MEAN, panel.getKind());
	}

	@Test
	public void testMeanDoesNotFallBack() {
		Panel panel = new Panel(PanelKind.MEAN, "3-2", SCREWS);
		panel.solve();
		assertFalse(panel.fellBack());
		assertArrayEquals(new double [] {0.0}, panel.getParameters(), 0.0);
	}

	@Test
	public void testScrewAdjustmentsUnits() {
		Panel panel = new Panel(PanelKind.MEAN, "4-1", SCREWS);
		panel.addSample(new PanelSample(0.5, 0.5, 0, 0, 0.00254));
		panel.solve();
		assertArrayEquals(new double [] {2.54, 2.54, 2.54, 2.54},     panel.getScrewAdjustments(LengthUnit.MM),   1e-12);
		assertArrayEquals(new double [] {100.0, 100.0, 100.0, 100.0}, panel.getScrewAdjustments(LengthUnit.MILS), 1e-9);
		assertTrue(panel.exportAdjustments(LengthUnit.MM).startsWith("4-1"));
	}

	@Test
	public void testEveryKindFitsItsOwnSurface() {
		for (PanelKind kind : PanelKind.values()) {
			Panel panel = new Panel(kind, kind.getName(), SCREWS);
			for (int iy = 0; iy < 6; iy++) {
				for (int ix = 0; ix < 6; ix++) {
					panel.addSample(new PanelSample(0.2 * ix, 0.2 * iy, ix, iy, 0.004));
				}
			}
			panel.solve();
			assertEquals(kind.getName(), 0.004, panel.correctionAt(0.5, 0.5), 1e-7);
		}
	}

	@Test
	public void testScrewsAreCopies() {
		double [][] screws = {{0.0, 0.0}, {1.0, 0.0}};
		Panel panel = new Panel(PanelKind.MEAN, "4-2", screws);
		screws[1][0] = 5.0;
		panel.getScrews()[0][1] = 7.0;
		assertArrayEquals(new double [] {0.0, 0.0}, panel.getScrews()[0], 0.0);
		assertArrayEquals(new double [] {1.0, 0.0}, panel.getScrews()[1], 0.0);
	}

	@Test(expected = IllegalStateException.class)
	public void testCorrectionsBeforeSolve() {
		new Panel(PanelKind.MEAN, "5-1", SCREWS).getCorrections();
	}

	@Test(expected = IllegalStateException.class)
	public void testNoSamplesAfterSolve() {
		Panel panel = new Panel(PanelKind.MEAN, "5-2", SCREWS);
		panel.solve();
		panel.addSample(new PanelSample(0.0, 0.0, 0, 0, 1.0));
	}
}
