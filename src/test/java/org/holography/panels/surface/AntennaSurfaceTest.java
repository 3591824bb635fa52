package org.holography.panels.surface;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.holography.panels.geometry.ApertureMetadata;
import org.holography.panels.geometry.PolarField;
import org.holography.panels.geometry.TelescopeGeometry;
import org.junit.Test;

public class AntennaSurfaceTest {

	private static AntennaSurface flat(ApertureMetadata metadata, TelescopeGeometry telescope, SurfaceParameters sp) {
		int size = metadata.npix * metadata.npix;
		return new AntennaSurface(SyntheticSurfaces.filled(size, 1.0), new double [size], metadata, telescope, sp);
	}

	@Test
	public void testFlatSurface() {
		SurfaceParameters sp = new SurfaceParameters();
		sp.panel_kind = "mean";
		AntennaSurface surface = flat(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), sp);
		assertEquals(24, surface.getPanels().size());
		assertArrayEquals(new double [] {0.0}, surface.getRms(), 0.0);
		double [][] gains = surface.gains();
		assertEquals(1, gains.length);
		assertEquals(gains[0][0], gains[0][1], 1e-12);
		double resolution = 10.0 / 64;
		double thgain = 4.0 * Math.PI * Math.pow(1000.0 * resolution / SyntheticSurfaces.WAVELENGTH, 2);
		assertEquals(10.0 * Math.log10(thgain), gains[0][1], 1e-9);

		surface.fitSurface();
		surface.correctSurface();
		assertTrue(surface.isCorrected());
		assertArrayEquals(new double [] {0.0, 0.0}, surface.getRms(), 1e-9);
		assertEquals(2, surface.gains().length);
	}

	@Test
	public void testMask() {
		ApertureMetadata metadata = SyntheticSurfaces.toyMetadata();
		int size = metadata.npix * metadata.npix;
		double [] amplitude = SyntheticSurfaces.filled(size, 1.0);
		double [] deviation = new double [size];
		PolarField polar = PolarField.build(metadata.x_axis, metadata.y_axis);
		int low = -1, blank = -1, hole = -1;
		for (int i = 0; i < size; i++) {
			double r = polar.getRadius(i);
			if ((r > 2.0) && (r < 4.0)) {
				if (low < 0) low = i;
				else if (blank < 0) blank = i;
			}
			if ((hole < 0) && (r < 0.5)) hole = i;
		}
		amplitude[low] =   0.2;        // below 0.21 of the maximum
		deviation[blank] = Double.NaN;
		amplitude[0] =     Double.NaN;
		AntennaSurface surface = new AntennaSurface(amplitude, deviation, metadata, SyntheticSurfaces.toyTelescope(), new SurfaceParameters());
		boolean [] mask = surface.getMask();
		assertFalse(mask[low]);
		assertFalse(mask[blank]);
		assertFalse(mask[hole]);
		assertFalse(mask[0]);
		for (int i = 0; i < size; i++) {
			double r = polar.getRadius(i);
			if ((i != low) && (i != blank) && (r >= 1.0) && (r <= 4.9)) {
				assertTrue("pixel "+i, mask[i]);
			}
		}
	}

	@Test
	public void testPanelOffsetsCorrectedRigid() {
		SurfaceParameters sp = new SurfaceParameters();
		sp.panel_kind = "rigid";
		AntennaSurface surface = SyntheticSurfaces.withPanelOffsets(SyntheticSurfaces.vlaMetadata(), TelescopeGeometry.vla(), sp);
		surface.fitSurface();
		surface.correctSurface();
		double [] rms = surface.getRms();
		assertTrue(rms[0] > 0.1);
		assertEquals(0.0, rms[1], 1e-9);
		double [] deviation =   surface.getDeviation();
		double [] corrections = surface.getCorrections();
		double [] residuals =   surface.getResiduals();
		boolean [] mask =       surface.getMask();
		for (int i = 0; i < mask.length; i++) {
			if (mask[i]) {
				assertEquals(-deviation[i], corrections[i], 1e-12);
			} else {
				assertTrue(Double.isNaN(residuals[i]));
				assertTrue(Double.isNaN(corrections[i]));
			}
		}
		double [][] gains = surface.gains();
		assertEquals(gains[1][0], gains[1][1], 1e-9);
		// actual gain first, below the theoretical one before correction
		assertTrue(gains[0][0] < gains[0][1]);
		assertTrue(gains[0][0] < gains[1][0]);
	}

	@Test
	public void testPanelOffsetsCorrectedDefaultKind() {
		AntennaSurface surface = SyntheticSurfaces.withPanelOffsets(SyntheticSurfaces.vlaMetadata(), TelescopeGeometry.vla(), new SurfaceParameters());
		assertEquals("rotatedparaboloid", surface.getPanelKind().getName());
		surface.fitSurface();
		surface.correctSurface();
		assertEquals(0.0, surface.getRms()[1], 1e-3);
	}

	@Test
	public void testPolarFieldNotWritableFromOutside() {
		SurfaceParameters sp = new SurfaceParameters();
		sp.panel_kind = "rigid";
		AntennaSurface surface = SyntheticSurfaces.withPanelOffsets(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), sp);
		double [] phase = surface.getPhase();
		Arrays.fill(surface.getPolarField().getRadius(),  0.0);
		Arrays.fill(surface.getPolarField().getAzimuth(), 0.0);
		assertArrayEquals(phase, surface.deviationToPhase(surface.getDeviation()), 0.0);
		surface.fitSurface();
		surface.correctSurface();
		assertEquals(0, surface.getNumFallbacks());
		assertEquals(0.0, surface.getRms()[1], 1e-9);
	}

	@Test
	public void testFallbacksCounted() {
		ApertureMetadata metadata = SyntheticSurfaces.toyMetadata();
		int size = metadata.npix * metadata.npix;
		PolarField polar = PolarField.build(metadata.x_axis, metadata.y_axis);
		double [] amplitude = new double [size];
		double [] deviation = new double [size];
		for (int i = 0; i < size; i++) {
			if (polar.getRadius(i) < 3.0) {
				amplitude[i] = 1.0; // outer ring stays below the cutoff
			}
			deviation[i] = 2.0e-4;
		}
		SurfaceParameters sp = new SurfaceParameters();
		sp.panel_kind = "rigid";
		AntennaSurface surface = new AntennaSurface(amplitude, deviation, metadata, SyntheticSurfaces.toyTelescope(), sp);
		surface.fitSurface();
		assertEquals(16, surface.getNumFallbacks());
		assertTrue(surface.fetchPanel(2, 1).fellBack());
		assertFalse(surface.fetchPanel(1, 1).fellBack());
	}

	@Test
	public void testPhaseConversion() {
		ApertureMetadata metadata = SyntheticSurfaces.toyMetadata();
		TelescopeGeometry toy = SyntheticSurfaces.toyTelescope();
		int size = metadata.npix * metadata.npix;
		SurfaceParameters sp = new SurfaceParameters();
		sp.deviation_is_phase = true;
		double [] phase = SyntheticSurfaces.filled(size, 0.3);
		AntennaSurface surface = new AntennaSurface(SyntheticSurfaces.filled(size, 1.0), phase, metadata, toy, sp);
		assertArrayEquals(phase, surface.getPhase(), 0.0);
		double [] deviation = surface.getDeviation();
		double r = surface.getPolarField().getRadius(100);
		double f4 = 4.0 * toy.getFocus();
		double expected = SyntheticSurfaces.WAVELENGTH / (4.0 * Math.PI * f4) * 0.3 * Math.sqrt(r * r + f4 * f4);
		assertEquals(expected, deviation[100], 1e-15);
		assertArrayEquals(phase, surface.deviationToPhase(deviation), 1e-12);
	}

	@Test
	public void testFetchPanel() {
		AntennaSurface surface = flat(SyntheticSurfaces.vlaMetadata(), TelescopeGeometry.vla(), new SurfaceParameters());
		assertEquals("2-5",  surface.fetchPanel(2, 5).getLabel());
		assertEquals("6-40", surface.fetchPanel(6, 40).getLabel());
		assertEquals(1,      surface.fetchPanel(1, 1).getPanelNumber());
		try {
			surface.fetchPanel(1, 13);
			fail("ring 1 has 12 panels");
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("13"));
		}
	}

	@Test(expected = UnsolvedSurfaceException.class)
	public void testCorrectBeforeFit() {
		flat(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), new SurfaceParameters()).correctSurface();
	}

	@Test(expected = UnsolvedSurfaceException.class)
	public void testResidualsBeforeCorrection() {
		AntennaSurface surface = flat(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), new SurfaceParameters());
		surface.fitSurface();
		surface.getResiduals();
	}

	@Test(expected = IllegalStateException.class)
	public void testFitTwice() {
		AntennaSurface surface = flat(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), new SurfaceParameters());
		surface.fitSurface();
		surface.fitSurface();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSizeMismatch() {
		new AntennaSurface(new double [10], new double [10], SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), new SurfaceParameters());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNotRinged() {
		TelescopeGeometry flat_panels = new TelescopeGeometry("ALMA", 12.0, 4.8, false, new double [0], new double [0], new int [0]);
		flat(SyntheticSurfaces.toyMetadata(), flat_panels, new SurfaceParameters());
	}
}
