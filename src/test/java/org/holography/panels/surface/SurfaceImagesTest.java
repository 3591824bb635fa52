package org.holography.panels.surface;

import static org.junit.Assert.assertEquals;

import ij.ImagePlus;
import ij.ImageStack;
import org.junit.Test;

public class SurfaceImagesTest {

	@Test
	public void testStackBeforeAndAfterCorrection() {
		SurfaceParameters sp = new SurfaceParameters();
		sp.panel_kind = "rigid";
		AntennaSurface surface = SyntheticSurfaces.withPanelOffsets(SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), sp);

		ImagePlus imp = SurfaceImages.makeStack(surface, false);
		assertEquals(3,  imp.getStackSize());
		assertEquals(64, imp.getWidth());
		assertEquals("ea01-deviation", imp.getTitle());

		surface.fitSurface();
		surface.correctSurface();
		imp = SurfaceImages.makeStack(surface, false);
		ImageStack stack = imp.getStack();
		assertEquals(5, stack.getSize());
		assertEquals("mask",         stack.getSliceLabel(2));
		assertEquals("residuals_mm", stack.getSliceLabel(5));

		double [] deviation = surface.getDeviation();
		boolean [] mask = surface.getMask();
		float [] mm =     (float []) stack.getPixels(3);
		float [] fmask =  (float []) stack.getPixels(2);
		for (int i = 0; i < deviation.length; i++) {
			assertEquals((float) (deviation[i] * 1000.0), mm[i], 0.0f);
			assertEquals(mask[i] ? 1.0f : 0.0f, fmask[i], 0.0f);
		}
	}

	@Test
	public void testPhaseStack() {
		int size = 64 * 64;
		SurfaceParameters sp = new SurfaceParameters();
		sp.deviation_is_phase = true;
		AntennaSurface surface = new AntennaSurface(SyntheticSurfaces.filled(size, 1.0), SyntheticSurfaces.filled(size, Math.PI / 4),
				SyntheticSurfaces.toyMetadata(), SyntheticSurfaces.toyTelescope(), sp);
		ImagePlus imp = SurfaceImages.makeStack(surface, true);
		assertEquals("phase_deg", imp.getStack().getSliceLabel(3));
		assertEquals(45.0f, ((float []) imp.getStack().getPixels(3))[1000], 1e-4f);
	}
}
