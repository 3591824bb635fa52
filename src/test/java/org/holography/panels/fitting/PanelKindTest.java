package org.holography.panels.fitting;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PanelKindTest {

	@Test
	public void testNames() {
		assertEquals(PanelKind.RIGID,                PanelKind.fromName("rigid"));
		assertEquals(PanelKind.ROTATED_PARABOLOID,   PanelKind.fromName("RotatedParaboloid"));
		assertEquals(PanelKind.COROTATED_LST_SQ,     PanelKind.fromName(" corotated_lst_sq "));
		assertEquals(PanelKind.COROTATED_PARABOLOID, PanelKind.fromName("COROTATED_PARABOLOID"));
		for (PanelKind kind : PanelKind.values()) {
			assertEquals(kind, PanelKind.fromName(kind.toString()));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownName() {
		PanelKind.fromName("hexagonal");
	}

	@Test
	public void testModelsMatchParameterCounts() {
		PanelLmaParameters plp = new PanelLmaParameters();
		for (PanelKind kind : PanelKind.values()) {
			PanelModel model = kind.createModel(new double [] {1.0, 2.0}, 0.3, plp);
			assertEquals(kind.getName(), kind.getNumParameters(), model.getNumParameters());
		}
		assertTrue(PanelKind.LEAST_SQUARES.createModel(new double [2], 0.0, plp) instanceof LeastSquaresParaboloidModel);
	}
}
