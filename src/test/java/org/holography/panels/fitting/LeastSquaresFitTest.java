package org.holography.panels.fitting;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class LeastSquaresFitTest {

	@Test
	public void testLineFit() {
		double [][] design = new double [10][];
		double [] values = new double [10];
		for (int i = 0; i < 10; i++) {
			design[i] = new double [] {i, 1.0};
			values[i] = 0.5 * i - 2.0;
		}
		LeastSquaresFit fit = LeastSquaresFit.solve(design, values);
		assertArrayEquals(new double [] {0.5, -2.0}, fit.getSolution(), 1e-12);
		assertEquals(2, fit.getRank());
		assertEquals(0.0, fit.getResidualSum(), 1e-20);
	}

	@Test
	public void testRankDeficientMinimumNorm() {
		// two identical columns: any a + b = 2 fits, minimum norm gives a = b = 1
		double [][] design = {{1, 1}, {1, 1}, {1, 1}};
		double [] values = {2, 2, 2};
		LeastSquaresFit fit = LeastSquaresFit.solve(design, values);
		assertEquals(1, fit.getRank());
		assertArrayEquals(new double [] {1.0, 1.0}, fit.getSolution(), 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnderdetermined() {
		LeastSquaresFit.solve(new double [][] {{1, 2, 3}}, new double [] {1});
	}

	@Test(expected = SingularMatrixException.class)
	public void testNaN() {
		LeastSquaresFit.solve(new double [][] {{1, 0}, {0, 1}, {1, 1}}, new double [] {1, Double.NaN, 2});
	}
}
