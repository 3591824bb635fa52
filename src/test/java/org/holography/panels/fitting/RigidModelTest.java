package org.holography.panels.fitting;

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;

public class RigidModelTest {

	@Test
	public void testIdentity() {
		double [][] system = {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};
		double [] vector = {3.0, -1.0, 0.5};
		assertArrayEquals(vector, RigidModel.solveNormal(system, vector), 1e-15);
	}

	@Test
	public void testNeedsPivoting() {
		double [][] system = {{0, 2, 1}, {1, 1, 1}, {2, 0, 3}};
		double [] expected = {1.0, -2.0, 0.5};
		double [] vector = new double [3];
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				vector[i] += system[i][j] * expected[j];
			}
		}
		assertArrayEquals(expected, RigidModel.solveNormal(system, vector), 1e-12);
		// inputs untouched
		assertArrayEquals(new double [] {0, 2, 1}, system[0], 0.0);
	}

	@Test
	public void testPlane() {
		double [] x = new double [12];
		double [] y = new double [12];
		double [] v = new double [12];
		for (int i = 0; i < 12; i++) {
			x[i] = i % 4;
			y[i] = i / 4;
			v[i] = 3.5 * x[i] - 2.0 * y[i] + 1.0;
		}
		assertArrayEquals(new double [] {3.5, -2.0, 1.0}, new RigidModel().solve(x, y, v), 1e-12);
	}

	@Test(expected = SingularMatrixException.class)
	public void testSingular() {
		RigidModel.solveNormal(new double [][] {{1, 2}, {2, 4}}, new double [] {1, 2});
	}

	@Test(expected = SingularMatrixException.class)
	public void testNearlySingular() {
		RigidModel.solveNormal(new double [][] {{1, 1}, {1, 1 + 1e-15}}, new double [] {1, 1});
	}

	@Test(expected = SingularMatrixException.class)
	public void testAllZero() {
		RigidModel.solveNormal(new double [3][3], new double [3]);
	}

	@Test(expected = SingularMatrixException.class)
	public void testCollinearSamples() {
		// all samples on the line y = x leave the plane undetermined
		new RigidModel().solve(new double [] {1, 2, 3, 4}, new double [] {1, 2, 3, 4}, new double [] {1, 2, 3, 4});
	}

	@Test(expected = IllegalArgumentException.class)
	public void testShapeMismatch() {
		RigidModel.solveNormal(new double [][] {{1, 0}, {0, 1}}, new double [3]);
	}
}
