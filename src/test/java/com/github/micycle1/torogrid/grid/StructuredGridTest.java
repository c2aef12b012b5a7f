package com.github.micycle1.torogrid.grid;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.github.micycle1.torogrid.MeshConstructionException;

public class StructuredGridTest {

	@Test
	void cartesian2DIsZMajor() {
		Cartesian2D g = new Cartesian2D(1, 2, 3, -1, 1, 5);
		assertEquals(2, g.getDimension());
		assertEquals(15, g.size());
		assertArrayEquals(new int[] { 5, 3 }, g.getShape());
		assertEquals(3, g.getNR());
		assertEquals(5, g.getNZ());
		int i = g.index(4, 1);
		assertEquals(13, i);
		assertEquals(1.5, g.getR(i), 1e-15);
		assertEquals(1, g.getZ(i), 1e-15);
	}

	@Test
	void cartesian3DConvertsToCylindrical() {
		Cartesian3D g = new Cartesian3D(new double[] { -1, 0, 1 }, new double[] { -0.5, 0.5 }, new double[] { -1, 0, 1 });
		assertEquals(3, g.getDimension());
		assertArrayEquals(new int[] { 3, 2, 3 }, g.getShape());

		int i = g.index(1, 1, 2); // X = 1, Y = 0.5, Z = 0
		assertEquals(1, g.getR(i), 1e-15);
		assertEquals(0.5, g.getZ(i), 0);
		assertEquals(0, g.getPhi(i), 0);

		// φ grows opposite to Cartesian Z
		assertEquals(Math.PI / 2, g.getPhi(g.index(0, 0, 1)), 1e-15); // X = 0, Z = -1
		assertEquals(3 * Math.PI / 2, g.getPhi(g.index(2, 0, 1)), 1e-15); // X = 0, Z = 1
		assertEquals(Math.PI, g.getPhi(g.index(1, 0, 0)), 1e-15); // X = -1, Z = 0
		assertEquals(Math.sqrt(2), g.getR(g.index(2, 1, 2)), 1e-15);
		assertEquals(-1, g.getCartesianZ(g.index(0, 1, 2)), 0);
		assertEquals(-0.5, g.getY(g.index(2, 0, 0)), 0);
	}

	@Test
	void cylindricalGridWrapsAngles() {
		CylindricalGrid g = new CylindricalGrid(new double[] { 1, 2 }, new double[] { 0 }, new double[] { -Math.PI / 2, 2 * Math.PI });
		assertArrayEquals(new int[] { 2, 1, 2 }, g.getShape());
		assertEquals(3 * Math.PI / 2, g.getPhi(g.index(0, 0, 1)), 1e-15);
		assertEquals(0, g.getPhi(g.index(1, 0, 0)), 0);
		assertEquals(2, g.getR(g.index(1, 0, 1)), 0);
	}

	@Test
	void rejectsBadAxes() {
		assertThrows(MeshConstructionException.class, () -> new Cartesian2D(1, 2, 1, 0, 1, 3));
		assertThrows(MeshConstructionException.class, () -> new Cartesian2D(2, 1, 3, 0, 1, 3));
		assertThrows(MeshConstructionException.class, () -> new Cartesian2D(new double[] { 0, 2, 1 }, new double[] { 0, 1 }));
		assertThrows(MeshConstructionException.class, () -> new CylindricalGrid(new double[] { 1 }, new double[] { 0 }, new double[0]));
	}
}
