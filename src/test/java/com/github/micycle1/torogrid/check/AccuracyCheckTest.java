package com.github.micycle1.torogrid.check;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.torogrid.MeshFixtures;
import com.github.micycle1.torogrid.data.Quantity;
import com.github.micycle1.torogrid.grid.Cartesian2D;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

public class AccuracyCheckTest {

	// mesh nodes coincide with the grid points, in the same order
	private static final Cartesian2D GRID = new Cartesian2D(0, 4, 5, 0, 4, 5);

	private static UnstructuredMesh mesh() {
		double[][] rz = MeshFixtures.lattice(0, 4, 5, 0, 4, 5);
		return UnstructuredMesh.of(rz[0], rz[1]);
	}

	private static double[] linear() {
		double[] v = new double[GRID.size()];
		for (int i = 0; i < v.length; i++) {
			v[i] = 1 + GRID.getR(i) + 3 * GRID.getZ(i);
		}
		return v;
	}

	private static AccuracyReport run(AccuracyCheck check, double[] nodes, double[] grid) {
		AccuracyReport.Builder report = new AccuracyReport.Builder(0.2);
		check.compare(Quantity.POTENTIAL, 0, 0, nodes, grid, report);
		return report.build();
	}

	@Test
	void comparesOnlyNodesStrictlyInsideTheGrid() {
		AccuracyCheck check = new AccuracyCheck(mesh(), GRID, 0.2);
		assertEquals(9, check.getComparedNodeCount());
		AccuracyCheck wide = new AccuracyCheck(mesh(), new Cartesian2D(-1, 5, 7, -1, 5, 7), 0.2);
		assertEquals(25, wide.getComparedNodeCount());
	}

	@Test
	void exactGriddingPasses() {
		AccuracyCheck check = new AccuracyCheck(mesh(), GRID, 0.2);
		double[] v = linear();
		AccuracyReport report = check.check(EnumSet.of(Quantity.POTENTIAL, Quantity.ION_DENSITY), 2, 3, (q, c, t) -> v, (q, c, t) -> v);
		assertTrue(report.isApplicable());
		assertTrue(report.passed());
		assertEquals(9 * 2 * 3, report.getCheckedCount(Quantity.POTENTIAL));
		assertEquals(9 * 2 * 3, report.getCheckedCount(Quantity.ION_DENSITY));
		assertEquals(0, report.getCheckedCount(Quantity.NONADIABATIC_ELECTRON_DENSITY));
	}

	@Test
	void flagsAPerturbedPoint() {
		AccuracyCheck check = new AccuracyCheck(mesh(), GRID, 0.2);
		double[] nodes = linear();
		double[] grid = linear();
		int centre = GRID.index(2, 2);
		grid[centre] *= 2;

		List<Violation> violations = run(check, nodes, grid).getViolations();
		assertEquals(1, violations.size());
		Violation v = violations.get(0);
		assertEquals(centre, v.getNode());
		assertEquals(Quantity.POTENTIAL, v.getQuantity());
		assertEquals(0, v.getCrossSection());
		assertEquals(0, v.getTime());
		assertEquals(2, v.getR(), 0);
		assertEquals(2, v.getZ(), 0);
		assertEquals(nodes[centre], v.getOriginal(), 0);
		assertEquals(2 * nodes[centre], v.getBackInterpolated(), 0);
		assertEquals(0.5, v.getError(), 1e-12);
	}

	@Test
	void ignoresInsignificantAndUndefinedErrors() {
		AccuracyCheck check = new AccuracyCheck(mesh(), GRID, 0.2);
		double[] nodes = linear();
		double[] grid = linear();
		int small = GRID.index(1, 1);
		int zero = GRID.index(3, 3);
		// below 1% of the largest compared value
		nodes[small] = 1e-3;
		grid[small] = 1e-2;
		// 0 / 0
		nodes[zero] = 0;
		grid[zero] = 0;
		assertTrue(run(check, nodes, grid).passed());
	}

	@Test
	void reportsWithoutThrowing() {
		AccuracyReport na = AccuracyReport.notApplicable(0.1);
		assertFalse(na.isApplicable());
		assertTrue(na.getViolations().isEmpty());
		assertThrows(IllegalArgumentException.class, () -> new AccuracyCheck(mesh(), GRID, 0));
	}

	@Test
	void bilinearInterpolationIsExactForBilinearData() {
		Cartesian2D grid = new Cartesian2D(0, 2, 3, 0, 1, 4);
		double[] v = new double[grid.size()];
		for (int i = 0; i < v.length; i++) {
			v[i] = grid.getR(i) * grid.getZ(i) + grid.getR(i) - grid.getZ(i);
		}
		BilinearGridInterpolator b = new BilinearGridInterpolator(grid, v);
		assertEquals(0.3 * 0.7 + 0.3 - 0.7, b.interpolate(0.3, 0.7), 1e-12);
		assertEquals(1.9 * 0.05 + 1.9 - 0.05, b.interpolate(1.9, 0.05), 1e-12);
		// clamped to the edge cell: linear continuation of the bilinear form
		assertEquals(2.5 * 0.5 + 2.5 - 0.5, b.interpolate(2.5, 0.5), 1e-12);
		assertThrows(IllegalArgumentException.class, () -> new BilinearGridInterpolator(grid, new double[2]));
	}
}
