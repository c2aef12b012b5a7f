package com.github.micycle1.torogrid.tracing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import java.util.function.IntPredicate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.torogrid.MeshFixtures;
import com.github.micycle1.torogrid.data.SimulationMesh;
import com.github.micycle1.torogrid.grid.CylindricalGrid;

public class NodeAdjacencyLandingEstimatorTest {

	private SimulationMesh mesh;

	// 11 x 11 lattice on [1, 2] x [-0.5, 0.5]; psi = R; each node leads to its +R neighbour
	@BeforeEach
	void setUp() {
		int nr = 11;
		double[][] rz = MeshFixtures.lattice(1, 2, nr, -0.5, 0.5, 11);
		int n = rz[0].length;
		int[] next = new int[n];
		for (int i = 0; i < n; i++) {
			next[i] = i % nr == nr - 1 ? -1 : i + 1;
		}
		mesh = SimulationMesh.of(rz[0], rz[1], rz[0].clone(), next);
	}

	@Test
	void movesAlongTheAnchorAdjacency() {
		CylindricalGrid grid = new CylindricalGrid(new double[] { 1.55 }, new double[] { 0 }, new double[] { Math.PI / 4 });
		PlaneIndexTable planes = new PlaneIndexTable(grid, 4, true);
		LandingPositions landing = new NodeAdjacencyLandingEstimator(mesh).estimate(new double[] { 1.55 }, new double[] { 0 }, planes);

		assertTrue(landing.isDefined(0));
		assertEquals(0.5, landing.getFractionPrev(0), 1e-12);
		// anchor is the node at R = 1.5; next at 1.6, previous at 1.4
		assertEquals(1.60, landing.getRNext(0), 1e-12);
		assertEquals(1.50, landing.getRPrev(0), 1e-12);
		assertEquals(0, landing.getZNext(0), 1e-12);
		assertEquals(0, landing.getZPrev(0), 1e-12);
	}

	@Test
	void withoutPreviousNodeMirrorsTheForwardMove() {
		CylindricalGrid grid = new CylindricalGrid(new double[] { 1.02 }, new double[] { 0.1 }, new double[] { Math.PI / 8 });
		PlaneIndexTable planes = new PlaneIndexTable(grid, 4, true);
		LandingPositions landing = new NodeAdjacencyLandingEstimator(mesh).estimate(new double[] { 1.02 }, new double[] { 0.1 }, planes);

		// anchor is node 66 at (1, 0.1), which no node leads to
		assertEquals(-1, mesh.getPrevNode(66));
		assertEquals(0.25, landing.getFractionPrev(0), 1e-12);
		assertEquals(1.02 + 0.75 * 0.1, landing.getRNext(0), 1e-12);
		assertEquals(1.02 - 0.25 * 0.1, landing.getRPrev(0), 1e-12);
	}

	@Test
	void pointsOutsideTheMeshStayPut() {
		CylindricalGrid grid = new CylindricalGrid(new double[] { 2.5 }, new double[] { 0 }, new double[] { 1.0 });
		PlaneIndexTable planes = new PlaneIndexTable(grid, 4, true);
		LandingPositions landing = new NodeAdjacencyLandingEstimator(mesh).estimate(new double[] { 2.5 }, new double[] { 0 }, planes);
		assertTrue(landing.isDefined(0));
		assertEquals(2.5, landing.getRPrev(0), 0);
		assertEquals(2.5, landing.getRNext(0), 0);
	}

	@Test
	void anchorFallsBackWhenNoInnerNodeExists() {
		NodeAdjacencyLandingEstimator est = new NodeAdjacencyLandingEstimator(mesh);
		// psi below every node: nearest node overall
		assertEquals(55, est.anchor(1.0, 0.0, -5));
		// psi exactly at the innermost surface: no node strictly inside, take the window
		int a = est.anchor(1.0, 0.0, 1.0);
		assertEquals(1.0, mesh.getMesh().getR(a), 1e-12);
	}

	@Test
	void anchorIsNearestNodeInTheFluxWindow() {
		double[][] rz = MeshFixtures.jitteredLattice(1, 2, 25, -0.5, 0.5, 25, 0.3, 13L);
		int n = rz[0].length;
		double[] psi = new double[n];
		for (int i = 0; i < n; i++) {
			psi[i] = Math.pow(rz[0][i] - 1.5, 2) + Math.pow(rz[1][i], 2);
		}
		SimulationMesh curved = SimulationMesh.of(rz[0], rz[1], psi, MeshFixtures.noAdjacency(n));
		NodeAdjacencyLandingEstimator est = new NodeAdjacencyLandingEstimator(curved);
		double w = curved.getPsiMax() / 10;
		Random rnd = new Random(6);
		for (int q = 0; q < 300; q++) {
			double r = 1 + rnd.nextDouble();
			double z = -0.5 + rnd.nextDouble();
			double p = -0.05 + 0.6 * rnd.nextDouble();
			int expected = nearest(rz, r, z, i -> psi[i] >= p - w && psi[i] < p);
			if (expected < 0) {
				expected = nearest(rz, r, z, i -> psi[i] >= p - w && psi[i] <= p + w);
			}
			if (expected < 0) {
				expected = nearest(rz, r, z, i -> true);
			}
			int found = est.anchor(r, z, p);
			assertEquals(Math.hypot(rz[0][expected] - r, rz[1][expected] - z), Math.hypot(rz[0][found] - r, rz[1][found] - z), 1e-15,
					"psi " + p + " at (" + r + ", " + z + ")");
		}
	}

	private static int nearest(double[][] rz, double r, double z, IntPredicate accept) {
		int best = -1;
		double bestD = Double.POSITIVE_INFINITY;
		for (int i = 0; i < rz[0].length; i++) {
			double d = Math.hypot(rz[0][i] - r, rz[1][i] - z);
			if (accept.test(i) && d < bestD) {
				bestD = d;
				best = i;
			}
		}
		return best;
	}
}
