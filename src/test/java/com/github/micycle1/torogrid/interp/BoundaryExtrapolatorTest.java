package com.github.micycle1.torogrid.interp;

import static org.junit.jupiter.api.Assertions.*;

import java.util.function.DoubleBinaryOperator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.github.micycle1.torogrid.MeshFixtures;
import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;
import com.github.micycle1.torogrid.mesh.MaskedValues;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

public class BoundaryExtrapolatorTest {

	private static UnstructuredMesh unitSquare() {
		double[][] rz = MeshFixtures.lattice(0, 1, 5, 0, 1, 5);
		return UnstructuredMesh.of(rz[0], rz[1]);
	}

	private static CloughTocherInterpolant field(UnstructuredMesh mesh, DoubleBinaryOperator f) {
		double[] v = new double[mesh.getNodeCount()];
		for (int i = 0; i < v.length; i++) {
			v[i] = f.applyAsDouble(mesh.getR(i), mesh.getZ(i));
		}
		return mesh.interpolant(v);
	}

	@ParameterizedTest
	@CsvSource({ "1.5, 0.5", "-0.3, 0.2", "0.6, 1.8", "2, 2", "-1, -1" })
	void linearFieldsExtrapolateExactly(double r, double z) {
		UnstructuredMesh mesh = unitSquare();
		BoundaryExtrapolator ext = new BoundaryExtrapolator(mesh);
		assertEquals(2 * r + 3 * z + 1, ext.extrapolate(field(mesh, (a, b) -> 2 * a + 3 * b + 1), r, z), 1e-9);
	}

	@Test
	void usesNearestHullVertexAndItsGradient() {
		UnstructuredMesh mesh = unitSquare();
		CloughTocherInterpolant f = field(mesh, (a, b) -> Math.exp(a) * Math.cos(b));
		BoundaryExtrapolator ext = new BoundaryExtrapolator(mesh);

		double r = 1.4, z = 0.55;
		int v = mesh.nearestHullVertex(r, z);
		assertEquals(1.0, mesh.getR(v), 0);
		assertEquals(0.5, mesh.getZ(v), 0);
		double expected = f.getNodeValue(v) + 0.4 * f.getNodeGradientR(v) + (z - 0.5) * f.getNodeGradientZ(v);
		assertEquals(expected, ext.extrapolate(f, r, z), 1e-12);
	}

	@Test
	void fillsOnlyUndefinedEntries() {
		UnstructuredMesh mesh = unitSquare();
		CloughTocherInterpolant f = field(mesh, (a, b) -> a * a + b);
		BoundaryExtrapolator ext = new BoundaryExtrapolator(mesh);
		double[] r = { 0.3, 1.2, 0.7, -0.5 };
		double[] z = { 0.3, 0.5, 0.9, 0.0 };
		MaskedValues inside = f.evaluate(r, z);
		double[] all = ext.evaluate(f, r, z);

		assertEquals(inside.get(0), all[0], 0);
		assertEquals(inside.get(2), all[2], 0);
		assertEquals(ext.extrapolate(f, 1.2, 0.5), all[1], 0);
		assertEquals(ext.extrapolate(f, -0.5, 0.0), all[3], 0);
		for (double v : all) {
			assertTrue(Double.isFinite(v));
		}
	}
}
