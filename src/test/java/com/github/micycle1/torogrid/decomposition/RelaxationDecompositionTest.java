package com.github.micycle1.torogrid.decomposition;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class RelaxationDecompositionTest {

	private static double[][][] random(int planes, int times, int nodes, long seed) {
		Random rnd = new Random(seed);
		double[][][] a = new double[planes][times][nodes];
		for (double[][] p : a) {
			for (double[] t : p) {
				for (int i = 0; i < nodes; i++) {
					t[i] = rnd.nextGaussian() + 3;
				}
			}
		}
		return a;
	}

	@ParameterizedTest
	@ValueSource(longs = { 1L, 8L, 77L })
	void removingTheToroidalAverageIsIdempotent(long seed) {
		double[][][] raw = random(6, 3, 40, seed);
		double[][][] once = RelaxationDecomposition.removeToroidalAverage(raw);
		double[][][] twice = RelaxationDecomposition.removeToroidalAverage(once);
		for (int p = 0; p < once.length; p++) {
			for (int t = 0; t < once[p].length; t++) {
				assertArrayEquals(once[p][t], twice[p][t], 1e-12);
			}
		}
		for (double[] avg : RelaxationDecomposition.toroidalAverage(once)) {
			for (double v : avg) {
				assertEquals(0, v, 1e-12);
			}
		}
	}

	@Test
	void averagesAndLeavesInputUntouched() {
		double[][][] raw = { { { 1, 2 }, { 3, 4 } }, { { 5, 6 }, { 7, 8 } } };
		double[][] avg = RelaxationDecomposition.toroidalAverage(raw);
		assertArrayEquals(new double[] { 3, 4 }, avg[0], 0);
		assertArrayEquals(new double[] { 5, 6 }, avg[1], 0);
		assertArrayEquals(new double[] { 4, 5 }, RelaxationDecomposition.timeAverage(avg), 0);

		double[][][] centred = RelaxationDecomposition.removeToroidalAverage(raw);
		assertArrayEquals(new double[] { -2, -2 }, centred[0][0], 0);
		assertArrayEquals(new double[] { 2, 2 }, centred[1][1], 0);
		assertEquals(1, raw[0][0][0]);
	}

	@Test
	void meanSubtractionCentresEachTimestep() {
		double[][][] raw = random(4, 2, 10, 3L);
		double[][][] out = RelaxationDecomposition.removeTimestepMean(raw);
		for (int t = 0; t < 2; t++) {
			double sum = 0;
			for (double[][] plane : out) {
				for (double v : plane[t]) {
					sum += v;
				}
			}
			assertEquals(0, sum, 1e-10);
		}
		assertEquals(raw[1][1][1] - raw[2][1][4], out[1][1][1] - out[2][1][4], 1e-12);
	}

	@Test
	void adiabaticResponse() {
		double[][][] phi = { { { 0.5, 1, -2 } } };
		double[][][] dn = AdiabaticResponse.compute(phi, new double[] { 2, 4, 6 }, new double[] { 1, 2, 0 });
		assertArrayEquals(new double[] { 1, 2, 0 }, dn[0][0], 0);
	}

	@Test
	void filterZeroesOnlyOversizedFluctuations() {
		double[][][] dn = { { { 0.5, -3, 2.5 }, { -0.1, 1.9, -2.1 } } };
		int zeroed = FluctuationFilter.apply(dn, new double[] { 1, 2, 2 });
		assertEquals(3, zeroed);
		assertArrayEquals(new double[] { 0.5, 0, 0 }, dn[0][0], 0);
		assertArrayEquals(new double[] { -0.1, 1.9, 0 }, dn[0][1], 0);
	}
}
