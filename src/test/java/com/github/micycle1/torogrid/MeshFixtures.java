package com.github.micycle1.torogrid;

import java.util.Arrays;
import java.util.Random;

import com.github.micycle1.torogrid.data.EquilibriumProfiles;

/**
 * Small synthetic meshes shared by the tests.
 */
public final class MeshFixtures {

	private MeshFixtures() {
	}

	/** Regular nr x nz lattice on [r0, r1] x [z0, z1]; node iz * nr + ir. */
	public static double[][] lattice(double r0, double r1, int nr, double z0, double z1, int nz) {
		double[] r = new double[nr * nz];
		double[] z = new double[nr * nz];
		for (int iz = 0; iz < nz; iz++) {
			for (int ir = 0; ir < nr; ir++) {
				int i = iz * nr + ir;
				r[i] = r0 + (r1 - r0) * ir / (nr - 1);
				z[i] = z0 + (z1 - z0) * iz / (nz - 1);
			}
		}
		return new double[][] { r, z };
	}

	/** Lattice with interior nodes jittered by up to jitter cell widths. */
	public static double[][] jitteredLattice(double r0, double r1, int nr, double z0, double z1, int nz, double jitter, long seed) {
		double[][] rz = lattice(r0, r1, nr, z0, z1, nz);
		Random rnd = new Random(seed);
		double dr = (r1 - r0) / (nr - 1);
		double dz = (z1 - z0) / (nz - 1);
		for (int iz = 1; iz < nz - 1; iz++) {
			for (int ir = 1; ir < nr - 1; ir++) {
				int i = iz * nr + ir;
				rz[0][i] += (rnd.nextDouble() * 2 - 1) * jitter * dr;
				rz[1][i] += (rnd.nextDouble() * 2 - 1) * jitter * dz;
			}
		}
		return rz;
	}

	/** Flat profiles: Te = 1, Ti = 1, ne = ni = 2 over psi in [-10, 10]. */
	public static EquilibriumProfiles flatProfiles() {
		double[] psi = { -10, 10 };
		return new EquilibriumProfiles(psi, new double[] { 1, 1 }, new double[] { 1, 1 }, new double[] { 2, 2 }, new double[] { 2, 2 });
	}

	public static double[] constant(int n, double v) {
		double[] a = new double[n];
		Arrays.fill(a, v);
		return a;
	}

	/** nextNode with -1 everywhere. */
	public static int[] noAdjacency(int n) {
		int[] a = new int[n];
		Arrays.fill(a, -1);
		return a;
	}
}
