package com.github.micycle1.torogrid.grid;

import com.github.micycle1.torogrid.MeshConstructionException;

/**
 * Tensor-product grid in cylindrical coordinates. Shape is (NPHI, NZ, NR);
 * point {@code (ip * NZ + iz) * NR + ir} sits at (R1D[ir], Z1D[iz], PHI1D[ip]).
 * Angles are wrapped into [0, 2π) on construction and need not be sorted.
 */
public final class CylindricalGrid implements ToroidalGrid {

	private final double[] r1D;
	private final double[] z1D;
	private final double[] phi1D;

	public CylindricalGrid(double[] r1D, double[] z1D, double[] phi1D) {
		this.r1D = Axes.checked(r1D, 1, "R");
		this.z1D = Axes.checked(z1D, 1, "Z");
		if (phi1D == null || phi1D.length == 0) {
			throw new MeshConstructionException("PHI axis needs at least 1 point");
		}
		this.phi1D = new double[phi1D.length];
		for (int i = 0; i < phi1D.length; i++) {
			if (!Double.isFinite(phi1D[i])) {
				throw new MeshConstructionException("PHI axis has a non-finite value at " + i);
			}
			this.phi1D[i] = ToroidalGrid.wrapAngle(phi1D[i]);
		}
	}

	@Override
	public int size() {
		return r1D.length * z1D.length * phi1D.length;
	}

	@Override
	public int[] getShape() {
		return new int[] { phi1D.length, z1D.length, r1D.length };
	}

	@Override
	public double getR(int i) {
		return r1D[i % r1D.length];
	}

	@Override
	public double getZ(int i) {
		return z1D[(i / r1D.length) % z1D.length];
	}

	@Override
	public double getPhi(int i) {
		return phi1D[i / (r1D.length * z1D.length)];
	}

	public int index(int ip, int iz, int ir) {
		return (ip * z1D.length + iz) * r1D.length + ir;
	}

	@Override
	public String toString() {
		return "CylindricalGrid[" + r1D.length + " x " + z1D.length + " x " + phi1D.length + "]";
	}
}
