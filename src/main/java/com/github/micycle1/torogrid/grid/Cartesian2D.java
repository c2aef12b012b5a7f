package com.github.micycle1.torogrid.grid;

/**
 * Rectangular poloidal grid. Shape is (NZ, NR); point {@code iz * NR + ir} sits
 * at (R1D[ir], Z1D[iz]).
 */
public final class Cartesian2D implements StructuredGrid {

	private final double[] r1D;
	private final double[] z1D;

	public Cartesian2D(double rMin, double rMax, int nr, double zMin, double zMax, int nz) {
		this(Axes.linspace(rMin, rMax, nr, "R"), Axes.linspace(zMin, zMax, nz, "Z"));
	}

	public Cartesian2D(double[] r1D, double[] z1D) {
		this.r1D = Axes.checked(r1D, 2, "R");
		this.z1D = Axes.checked(z1D, 2, "Z");
	}

	@Override
	public int getDimension() {
		return 2;
	}

	@Override
	public int size() {
		return r1D.length * z1D.length;
	}

	@Override
	public int[] getShape() {
		return new int[] { z1D.length, r1D.length };
	}

	@Override
	public double getR(int i) {
		return r1D[i % r1D.length];
	}

	@Override
	public double getZ(int i) {
		return z1D[i / r1D.length];
	}

	public int index(int iz, int ir) {
		return iz * r1D.length + ir;
	}

	public double[] getR1D() {
		return r1D.clone();
	}

	public double[] getZ1D() {
		return z1D.clone();
	}

	public int getNR() {
		return r1D.length;
	}

	public int getNZ() {
		return z1D.length;
	}

	@Override
	public String toString() {
		return "Cartesian2D[R " + r1D[0] + ".." + r1D[r1D.length - 1] + " (" + r1D.length + "), Z " + z1D[0] + ".." + z1D[z1D.length - 1] + " ("
				+ z1D.length + ")]";
	}
}
