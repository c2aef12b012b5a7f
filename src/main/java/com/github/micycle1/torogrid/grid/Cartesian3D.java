package com.github.micycle1.torogrid.grid;

/**
 * Rectangular 3-D grid in machine Cartesian coordinates. X is the horizontal
 * axis lying in the φ = 0 plane, Y is vertical, Z completes the right-handed
 * set. Shape is (NZ, NY, NX); point {@code (iz * NY + iy) * NX + ix} sits at
 * (X1D[ix], Y1D[iy], Z1D[iz]).
 * <p>
 * Cylindrical coordinates follow R = sqrt(X² + Z²), z = Y and φ = atan2(-Z, X)
 * in [0, 2π): φ increases opposite to the Cartesian Z axis, so that both X-Y-Z
 * and R-φ-z are right-handed.
 */
public final class Cartesian3D implements ToroidalGrid {

	private final double[] x1D;
	private final double[] y1D;
	private final double[] z1D;
	private final double[] r3D;
	private final double[] phi3D;

	public Cartesian3D(double xMin, double xMax, int nx, double yMin, double yMax, int ny, double zMin, double zMax, int nz) {
		this(Axes.linspace(xMin, xMax, nx, "X"), Axes.linspace(yMin, yMax, ny, "Y"), Axes.linspace(zMin, zMax, nz, "Z"));
	}

	public Cartesian3D(double[] x1D, double[] y1D, double[] z1D) {
		this.x1D = Axes.checked(x1D, 1, "X");
		this.y1D = Axes.checked(y1D, 1, "Y");
		this.z1D = Axes.checked(z1D, 1, "Z");
		int n = size();
		r3D = new double[n];
		phi3D = new double[n];
		for (int i = 0; i < n; i++) {
			double x = getX(i);
			double z = getCartesianZ(i);
			r3D[i] = Math.hypot(x, z);
			phi3D[i] = ToroidalGrid.wrapAngle(Math.atan2(-z, x));
		}
	}

	@Override
	public int size() {
		return x1D.length * y1D.length * z1D.length;
	}

	@Override
	public int[] getShape() {
		return new int[] { z1D.length, y1D.length, x1D.length };
	}

	@Override
	public double getR(int i) {
		return r3D[i];
	}

	/** Vertical coordinate: the Cartesian Y of point i. */
	@Override
	public double getZ(int i) {
		return y1D[(i / x1D.length) % y1D.length];
	}

	@Override
	public double getPhi(int i) {
		return phi3D[i];
	}

	public double getX(int i) {
		return x1D[i % x1D.length];
	}

	public double getY(int i) {
		return getZ(i);
	}

	/** Cartesian Z (horizontal, out of the φ = 0 plane) of point i. */
	public double getCartesianZ(int i) {
		return z1D[i / (x1D.length * y1D.length)];
	}

	public int index(int iz, int iy, int ix) {
		return (iz * y1D.length + iy) * x1D.length + ix;
	}

	@Override
	public String toString() {
		return "Cartesian3D[" + x1D.length + " x " + y1D.length + " x " + z1D.length + "]";
	}
}
