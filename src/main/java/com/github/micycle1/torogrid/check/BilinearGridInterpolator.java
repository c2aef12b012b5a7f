package com.github.micycle1.torogrid.check;

import java.util.Objects;

import com.github.micycle1.torogrid.grid.Cartesian2D;

/**
 * Bilinear interpolation of values stored on a {@link Cartesian2D} grid, in
 * the grid's flat (NZ, NR) order.
 */
public final class BilinearGridInterpolator {

	private final double[] r1D;
	private final double[] z1D;
	private final double[] values;

	public BilinearGridInterpolator(Cartesian2D grid, double[] values) {
		Objects.requireNonNull(grid, "grid must not be null");
		if (values.length != grid.size()) {
			throw new IllegalArgumentException("Expected " + grid.size() + " grid values, got " + values.length);
		}
		this.r1D = grid.getR1D();
		this.z1D = grid.getZ1D();
		this.values = values.clone();
	}

	/**
	 * Interpolated value at (r, z); coordinates beyond the grid are clamped to
	 * the edge cells.
	 */
	public double interpolate(double r, double z) {
		int ir = cell(r1D, r);
		int iz = cell(z1D, z);
		double tr = (r - r1D[ir]) / (r1D[ir + 1] - r1D[ir]);
		double tz = (z - z1D[iz]) / (z1D[iz + 1] - z1D[iz]);
		int nr = r1D.length;
		double v00 = values[iz * nr + ir];
		double v01 = values[iz * nr + ir + 1];
		double v10 = values[(iz + 1) * nr + ir];
		double v11 = values[(iz + 1) * nr + ir + 1];
		double v0 = v00 + tr * (v01 - v00);
		double v1 = v10 + tr * (v11 - v10);
		return v0 + tz * (v1 - v0);
	}

	// index of the lower corner of the cell holding x
	private static int cell(double[] a, double x) {
		int lo = 0, hi = a.length - 1;
		if (x <= a[0]) {
			return 0;
		}
		if (x >= a[hi]) {
			return hi - 1;
		}
		while (lo + 1 < hi) {
			int mid = (lo + hi) >>> 1;
			if (a[mid] > x) {
				hi = mid;
			} else {
				lo = mid;
			}
		}
		return lo;
	}
}
