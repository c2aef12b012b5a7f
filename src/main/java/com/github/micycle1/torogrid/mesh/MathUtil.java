package com.github.micycle1.torogrid.mesh;

final class MathUtil {

	private MathUtil() {
	}

	/*
	 * Affine map from (x,y) to the first two barycentric coordinates of triangle
	 * (x0,y0)-(x1,y1)-(x2,y2), stored as {d0/dx, d0/dy, d1/dx, d1/dy, x2, y2} so
	 * that b0 = t[0]*(x-t[4]) + t[1]*(y-t[5]) and b1 likewise. Returns false for a
	 * zero-area triangle.
	 */
	public static boolean barycentricTransform(double x0, double y0, double x1, double y1, double x2, double y2, double[] t, int offset) {
		double det = (y1 - y2) * (x0 - x2) + (x2 - x1) * (y0 - y2);
		if (det == 0.0 || !Double.isFinite(det)) {
			return false;
		}
		t[offset] = (y1 - y2) / det;
		t[offset + 1] = (x2 - x1) / det;
		t[offset + 2] = (y2 - y0) / det;
		t[offset + 3] = (x0 - x2) / det;
		t[offset + 4] = x2;
		t[offset + 5] = y2;
		return true;
	}

	// Fills b[0..2] from a transform written by barycentricTransform.
	public static void barycentric(double[] t, int offset, double x, double y, double[] b) {
		double dx = x - t[offset + 4];
		double dy = y - t[offset + 5];
		b[0] = t[offset] * dx + t[offset + 1] * dy;
		b[1] = t[offset + 2] * dx + t[offset + 3] * dy;
		b[2] = 1.0 - b[0] - b[1];
	}

	// x^e for the small non-negative exponents of a cubic Bernstein term
	public static double ipow(double x, int e) {
		switch (e) {
			case 0:
				return 1.0;
			case 1:
				return x;
			case 2:
				return x * x;
			default:
				return x * x * x;
		}
	}
}
