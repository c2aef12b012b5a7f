package com.github.micycle1.torogrid.data;

/**
 * Piecewise-linear 1-D profile f(ψ) with a constant fill value outside the
 * tabulated ψ range.
 */
public final class ProfileInterpolator {

	private final double[] psi;
	private final double[] values;
	private final double fill;

	public ProfileInterpolator(double[] psi, double[] values, double fill) {
		if (psi == null || values == null || psi.length != values.length) {
			throw new IllegalArgumentException("psi and values must be non-null and of equal length");
		}
		if (psi.length < 2) {
			throw new IllegalArgumentException("A profile needs at least 2 samples");
		}
		for (int i = 1; i < psi.length; i++) {
			if (!(psi[i] > psi[i - 1])) {
				throw new IllegalArgumentException("Profile psi must be strictly increasing (index " + i + ")");
			}
		}
		this.psi = psi.clone();
		this.values = values.clone();
		this.fill = fill;
	}

	public double value(double p) {
		if (!(p >= psi[0] && p <= psi[psi.length - 1])) {
			return fill;
		}
		int lo = 0, hi = psi.length - 1;
		while (hi - lo > 1) {
			int mid = (lo + hi) >>> 1;
			if (psi[mid] > p) {
				hi = mid;
			} else {
				lo = mid;
			}
		}
		double t = (p - psi[lo]) / (psi[hi] - psi[lo]);
		return values[lo] + t * (values[hi] - values[lo]);
	}

	public double[] values(double[] p) {
		double[] out = new double[p.length];
		for (int i = 0; i < p.length; i++) {
			out[i] = value(p[i]);
		}
		return out;
	}

	public double getFill() {
		return fill;
	}
}
