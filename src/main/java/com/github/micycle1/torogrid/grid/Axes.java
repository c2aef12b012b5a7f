package com.github.micycle1.torogrid.grid;

import com.github.micycle1.torogrid.MeshConstructionException;

final class Axes {

	private Axes() {
	}

	// n evenly spaced values from min to max inclusive
	static double[] linspace(double min, double max, int n, String name) {
		if (n < 2) {
			throw new MeshConstructionException(name + " axis needs at least 2 points, got " + n);
		}
		if (!(max > min) || !Double.isFinite(min) || !Double.isFinite(max)) {
			throw new MeshConstructionException(name + " axis range [" + min + ", " + max + "] is empty or non-finite");
		}
		double[] a = new double[n];
		double step = (max - min) / (n - 1);
		for (int i = 0; i < n; i++) {
			a[i] = min + i * step;
		}
		a[n - 1] = max;
		return a;
	}

	// defensive copy of a strictly increasing axis
	static double[] checked(double[] axis, int minLength, String name) {
		if (axis == null || axis.length < minLength) {
			throw new MeshConstructionException(name + " axis needs at least " + minLength + " points");
		}
		for (int i = 0; i < axis.length; i++) {
			if (!Double.isFinite(axis[i])) {
				throw new MeshConstructionException(name + " axis has a non-finite value at " + i);
			}
			if (i > 0 && !(axis[i] > axis[i - 1])) {
				throw new MeshConstructionException(name + " axis must be strictly increasing (index " + i + ")");
			}
		}
		return axis.clone();
	}
}
