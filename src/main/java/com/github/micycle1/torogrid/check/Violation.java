package com.github.micycle1.torogrid.check;

import com.github.micycle1.torogrid.data.Quantity;

/**
 * A mesh node where the gridded field, read back, misses the original node
 * value by more than the tolerance.
 */
public final class Violation {

	private final Quantity quantity;
	private final int crossSection;
	private final int time;
	private final int node;
	private final double r;
	private final double z;
	private final double original;
	private final double backInterpolated;
	private final double error;

	Violation(Quantity quantity, int crossSection, int time, int node, double r, double z, double original, double backInterpolated, double error) {
		this.quantity = quantity;
		this.crossSection = crossSection;
		this.time = time;
		this.node = node;
		this.r = r;
		this.z = z;
		this.original = original;
		this.backInterpolated = backInterpolated;
		this.error = error;
	}

	public Quantity getQuantity() {
		return quantity;
	}

	public int getCrossSection() {
		return crossSection;
	}

	public int getTime() {
		return time;
	}

	public int getNode() {
		return node;
	}

	public double getR() {
		return r;
	}

	public double getZ() {
		return z;
	}

	public double getOriginal() {
		return original;
	}

	public double getBackInterpolated() {
		return backInterpolated;
	}

	/** |original - back| / |back|. */
	public double getError() {
		return error;
	}

	@Override
	public String toString() {
		return String.format("%s[cross=%d, t=%d] node %d (R=%.4g, Z=%.4g): original %.4g, back %.4g, error %.3g", quantity, crossSection, time,
				node, r, z, original, backInterpolated, error);
	}
}
