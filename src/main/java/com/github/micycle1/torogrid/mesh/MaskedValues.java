package com.github.micycle1.torogrid.mesh;

import java.util.Arrays;
import java.util.BitSet;

/**
 * A dense array of samples with a parallel validity mask. Entries that are not
 * defined (e.g. outside the convex hull of the mesh) hold NaN in
 * {@link #values()} but must be tested through {@link #isDefined(int)}.
 */
public final class MaskedValues {

	private final double[] values;
	private final BitSet defined;

	public MaskedValues(double[] values, BitSet defined) {
		this.values = values;
		this.defined = defined;
	}

	public static MaskedValues allDefined(double[] values) {
		BitSet defined = new BitSet(values.length);
		defined.set(0, values.length);
		return new MaskedValues(values, defined);
	}

	public int size() {
		return values.length;
	}

	public boolean isDefined(int i) {
		return defined.get(i);
	}

	public double get(int i) {
		if (!defined.get(i)) {
			throw new IllegalStateException("Sample " + i + " is undefined");
		}
		return values[i];
	}

	public int undefinedCount() {
		return values.length - defined.cardinality();
	}

	/** Index of the first undefined entry at or after from, or -1. */
	public int nextUndefined(int from) {
		int i = defined.nextClearBit(from);
		return i < values.length ? i : -1;
	}

	/** Backing array; undefined entries are NaN. */
	public double[] values() {
		return values;
	}

	public BitSet definedMask() {
		return (BitSet) defined.clone();
	}

	/** Copy of the values with undefined entries replaced by fill. */
	public double[] filled(double fill) {
		double[] out = Arrays.copyOf(values, values.length);
		for (int i = defined.nextClearBit(0); i < out.length; i = defined.nextClearBit(i + 1)) {
			out[i] = fill;
		}
		return out;
	}
}
