package com.github.micycle1.torogrid.tracing;

import java.util.BitSet;

/**
 * Where the field line through each grid point meets its previous and next
 * plane, with the blend fractions. A point's entries are only meaningful where
 * {@link #isDefined(int)} holds.
 * <p>
 * fractionPrev is the share of the field-line length lying between the point and
 * the previous plane; the blended value is
 * {@code valuePrev * fractionNext + valueNext * fractionPrev}, so a point on the
 * previous plane (fractionPrev = 0) takes that plane's value.
 */
public final class LandingPositions {

	private final double[] rPrev;
	private final double[] zPrev;
	private final double[] rNext;
	private final double[] zNext;
	private final double[] fractionPrev;
	private final BitSet defined;

	LandingPositions(double[] rPrev, double[] zPrev, double[] rNext, double[] zNext, double[] fractionPrev, boolean[] defined) {
		this.rPrev = rPrev;
		this.zPrev = zPrev;
		this.rNext = rNext;
		this.zNext = zNext;
		this.fractionPrev = fractionPrev;
		this.defined = new BitSet(defined.length);
		for (int i = 0; i < defined.length; i++) {
			if (defined[i]) {
				this.defined.set(i);
			}
		}
	}

	public int size() {
		return rPrev.length;
	}

	public boolean isDefined(int i) {
		return defined.get(i);
	}

	public int undefinedCount() {
		return rPrev.length - defined.cardinality();
	}

	public double getRPrev(int i) {
		return rPrev[i];
	}

	public double getZPrev(int i) {
		return zPrev[i];
	}

	public double getRNext(int i) {
		return rNext[i];
	}

	public double getZNext(int i) {
		return zNext[i];
	}

	public double getFractionPrev(int i) {
		return fractionPrev[i];
	}

	public double getFractionNext(int i) {
		return 1 - fractionPrev[i];
	}

	/** Copies of the landing coordinates on the previous plane. */
	public double[] getRPrev() {
		return rPrev.clone();
	}

	public double[] getZPrev() {
		return zPrev.clone();
	}

	public double[] getRNext() {
		return rNext.clone();
	}

	public double[] getZNext() {
		return zNext.clone();
	}
}
