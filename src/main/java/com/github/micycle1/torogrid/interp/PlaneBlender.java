package com.github.micycle1.torogrid.interp;

import java.util.BitSet;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.stream.IntStream;

import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;
import com.github.micycle1.torogrid.mesh.MaskedValues;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;
import com.github.micycle1.torogrid.tracing.LandingPositions;
import com.github.micycle1.torogrid.tracing.PlaneIndexTable;

/**
 * <p>
 * Evaluates one stored per-plane field at the landing positions of a grid and
 * blends the two bracketing planes:
 * </p>
 *
 * <pre>
 * value = valuePrev * fractionNext + valueNext * fractionPrev
 * </pre>
 *
 * <p>
 * Plane values come from a Clough–Tocher interpolant of plane
 * (centre + offset) mod P, with 0 outside the mesh: fluctuations vanish beyond
 * the last closed flux surface. Points with an undefined landing stay
 * undefined.
 * </p>
 *
 * One blender serves one quantity at one timestep; its interpolants are not
 * shared with any other.
 */
public final class PlaneBlender {

	private final UnstructuredMesh mesh;
	private final IntFunction<double[]> planeValues;
	private final int planeCount;
	private final boolean parallel;

	/**
	 * @param planeValues supplies the node values of an absolute plane index
	 */
	public PlaneBlender(UnstructuredMesh mesh, IntFunction<double[]> planeValues, int planeCount, boolean parallel) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
		this.planeValues = Objects.requireNonNull(planeValues, "planeValues must not be null");
		if (planeCount < 1) {
			throw new IllegalArgumentException("planeCount must be >= 1, got " + planeCount);
		}
		this.planeCount = planeCount;
		this.parallel = parallel;
	}

	public MaskedValues blend(LandingPositions landing, PlaneIndexTable planes, int centerPlane) {
		int n = landing.size();
		if (planes.size() != n) {
			throw new IllegalArgumentException("Landing positions (" + n + ") and plane table (" + planes.size() + ") differ in size");
		}

		// build each needed plane's interpolant once, before the parallel section
		CloughTocherInterpolant[] byPlane = new CloughTocherInterpolant[planeCount];
		for (int i = 0; i < n; i++) {
			if (landing.isDefined(i)) {
				ensure(byPlane, absolute(centerPlane, planes.getPrev(i)));
				ensure(byPlane, absolute(centerPlane, planes.getNext(i)));
			}
		}

		double[] out = new double[n];
		boolean[] ok = new boolean[n];
		IntStream range = IntStream.range(0, n);
		if (parallel) {
			range = range.parallel();
		}
		range.forEach(i -> {
			if (!landing.isDefined(i)) {
				out[i] = Double.NaN;
				return;
			}
			double vPrev = byPlane[absolute(centerPlane, planes.getPrev(i))].valueOr(landing.getRPrev(i), landing.getZPrev(i), 0);
			double vNext = byPlane[absolute(centerPlane, planes.getNext(i))].valueOr(landing.getRNext(i), landing.getZNext(i), 0);
			out[i] = vPrev * landing.getFractionNext(i) + vNext * landing.getFractionPrev(i);
			ok[i] = true;
		});

		BitSet defined = new BitSet(n);
		for (int i = 0; i < n; i++) {
			if (ok[i]) {
				defined.set(i);
			}
		}
		return new MaskedValues(out, defined);
	}

	private int absolute(int centerPlane, int offset) {
		return Math.floorMod(centerPlane + offset, planeCount);
	}

	private void ensure(CloughTocherInterpolant[] byPlane, int plane) {
		if (byPlane[plane] == null) {
			byPlane[plane] = mesh.interpolant(planeValues.apply(plane));
		}
	}
}
