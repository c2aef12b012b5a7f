package com.github.micycle1.torogrid.tracing;

import java.util.Arrays;
import java.util.Objects;

import com.github.micycle1.torogrid.DataInconsistencyException;
import com.github.micycle1.torogrid.grid.ToroidalGrid;

/**
 * <p>
 * For every point of a 3-D grid, the two simulation planes that bracket it
 * along the magnetic field and the signed toroidal angle to each.
 * </p>
 *
 * <p>
 * Planes sit at φ<sub>k</sub> = 2πk/P. With s the number of planes at or below
 * φ (a right-sided binary search):
 * </p>
 * <ul>
 * <li>co-directional field: next = s, prev = s - 1, and next = P wraps to
 * 0;</li>
 * <li>counter-directional field: prev = s, next = s - 1, and prev = P wraps to
 * 0.</li>
 * </ul>
 * A plane 0 reached across the cut is taken at 2π, so offsets never exceed one
 * plane spacing in magnitude. Plane indices here are relative to the centre
 * plane of a cross-section.
 */
public final class PlaneIndexTable {

	private final int planeCount;
	private final boolean coDirectional;
	private final double spacing;
	private final int[] prev;
	private final int[] next;
	private final double[] offsetPrev;
	private final double[] offsetNext;

	/**
	 * @throws DataInconsistencyException if planeCount &lt; 1
	 */
	public PlaneIndexTable(ToroidalGrid grid, int planeCount, boolean coDirectional) {
		Objects.requireNonNull(grid, "grid must not be null");
		DataInconsistencyException.require(planeCount >= 1, "Plane count must be at least 1, got %d", planeCount);
		this.planeCount = planeCount;
		this.coDirectional = coDirectional;
		this.spacing = 2 * Math.PI / planeCount;

		double[] planeAngles = new double[planeCount];
		for (int k = 0; k < planeCount; k++) {
			planeAngles[k] = k * spacing;
		}

		int n = grid.size();
		prev = new int[n];
		next = new int[n];
		offsetPrev = new double[n];
		offsetNext = new double[n];
		for (int i = 0; i < n; i++) {
			double phi = ToroidalGrid.wrapAngle(grid.getPhi(i));
			int s = searchRight(planeAngles, phi);
			// angle of plane s, which is 2π when s == P
			double upper = s * spacing;
			double lower = (s - 1) * spacing;
			if (coDirectional) {
				prev[i] = s - 1;
				next[i] = s == planeCount ? 0 : s;
				offsetPrev[i] = lower - phi;
				offsetNext[i] = upper - phi;
			} else {
				prev[i] = s == planeCount ? 0 : s;
				next[i] = s - 1;
				offsetPrev[i] = upper - phi;
				offsetNext[i] = lower - phi;
			}
		}
	}

	/** Number of entries of a that are &lt;= v; a is sorted ascending. */
	static int searchRight(double[] a, double v) {
		int lo = 0, hi = a.length;
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (a[mid] <= v) {
				lo = mid + 1;
			} else {
				hi = mid;
			}
		}
		return lo;
	}

	public int size() {
		return prev.length;
	}

	public int getPlaneCount() {
		return planeCount;
	}

	public boolean isCoDirectional() {
		return coDirectional;
	}

	/** Angular distance between neighbouring planes, 2π/P. */
	public double getPlaneSpacing() {
		return spacing;
	}

	public int getPrev(int i) {
		return prev[i];
	}

	public int getNext(int i) {
		return next[i];
	}

	/** φ<sub>prev</sub> - φ, signed. */
	public double getOffsetPrev(int i) {
		return offsetPrev[i];
	}

	/** φ<sub>next</sub> - φ, signed. */
	public double getOffsetNext(int i) {
		return offsetNext[i];
	}

	@Override
	public String toString() {
		return "PlaneIndexTable[points=" + prev.length + ", planes=" + planeCount + ", coDirectional=" + coDirectional + ", prev="
				+ Arrays.toString(Arrays.copyOf(prev, Math.min(prev.length, 8))) + "...]";
	}
}
