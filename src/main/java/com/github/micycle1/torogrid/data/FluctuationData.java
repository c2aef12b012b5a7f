package com.github.micycle1.torogrid.data;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.github.micycle1.torogrid.DataInconsistencyException;

/**
 * Raw per-plane fluctuation fields as delivered by the simulation reader, each
 * indexed {@code [plane][time][node]}. All quantities share the same plane,
 * timestep and node counts. Arrays are copied on build.
 */
public final class FluctuationData {

	private final Map<Quantity, double[][][]> fields;
	private final int planeCount;
	private final int timeCount;
	private final int nodeCount;

	private FluctuationData(Map<Quantity, double[][][]> fields) {
		this.fields = fields;
		double[][][] any = fields.values().iterator().next();
		planeCount = any.length;
		timeCount = any[0].length;
		nodeCount = any[0][0].length;
	}

	public static Builder builder() {
		return new Builder();
	}

	public int getPlaneCount() {
		return planeCount;
	}

	public int getTimeCount() {
		return timeCount;
	}

	public int getNodeCount() {
		return nodeCount;
	}

	public boolean has(Quantity q) {
		return fields.containsKey(q);
	}

	public Set<Quantity> getQuantities() {
		return Collections.unmodifiableSet(fields.keySet());
	}

	/** Copy of the values of one quantity on one plane at one timestep. */
	public double[] get(Quantity q, int plane, int time) {
		double[][][] f = fields.get(q);
		if (f == null) {
			throw new IllegalArgumentException(q + " was not supplied");
		}
		return f[plane][time].clone();
	}

	// shared, not copied: callers in this package must not modify
	double[][][] raw(Quantity q) {
		return fields.get(q);
	}

	public static final class Builder {

		private final Map<Quantity, double[][][]> fields = new EnumMap<>(Quantity.class);

		private Builder() {
		}

		public Builder potential(double[][][] values) {
			return put(Quantity.POTENTIAL, values);
		}

		/** Non-adiabatic electron density; only present in runs with electron dynamics. */
		public Builder electronDensity(double[][][] values) {
			return put(Quantity.NONADIABATIC_ELECTRON_DENSITY, values);
		}

		public Builder ionDensity(double[][][] values) {
			return put(Quantity.ION_DENSITY, values);
		}

		private Builder put(Quantity q, double[][][] values) {
			if (values == null) {
				fields.remove(q);
			} else {
				fields.put(q, values);
			}
			return this;
		}

		/**
		 * @throws DataInconsistencyException if the potential is missing or the
		 *                                    arrays are ragged or disagree in shape
		 */
		public FluctuationData build() {
			DataInconsistencyException.require(fields.containsKey(Quantity.POTENTIAL), "The potential fluctuation is required");
			double[][][] ref = fields.get(Quantity.POTENTIAL);
			DataInconsistencyException.require(ref.length > 0, "No planes supplied");
			DataInconsistencyException.require(ref[0] != null && ref[0].length > 0, "No timesteps supplied");
			DataInconsistencyException.require(ref[0][0] != null && ref[0][0].length > 0, "No nodes supplied");
			int planes = ref.length;
			int times = ref[0].length;
			int nodes = ref[0][0].length;

			Map<Quantity, double[][][]> copy = new EnumMap<>(Quantity.class);
			for (Map.Entry<Quantity, double[][][]> e : fields.entrySet()) {
				copy.put(e.getKey(), copyChecked(e.getKey(), e.getValue(), planes, times, nodes));
			}
			return new FluctuationData(copy);
		}

		private static double[][][] copyChecked(Quantity q, double[][][] values, int planes, int times, int nodes) {
			DataInconsistencyException.require(values.length == planes, "%s has %d planes, expected %d", q, values.length, planes);
			double[][][] out = new double[planes][][];
			for (int p = 0; p < planes; p++) {
				double[][] plane = values[p];
				DataInconsistencyException.require(plane != null && plane.length == times, "%s plane %d has %d timesteps, expected %d", q, p,
						plane == null ? 0 : plane.length, times);
				out[p] = new double[times][];
				for (int t = 0; t < times; t++) {
					double[] v = plane[t];
					DataInconsistencyException.require(v != null && v.length == nodes, "%s plane %d timestep %d has %d nodes, expected %d", q, p, t,
							v == null ? 0 : v.length, nodes);
					out[p][t] = v.clone();
				}
			}
			return out;
		}
	}
}
