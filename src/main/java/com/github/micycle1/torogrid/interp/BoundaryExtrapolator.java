package com.github.micycle1.torogrid.interp;

import java.util.Objects;

import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;
import com.github.micycle1.torogrid.mesh.MaskedValues;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

/**
 * Completes equilibrium fields outside the mesh by a first-order Taylor
 * expansion about the nearest convex-hull vertex:
 * {@code f(v) + (R - R_v) df/dR(v) + (Z - Z_v) df/dZ(v)}. Not meant for
 * turbulence fields, which vanish outside the mesh.
 */
public final class BoundaryExtrapolator {

	private final UnstructuredMesh mesh;

	public BoundaryExtrapolator(UnstructuredMesh mesh) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
	}

	public double extrapolate(CloughTocherInterpolant f, double r, double z) {
		int v = mesh.nearestHullVertex(r, z);
		return f.getNodeValue(v) + (r - mesh.getR(v)) * f.getNodeGradientR(v) + (z - mesh.getZ(v)) * f.getNodeGradientZ(v);
	}

	/** Copy of values with every undefined entry extrapolated. */
	public double[] fill(CloughTocherInterpolant f, MaskedValues values, double[] r, double[] z) {
		double[] out = values.values().clone();
		for (int i = values.nextUndefined(0); i >= 0; i = values.nextUndefined(i + 1)) {
			out[i] = extrapolate(f, r[i], z[i]);
		}
		return out;
	}

	/** f at every point: interpolated inside the mesh, extrapolated outside. */
	public double[] evaluate(CloughTocherInterpolant f, double[] r, double[] z) {
		return fill(f, f.evaluate(r, z), r, z);
	}
}
