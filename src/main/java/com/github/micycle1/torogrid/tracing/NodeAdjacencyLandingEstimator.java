package com.github.micycle1.torogrid.tracing;

import java.util.Arrays;
import java.util.Objects;

import com.github.micycle1.torogrid.data.SimulationMesh;
import com.github.micycle1.torogrid.mesh.NodeIndex;
import com.github.micycle1.torogrid.mesh.UnstructuredMesh;

/**
 * <p>
 * Cheap landing estimate from the mesh's along-field node adjacency instead of
 * integrating the field.
 * </p>
 *
 * <p>
 * For a point with flux ψ, the anchor node is the nearest node whose ψ lies in
 * [ψ - ψ<sub>max</sub>/10, ψ), i.e. just inside the point's flux surface. The
 * point is then moved by {@code portion * (neighbour - anchor)}, where portion
 * is the angular distance to the plane in units of the plane spacing and the
 * neighbour is the anchor's next (resp. previous) node.
 * </p>
 * <ul>
 * <li>When the anchor has no previous node the backward move mirrors the forward
 * one: {@code portionPrev * (anchor - next)}. This is an approximation kept as
 * the documented fallback.</li>
 * <li>When it has no next node but a previous one, the forward move mirrors the
 * backward one; with neither, the point does not move.</li>
 * <li>Without a node in the inner window the nearest node in the symmetric
 * window is used, and failing that the nearest node overall. All three are
 * nearest-neighbour queries on one spatial index, filtered by ψ.</li>
 * <li>Points outside the mesh do not move; the blended fluctuation there is
 * 0.</li>
 * </ul>
 * The blend fractions are the angular portions, so the blend reduces to linear
 * interpolation in φ.
 */
public final class NodeAdjacencyLandingEstimator {

	private final SimulationMesh mesh;
	private final double[] psi;
	// node ψ in ascending order, to tell whether a window holds any node
	private final double[] sortedPsi;
	private final NodeIndex nodes;
	private final double window;

	public NodeAdjacencyLandingEstimator(SimulationMesh mesh) {
		this.mesh = Objects.requireNonNull(mesh, "mesh must not be null");
		UnstructuredMesh m = mesh.getMesh();
		psi = mesh.getPsi();
		sortedPsi = psi.clone();
		Arrays.sort(sortedPsi);
		int[] all = new int[mesh.getNodeCount()];
		Arrays.setAll(all, i -> i);
		nodes = new NodeIndex(m.getNodesR(), m.getNodesZ(), all);
		window = Math.abs(mesh.getPsiMax()) / 10;
	}

	public LandingPositions estimate(double[] r, double[] z, PlaneIndexTable planes) {
		int n = planes.size();
		if (r.length != n || z.length != n) {
			throw new IllegalArgumentException("Expected " + n + " points, got " + r.length + " R and " + z.length + " Z values");
		}
		double[] rPrev = new double[n];
		double[] zPrev = new double[n];
		double[] rNext = new double[n];
		double[] zNext = new double[n];
		double[] fraction = new double[n];
		boolean[] defined = new boolean[n];
		double[] psiOut = new double[3];
		double spacing = planes.getPlaneSpacing();

		for (int i = 0; i < n; i++) {
			double portionPrev = Math.abs(planes.getOffsetPrev(i)) / spacing;
			double portionNext = Math.abs(planes.getOffsetNext(i)) / spacing;
			fraction[i] = portionPrev;
			defined[i] = true;
			if (!mesh.getPsiInterpolant().evaluate(r[i], z[i], psiOut)) {
				rPrev[i] = rNext[i] = r[i];
				zPrev[i] = zNext[i] = z[i];
				continue;
			}
			int anchor = anchor(r[i], z[i], psiOut[0]);

			double ra = mesh.getMesh().getR(anchor);
			double za = mesh.getMesh().getZ(anchor);
			int next = mesh.getNextNode(anchor);
			int prev = mesh.getPrevNode(anchor);
			// displacement per plane spacing, towards the next and previous planes
			double dRn = 0, dZn = 0, dRp = 0, dZp = 0;
			if (next >= 0) {
				dRn = mesh.getMesh().getR(next) - ra;
				dZn = mesh.getMesh().getZ(next) - za;
			}
			if (prev >= 0) {
				dRp = mesh.getMesh().getR(prev) - ra;
				dZp = mesh.getMesh().getZ(prev) - za;
			}
			if (prev < 0) {
				dRp = -dRn;
				dZp = -dZn;
			} else if (next < 0) {
				dRn = -dRp;
				dZn = -dZp;
			}
			rPrev[i] = r[i] + portionPrev * dRp;
			zPrev[i] = z[i] + portionPrev * dZp;
			rNext[i] = r[i] + portionNext * dRn;
			zNext[i] = z[i] + portionNext * dZn;
		}
		return new LandingPositions(rPrev, zPrev, rNext, zNext, fraction, defined);
	}

	int anchor(double r, double z, double p) {
		double lo = p - window;
		double hi = p + window;
		if (lowerBound(lo) < lowerBound(p)) {
			return nodes.nearest(r, z, node -> psi[node] >= lo && psi[node] < p);
		}
		if (lowerBound(lo) < upperBound(hi)) {
			return nodes.nearest(r, z, node -> psi[node] >= lo && psi[node] <= hi);
		}
		return nodes.nearest(r, z);
	}

	// first index with sortedPsi >= v
	private int lowerBound(double v) {
		int i = Arrays.binarySearch(sortedPsi, v);
		if (i < 0) {
			return -i - 1;
		}
		while (i > 0 && sortedPsi[i - 1] == v) {
			i--;
		}
		return i;
	}

	// first index with sortedPsi > v
	private int upperBound(double v) {
		return PlaneIndexTable.searchRight(sortedPsi, v);
	}
}
