package com.github.micycle1.torogrid.mesh;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.torogrid.MeshConstructionException;
import com.github.micycle1.torogrid.triangulation.TinfourTriangulation;
import com.github.micycle1.torogrid.triangulation.Triangulation;

/**
 * <p>
 * The poloidal (R,Z) simulation mesh: node coordinates, their Delaunay
 * triangulation, a nearest-node index over the hull and the shared geometry
 * from which C¹ interpolants of arbitrary nodal fields are built. Points are
 * located by walking the triangulation.
 * </p>
 *
 * <p>
 * Everything here is built once and is read-only afterwards, so one mesh may be
 * shared by any number of interpolants and concurrent evaluations.
 * </p>
 * <ul>
 * <li>{@link #locate(double, double)} returns the containing face or
 * {@link #OUTSIDE}.</li>
 * <li>{@link #interpolant(double[])} builds a Clough–Tocher interpolant; outside
 * the convex hull it reports "undefined" rather than extrapolating.</li>
 * <li>{@link #getHullVertices()} and {@link #nearestHullVertex(double, double)}
 * serve boundary extrapolation.</li>
 * </ul>
 */
public final class UnstructuredMesh {

	private static final Logger LOGGER = LoggerFactory.getLogger(UnstructuredMesh.class);

	public static final int OUTSIDE = -1;

	private final Triangulation tri;
	private final double[] r;
	private final double[] z;
	private final double[] transforms; // 6 per face, see MathUtil.barycentricTransform
	private final boolean[] usable;
	private final double[] edgeDirections; // Clough–Tocher cross-edge direction, 3 per face
	private final NodeIndex hullIndex;
	private final GradientEstimator gradients;

	/**
	 * Triangulates the nodes (R[i], Z[i]).
	 *
	 * @throws MeshConstructionException for degenerate or duplicated nodes
	 */
	public static UnstructuredMesh of(double[] r, double[] z) {
		return new UnstructuredMesh(TinfourTriangulation.of(r, z));
	}

	public UnstructuredMesh(Triangulation tri) {
		this.tri = Objects.requireNonNull(tri, "tri must not be null");
		int n = tri.getVertexCount();
		r = new double[n];
		z = new double[n];
		for (int i = 0; i < n; i++) {
			r[i] = tri.getX(i);
			z[i] = tri.getY(i);
		}

		List<int[]> faces = tri.getFaces();
		if (faces.isEmpty()) {
			throw new MeshConstructionException("Triangulation has no faces");
		}
		transforms = new double[6 * faces.size()];
		usable = new boolean[faces.size()];
		int degenerate = 0;
		for (int f = 0; f < faces.size(); f++) {
			int[] t = faces.get(f);
			usable[f] = MathUtil.barycentricTransform(r[t[0]], z[t[0]], r[t[1]], z[t[1]], r[t[2]], z[t[2]], transforms, 6 * f);
			if (!usable[f]) {
				degenerate++;
			}
		}
		if (degenerate > 0) {
			LOGGER.warn("{} zero-area faces reported as outside", degenerate);
		}
		edgeDirections = computeEdgeDirections(faces);

		int[] hullIds = tri.getBoundaryLoop().stream().mapToInt(Integer::intValue).toArray();
		hullIndex = new NodeIndex(r, z, hullIds);

		gradients = new GradientEstimator(tri);
		if (gradients.getLinearFallbackCount() > 0) {
			LOGGER.debug("{} nodes use a linear gradient fit, {} have no usable stencil", gradients.getLinearFallbackCount(),
					gradients.getFailedVertexCount());
		}
		LOGGER.debug("Mesh built: {} nodes, {} faces, {} hull vertices", n, faces.size(), hullIds.length);
	}

	public int getNodeCount() {
		return r.length;
	}

	public double getR(int node) {
		return r[node];
	}

	public double getZ(int node) {
		return z[node];
	}

	/** Copy of the node R coordinates. */
	public double[] getNodesR() {
		return r.clone();
	}

	/** Copy of the node Z coordinates. */
	public double[] getNodesZ() {
		return z.clone();
	}

	public Triangulation getTriangulation() {
		return tri;
	}

	public int getFaceCount() {
		return usable.length;
	}

	/** CCW convex-hull vertex loop. */
	public List<Integer> getHullVertices() {
		return tri.getBoundaryLoop();
	}

	/** The convex-hull vertex nearest (Euclidean, in R,Z) to the given point. */
	public int nearestHullVertex(double rq, double zq) {
		return hullIndex.nearest(rq, zq);
	}

	/** Face containing (R,Z), or {@link #OUTSIDE}. */
	public int locate(double rq, double zq) {
		return locate(rq, zq, new double[3]);
	}

	public boolean contains(double rq, double zq) {
		return locate(rq, zq) != OUTSIDE;
	}

	/** Builds a C¹ interpolant of the given per-node values. */
	public CloughTocherInterpolant interpolant(double[] nodeValues) {
		if (nodeValues.length != r.length) {
			throw new IllegalArgumentException("Expected " + r.length + " node values, got " + nodeValues.length);
		}
		return new CloughTocherInterpolant(this, nodeValues);
	}

	GradientEstimator getGradientEstimator() {
		return gradients;
	}

	// as locate(rq, zq), also leaving the barycentric coordinates in bary
	int locate(double rq, double zq, double[] bary) {
		if (!Double.isFinite(rq) || !Double.isFinite(zq)) {
			return OUTSIDE;
		}
		int f = tri.locateFace(rq, zq);
		if (f < 0 || !usable[f]) {
			return OUTSIDE;
		}
		MathUtil.barycentric(transforms, 6 * f, rq, zq, bary);
		return f;
	}

	double[] getTransforms() {
		return transforms;
	}

	double[] getEdgeDirections() {
		return edgeDirections;
	}

	int[] getFace(int f) {
		return tri.getFaces().get(f);
	}

	/*
	 * For the edge opposite vertex k, the C1 condition is imposed along the
	 * direction joining this face's centroid to the neighbour's centroid, written
	 * in local barycentric terms (affine invariant). Hull edges use the centroid
	 * direction of the face itself.
	 */
	private double[] computeEdgeDirections(List<int[]> faces) {
		double[] g = new double[3 * faces.size()];
		double[] c = new double[3];
		for (int f = 0; f < faces.size(); f++) {
			int[] nb = tri.getFaceNeighbors(f);
			for (int k = 0; k < 3; k++) {
				int other = nb[k];
				if (other < 0 || !usable[f]) {
					g[3 * f + k] = -0.5;
					continue;
				}
				int[] o = faces.get(other);
				double cx = (r[o[0]] + r[o[1]] + r[o[2]]) / 3.0;
				double cy = (z[o[0]] + z[o[1]] + z[o[2]]) / 3.0;
				MathUtil.barycentric(transforms, 6 * f, cx, cy, c);
				switch (k) {
					case 0:
						g[3 * f] = (2 * c[2] + c[1] - 1) / (2 - 3 * c[2] - 3 * c[1]);
						break;
					case 1:
						g[3 * f + 1] = (2 * c[0] + c[2] - 1) / (2 - 3 * c[0] - 3 * c[2]);
						break;
					default:
						g[3 * f + 2] = (2 * c[1] + c[0] - 1) / (2 - 3 * c[1] - 3 * c[0]);
						break;
				}
			}
		}
		return g;
	}
}
