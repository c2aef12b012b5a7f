package com.github.micycle1.torogrid.mesh;

import java.util.function.IntPredicate;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.ItemBoundable;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Nearest-node queries over a fixed subset of mesh nodes, backed by a JTS
 * {@link STRtree}. The tree is built up front, so concurrent queries are safe.
 * <p>
 * A query may carry a node filter; rejected nodes are ranked behind every
 * accepted one, so the branch-and-bound search still returns the nearest
 * accepted node.
 */
public final class NodeIndex {

	private static final IntPredicate ANY = node -> true;

	private final double[] r;
	private final double[] z;
	private final STRtree tree;
	private final int size;

	/**
	 * @param r     R coordinate of every mesh node, indexed by node
	 * @param z     Z coordinate of every mesh node, indexed by node
	 * @param nodes the nodes to index
	 */
	public NodeIndex(double[] r, double[] z, int[] nodes) {
		if (r.length != z.length) {
			throw new IllegalArgumentException("r and z must have equal length");
		}
		if (nodes.length == 0) {
			throw new IllegalArgumentException("Node index needs at least one node");
		}
		this.r = r;
		this.z = z;
		tree = new STRtree();
		for (int node : nodes) {
			tree.insert(new Envelope(new Coordinate(r[node], z[node])), Integer.valueOf(node));
		}
		tree.build();
		size = nodes.length;
	}

	public int size() {
		return size;
	}

	/** The indexed node nearest (Euclidean, in R,Z) to the given point. */
	public int nearest(double rq, double zq) {
		return nearest(rq, zq, ANY);
	}

	/**
	 * The nearest indexed node accepted by the filter, or -1 if none is. Without
	 * an accepted node every node is visited.
	 */
	public int nearest(double rq, double zq, IntPredicate accept) {
		Query q = new Query(rq, zq, accept);
		Integer node = (Integer) tree.nearestNeighbour(new Envelope(new Coordinate(rq, zq)), q, this::distance);
		if (node == null || !accept.test(node)) {
			return -1;
		}
		return node;
	}

	private double distance(ItemBoundable a, ItemBoundable b) {
		Object ia = a.getItem();
		Object ib = b.getItem();
		Query q = (Query) (ia instanceof Query ? ia : ib);
		int node = (Integer) (ia instanceof Query ? ib : ia);
		if (!q.accept.test(node)) {
			return Double.MAX_VALUE;
		}
		return Math.hypot(r[node] - q.r, z[node] - q.z);
	}

	private static final class Query {

		final double r;
		final double z;
		final IntPredicate accept;

		Query(double r, double z, IntPredicate accept) {
			this.r = r;
			this.z = z;
			this.accept = accept;
		}
	}
}
