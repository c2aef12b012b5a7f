package com.github.micycle1.torogrid.triangulation;

import java.util.List;

/**
 * Triangulation: the combinatorial + geometric view of a planar triangulation
 * over the nodes of a poloidal (R,Z) mesh.
 * <p>
 * Conventions:
 * <ul>
 * <li>Vertex indices are 0..n-1 (0-based) and equal the index of the node in
 * the arrays the triangulation was built from.</li>
 * <li>For each vertex v, getFlower(v) returns neighbors in COUNTER-CLOCKWISE
 * order (sorted by angle around v). The first neighbor is not repeated at the
 * end.</li>
 * <li>getBoundaryLoop() returns CCW-ordered convex-hull vertices, each exactly
 * once.</li>
 * <li>Faces are CCW vertex triples. getFaceNeighbors(f)[k] is the face sharing
 * the edge opposite vertex k of f, or -1 on the hull.</li>
 * </ul>
 */
public interface Triangulation {

	// ----------------------
	// Vertices
	// ----------------------

	/** Number of vertices (n). */
	int getVertexCount();

	/** R coordinate of vertex v. */
	double getX(int v);

	/** Z coordinate of vertex v. */
	double getY(int v);

	/**
	 * The neighbor list ("flower") for vertex v in CCW order. For interior vertices
	 * the list is cyclic; for boundary vertices it still lists every neighbor
	 * sorted by angle, so the first and last entries need not be adjacent.
	 */
	List<Integer> getFlower(int v);

	/**
	 * CCW ordered convex-hull loop (each boundary vertex once). The closure (edge
	 * between last and first) is implied, not explicitly repeated.
	 */
	List<Integer> getBoundaryLoop();

	// ----------------------
	// Faces
	// ----------------------

	/** Face list; each entry is a CCW vertex triple. */
	List<int[]> getFaces();

	/** Face count. */
	default int getFaceCount() {
		return getFaces().size();
	}

	/**
	 * Neighbors of face f: entry k is the face across the edge opposite vertex k,
	 * or -1 when that edge lies on the convex hull.
	 */
	int[] getFaceNeighbors(int f);

	/**
	 * Face containing (x,y), or -1 outside the convex hull. Points on a hull edge
	 * count as inside. Safe to call from several threads at once.
	 */
	int locateFace(double x, double y);
}
