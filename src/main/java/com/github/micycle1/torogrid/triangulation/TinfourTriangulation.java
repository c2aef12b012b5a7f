package com.github.micycle1.torogrid.triangulation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.tinfour.common.IIncrementalTin;
import org.tinfour.common.IIncrementalTinNavigator;
import org.tinfour.common.IQuadEdge;
import org.tinfour.common.Vertex;
import org.tinfour.common.VertexMergerGroup;
import org.tinfour.standard.IncrementalTin;

import com.github.micycle1.torogrid.MeshConstructionException;

/**
 * {@link Triangulation} backed by a Tinfour Delaunay TIN. Vertex ids are taken
 * from {@link Vertex#getIndex()}, so a TIN built by {@link #of(double[], double[])}
 * keeps the node numbering of the input arrays.
 * <p>
 * Point location walks the TIN with an {@link IIncrementalTinNavigator}.
 * Navigators keep the last visited triangle, so each thread gets its own.
 */
public class TinfourTriangulation implements Triangulation {

	// relative distance from a hull edge still counted as on it
	private static final double EDGE_TOLERANCE = 1e-12;

	protected final IIncrementalTin tin;
	protected final Vertex[] vertices;
	protected final List<Integer> boundary;
	protected final List<List<Integer>> flowers;
	protected final List<int[]> faces;
	protected final List<int[]> faceNeighbors;
	// edge index -> face on the edge's left
	protected final Map<Integer, Integer> faceOfEdge;
	private final ThreadLocal<IIncrementalTinNavigator> navigators;

	/**
	 * Triangulates the given node coordinates.
	 *
	 * @throws MeshConstructionException if the nodes cannot form a valid planar
	 *                                   triangulation (too few, non-finite,
	 *                                   duplicated or collinear)
	 */
	public static TinfourTriangulation of(double[] x, double[] y) {
		if (x == null || y == null || x.length != y.length) {
			throw new MeshConstructionException("Node coordinate arrays must be non-null and of equal length");
		}
		final int n = x.length;
		if (n < 3) {
			throw new MeshConstructionException("At least 3 nodes are required, got " + n);
		}
		double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
				throw new MeshConstructionException("Node " + i + " has non-finite coordinates (" + x[i] + ", " + y[i] + ")");
			}
			minX = Math.min(minX, x[i]);
			maxX = Math.max(maxX, x[i]);
			minY = Math.min(minY, y[i]);
			maxY = Math.max(maxY, y[i]);
		}
		checkDuplicates(x, y);

		double extent = Math.max(maxX - minX, maxY - minY);
		double area = Math.max((maxX - minX) * (maxY - minY), extent * extent * 1e-6);
		double spacing = Math.sqrt(area / n);

		IIncrementalTin tin = new IncrementalTin(spacing);
		List<Vertex> vs = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			vs.add(new Vertex(x[i], y[i], 0.0, i));
		}
		if (!tin.add(vs, null) || !tin.isBootstrapped()) {
			throw new MeshConstructionException("Nodes are collinear; no triangulation exists");
		}
		return new TinfourTriangulation(tin, n);
	}

	public TinfourTriangulation(IIncrementalTin tin, int vertexCount) {
		this.tin = tin;
		vertices = new Vertex[vertexCount];

		// 1) collect vertices
		tin.vertices().forEach(v -> {
			if (v.isSynthetic()) {
				return;
			}
			if (v instanceof VertexMergerGroup) {
				throw new MeshConstructionException("Nodes too close to be distinguished near (" + v.getX() + ", " + v.getY() + ")");
			}
			int id = v.getIndex();
			if (id < 0 || id >= vertexCount) {
				throw new MeshConstructionException("Vertex index " + id + " outside 0.." + (vertexCount - 1));
			}
			vertices[id] = v;
		});
		for (int i = 0; i < vertexCount; i++) {
			if (vertices[i] == null) {
				throw new MeshConstructionException("Node " + i + " is missing from the triangulation");
			}
		}

		// 2) populate flowers and faces
		BitSet processed = new BitSet(vertexCount);
		flowers = new ArrayList<>(Collections.nCopies(vertexCount, null));
		faces = new ArrayList<>();
		faceOfEdge = new HashMap<>();

		tin.edges().forEach(e -> {
			for (IQuadEdge side : new IQuadEdge[] { e, e.getDual() }) {
				Vertex a = side.getA();
				if (isMeshVertex(a) && !processed.get(a.getIndex())) {
					processed.set(a.getIndex());
					flowers.set(a.getIndex(), buildFlower(side));
				}
				collectFace(side);
			}
		});
		for (int i = 0; i < vertexCount; i++) {
			if (flowers.get(i) == null) {
				flowers.set(i, List.of());
			}
		}
		faceNeighbors = buildFaceNeighbors();

		// 3) compute CCW boundary
		boundary = buildBoundary();

		navigators = ThreadLocal.withInitial(tin::getNavigator);
	}

	@Override
	public int getVertexCount() {
		return vertices.length;
	}

	@Override
	public double getX(int v) {
		return vertices[v].getX();
	}

	@Override
	public double getY(int v) {
		return vertices[v].getY();
	}

	@Override
	public List<Integer> getFlower(int v) {
		return flowers.get(v);
	}

	@Override
	public List<Integer> getBoundaryLoop() {
		return boundary;
	}

	@Override
	public List<int[]> getFaces() {
		return faces;
	}

	@Override
	public int[] getFaceNeighbors(int f) {
		return faceNeighbors.get(f);
	}

	@Override
	public int locateFace(double x, double y) {
		IQuadEdge e = navigators.get().getNeighborEdge(x, y);
		if (e == null) {
			return -1;
		}
		Integer f = faceOfEdge.get(e.getIndex());
		if (f != null) {
			return f;
		}
		// exterior side of a perimeter edge: points on the edge belong to the face inside
		if (onEdge(e.getA(), e.getB(), x, y)) {
			return faceOfEdge.getOrDefault(e.getDual().getIndex(), -1);
		}
		return -1;
	}

	private static boolean isMeshVertex(Vertex v) {
		return v != null && !v.isSynthetic();
	}

	/*
	 * Every interior triangle is reached once from each of its three sides; keep
	 * it only from the side with the smallest edge index.
	 */
	private void collectFace(IQuadEdge side) {
		IQuadEdge fwd = side.getForward();
		IQuadEdge rev = side.getReverse();
		Vertex a = side.getA();
		Vertex b = side.getB();
		Vertex c = fwd.getB();
		if (!isMeshVertex(a) || !isMeshVertex(b) || !isMeshVertex(c)) {
			return; // ghost triangle
		}
		if (side.getIndex() > fwd.getIndex() || side.getIndex() > rev.getIndex()) {
			return;
		}
		int[] f = { a.getIndex(), b.getIndex(), c.getIndex() };
		double cross = (b.getX() - a.getX()) * (c.getY() - a.getY()) - (b.getY() - a.getY()) * (c.getX() - a.getX());
		if (cross < 0) {
			int t = f[1];
			f[1] = f[2];
			f[2] = t;
		}
		int id = faces.size();
		faces.add(f);
		faceOfEdge.put(side.getIndex(), id);
		faceOfEdge.put(fwd.getIndex(), id);
		faceOfEdge.put(rev.getIndex(), id);
	}

	private static boolean onEdge(Vertex a, Vertex b, double x, double y) {
		if (!isMeshVertex(a) || !isMeshVertex(b)) {
			return false;
		}
		double ex = b.getX() - a.getX();
		double ey = b.getY() - a.getY();
		double px = x - a.getX();
		double py = y - a.getY();
		double len2 = ex * ex + ey * ey;
		double cross = ex * py - ey * px;
		double t = (ex * px + ey * py) / len2;
		return Math.abs(cross) <= EDGE_TOLERANCE * len2 && t >= -EDGE_TOLERANCE && t <= 1 + EDGE_TOLERANCE;
	}

	private List<int[]> buildFaceNeighbors() {
		final long n = vertices.length;
		Map<Long, Integer> faceOfEdge = new HashMap<>(faces.size() * 4);
		for (int fi = 0; fi < faces.size(); fi++) {
			int[] f = faces.get(fi);
			for (int k = 0; k < 3; k++) {
				faceOfEdge.put(f[(k + 1) % 3] * n + f[(k + 2) % 3], fi);
			}
		}
		List<int[]> neighbors = new ArrayList<>(faces.size());
		for (int[] f : faces) {
			int[] nb = new int[3];
			for (int k = 0; k < 3; k++) {
				// the neighbor traverses the shared edge in the opposite direction
				Integer other = faceOfEdge.get(f[(k + 2) % 3] * n + f[(k + 1) % 3]);
				nb[k] = other == null ? -1 : other;
			}
			neighbors.add(nb);
		}
		return neighbors;
	}

	private List<Integer> buildBoundary() {
		List<IQuadEdge> perimeter = new ArrayList<>();
		tin.getPerimeter().forEach(perimeter::add);

		List<Vertex> boundary = new ArrayList<>();
		boundary.add(perimeter.get(0).getA());
		for (IQuadEdge e : perimeter) {
			Vertex last = boundary.get(boundary.size() - 1);
			if (last.equals(e.getA())) {
				boundary.add(e.getB());
			} else if (last.equals(e.getB())) {
				boundary.add(e.getA());
			} else {
				throw new IllegalStateException("Perimeter edges are not contiguous");
			}
		}
		// drop the last if it closes the loop
		if (boundary.size() > 1 && boundary.get(0).equals(boundary.get(boundary.size() - 1))) {
			boundary.remove(boundary.size() - 1);
		}

		if (!isCCW(boundary)) {
			Collections.reverse(boundary);
		}

		return boundary.stream().map(Vertex::getIndex).toList();
	}

	private List<Integer> buildFlower(IQuadEdge e) {
		Vertex a = e.getA();
		// Collect neighbors around A via pinwheel
		List<Vertex> neighbors = new ArrayList<>();
		e.pinwheel().forEach(ne -> {
			Vertex b = ne.getB();
			if (!isMeshVertex(b)) {
				return;
			}
			neighbors.add(b);
		});

		double ax = a.getX();
		double ay = a.getY();
		// Sort neighbors CCW by angle around A
		neighbors.sort(Comparator.comparingDouble(b -> Math.atan2(b.getY() - ay, b.getX() - ax)));

		return neighbors.stream().map(Vertex::getIndex).toList();
	}

	private static void checkDuplicates(double[] x, double[] y) {
		Integer[] order = new Integer[x.length];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> x[i]).thenComparingDouble(i -> y[i]));
		for (int k = 1; k < order.length; k++) {
			int i = order[k - 1];
			int j = order[k];
			if (x[i] == x[j] && y[i] == y[j]) {
				throw new MeshConstructionException("Nodes " + Math.min(i, j) + " and " + Math.max(i, j) + " share coordinates (" + x[i] + ", " + y[i] + ")");
			}
		}
	}

	public static boolean isCCW(List<Vertex> ring) {
		int n = ring.size();

		double x0 = ring.get(0).getX();
		double sum = 0.0;

		for (int i = 0; i < n; i++) {
			double xi = ring.get(i).getX() - x0;
			double yPrev = ring.get((i == 0) ? n - 1 : i - 1).getY();
			double yNext = ring.get((i + 1) % n).getY();
			sum += xi * (yPrev - yNext);
		}
		double total = 0.5 * sum;
		return total < 0;
	}

}
