package com.github.micycle1.torogrid.mesh;

import java.util.LinkedHashSet;
import java.util.Set;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

import com.github.micycle1.torogrid.triangulation.Triangulation;

/**
 * <p>
 * Estimates nodal gradients of a scalar field sampled on the vertices of a
 * triangulation, as needed by the Clough–Tocher element.
 * </p>
 *
 * <p>
 * For every vertex v a weighted least-squares quadratic
 * {@code f(j) - f(v) = a dx + b dy + c dx^2 + d dx dy + e dy^2} is fitted over
 * a stencil of nearby vertices (the 1-ring, or the 2-ring when the 1-ring is
 * small). The fit only depends on geometry, so the pseudo-inverse rows for
 * {@code a} and {@code b} are assembled once (EJML) and every later field costs
 * one dot product per vertex and axis.
 * </p>
 *
 * <ul>
 * <li>Linear and quadratic fields get exact gradients (up to rounding).</li>
 * <li>If the quadratic system is ill-conditioned the fit drops to a plane; if
 * even that fails the vertex gets a zero gradient.</li>
 * </ul>
 */
public final class GradientEstimator {

	private static final int QUADRATIC_TERMS = 5;
	private static final int LINEAR_TERMS = 2;
	// 1-rings smaller than this are widened to the 2-ring
	private static final int MIN_RING = 6;
	private static final double MAX_CONDITION = 1e12;

	private final int[][] stencils;
	private final double[][] weightsX;
	private final double[][] weightsY;
	private int linearFallbacks;
	private int failedVertices;

	public GradientEstimator(Triangulation tri) {
		int n = tri.getVertexCount();
		stencils = new int[n][];
		weightsX = new double[n][];
		weightsY = new double[n][];
		for (int v = 0; v < n; v++) {
			int[] stencil = stencil(tri, v);
			stencils[v] = stencil;
			if (!fit(tri, v, stencil, QUADRATIC_TERMS)) {
				linearFallbacks++;
				if (!fit(tri, v, stencil, LINEAR_TERMS)) {
					failedVertices++;
					weightsX[v] = new double[stencil.length];
					weightsY[v] = new double[stencil.length];
				}
			}
		}
	}

	/**
	 * Writes d f/dx and d f/dy at every vertex into gx and gy.
	 */
	public void estimate(double[] f, double[] gx, double[] gy) {
		for (int v = 0; v < stencils.length; v++) {
			int[] s = stencils[v];
			double[] wx = weightsX[v];
			double[] wy = weightsY[v];
			double fv = f[v];
			double sx = 0, sy = 0;
			for (int j = 0; j < s.length; j++) {
				double df = f[s[j]] - fv;
				sx += wx[j] * df;
				sy += wy[j] * df;
			}
			gx[v] = sx;
			gy[v] = sy;
		}
	}

	/** Vertices whose quadratic fit was rejected. */
	public int getLinearFallbackCount() {
		return linearFallbacks;
	}

	/** Vertices left with a zero gradient. */
	public int getFailedVertexCount() {
		return failedVertices;
	}

	private static int[] stencil(Triangulation tri, int v) {
		Set<Integer> ring = new LinkedHashSet<>(tri.getFlower(v));
		if (ring.size() < MIN_RING) {
			for (int u : tri.getFlower(v)) {
				ring.addAll(tri.getFlower(u));
			}
			ring.remove(v);
		}
		return ring.stream().mapToInt(Integer::intValue).toArray();
	}

	private boolean fit(Triangulation tri, int v, int[] stencil, int terms) {
		int m = stencil.length;
		if (m < terms) {
			return false;
		}
		double xv = tri.getX(v);
		double yv = tri.getY(v);

		double h = 0;
		for (int u : stencil) {
			h += Math.hypot(tri.getX(u) - xv, tri.getY(u) - yv);
		}
		h /= m;
		if (h == 0) {
			return false;
		}

		// rows weighted by inverse (scaled) distance
		double[] rowWeight = new double[m];
		DMatrixRMaj a = new DMatrixRMaj(m, terms);
		for (int j = 0; j < m; j++) {
			double dx = (tri.getX(stencil[j]) - xv) / h;
			double dy = (tri.getY(stencil[j]) - yv) / h;
			double w = 1.0 / Math.max(Math.hypot(dx, dy), 1e-12);
			rowWeight[j] = w;
			a.set(j, 0, w * dx);
			a.set(j, 1, w * dy);
			if (terms == QUADRATIC_TERMS) {
				a.set(j, 2, w * dx * dx);
				a.set(j, 3, w * dx * dy);
				a.set(j, 4, w * dy * dy);
			}
		}

		DMatrixRMaj ata = new DMatrixRMaj(terms, terms);
		CommonOps_DDRM.multTransA(a, a, ata);
		double cond = NormOps_DDRM.conditionP2(ata);
		if (!Double.isFinite(cond) || cond > MAX_CONDITION) {
			return false;
		}
		if (!CommonOps_DDRM.invert(ata)) {
			return false;
		}
		DMatrixRMaj pinv = new DMatrixRMaj(terms, m);
		CommonOps_DDRM.multTransB(ata, a, pinv);

		double[] wx = new double[m];
		double[] wy = new double[m];
		for (int j = 0; j < m; j++) {
			wx[j] = pinv.get(0, j) * rowWeight[j] / h;
			wy[j] = pinv.get(1, j) * rowWeight[j] / h;
		}
		weightsX[v] = wx;
		weightsY[v] = wy;
		return true;
	}
}
