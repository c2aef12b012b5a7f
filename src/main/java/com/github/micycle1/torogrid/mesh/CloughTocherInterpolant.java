package com.github.micycle1.torogrid.mesh;

import java.util.BitSet;

/**
 * <p>
 * Piecewise cubic, C¹ Clough–Tocher interpolant of a nodal field over an
 * {@link UnstructuredMesh}.
 * </p>
 *
 * <p>
 * Each face is split at its centroid into three cubic Bézier patches, fixed by
 * the nodal values and gradients (see {@link GradientEstimator}) and by a
 * cross-boundary derivative condition along each edge. At a node the
 * interpolant returns exactly the nodal value and estimated gradient. Outside
 * the convex hull the interpolant is undefined.
 * </p>
 *
 * Instances are immutable and safe to evaluate from several threads.
 */
public final class CloughTocherInterpolant {

	private final UnstructuredMesh mesh;
	private final double[] values;
	private final double[] gradR;
	private final double[] gradZ;

	CloughTocherInterpolant(UnstructuredMesh mesh, double[] nodeValues) {
		this.mesh = mesh;
		this.values = nodeValues.clone();
		int n = values.length;
		gradR = new double[n];
		gradZ = new double[n];
		mesh.getGradientEstimator().estimate(values, gradR, gradZ);
	}

	public UnstructuredMesh getMesh() {
		return mesh;
	}

	public double getNodeValue(int node) {
		return values[node];
	}

	/** d f/dR at a node: the gradient of the interpolant there. */
	public double getNodeGradientR(int node) {
		return gradR[node];
	}

	/** d f/dZ at a node. */
	public double getNodeGradientZ(int node) {
		return gradZ[node];
	}

	/**
	 * Evaluates value and gradient at (R,Z).
	 *
	 * @param out receives {value, d/dR, d/dZ}; untouched when outside
	 * @return false when the point is outside the convex hull
	 */
	public boolean evaluate(double r, double z, double[] out) {
		double[] beta = new double[3];
		int f = mesh.locate(r, z, beta);
		if (f == UnstructuredMesh.OUTSIDE) {
			return false;
		}
		evaluateInFace(f, beta, out);
		return true;
	}

	/** Values at the given points with an explicit validity mask. */
	public MaskedValues evaluate(double[] r, double[] z) {
		int n = r.length;
		double[] v = new double[n];
		BitSet defined = new BitSet(n);
		double[] out = new double[3];
		for (int i = 0; i < n; i++) {
			if (evaluate(r[i], z[i], out)) {
				v[i] = out[0];
				defined.set(i);
			} else {
				v[i] = Double.NaN;
			}
		}
		return new MaskedValues(v, defined);
	}

	/** Value at (R,Z), or fill outside the convex hull. */
	public double valueOr(double r, double z, double fill) {
		double[] out = new double[3];
		return evaluate(r, z, out) ? out[0] : fill;
	}

	private void evaluateInFace(int f, double[] beta, double[] out) {
		int[] t = mesh.getFace(f);
		double[] g = mesh.getEdgeDirections();
		double[] tr = mesh.getTransforms();
		int o = 6 * f;

		double x1 = mesh.getR(t[0]), y1 = mesh.getZ(t[0]);
		double x2 = mesh.getR(t[1]), y2 = mesh.getZ(t[1]);
		double x3 = mesh.getR(t[2]), y3 = mesh.getZ(t[2]);

		double e12x = x2 - x1, e12y = y2 - y1;
		double e23x = x3 - x2, e23y = y3 - y2;
		double e31x = x1 - x3, e31y = y1 - y3;

		double f1 = values[t[0]], f2 = values[t[1]], f3 = values[t[2]];

		// directional derivatives along the edges, taken at each end
		double df12 = +(gradR[t[0]] * e12x + gradZ[t[0]] * e12y);
		double df21 = -(gradR[t[1]] * e12x + gradZ[t[1]] * e12y);
		double df23 = +(gradR[t[1]] * e23x + gradZ[t[1]] * e23y);
		double df32 = -(gradR[t[2]] * e23x + gradZ[t[2]] * e23y);
		double df31 = +(gradR[t[2]] * e31x + gradZ[t[2]] * e31y);
		double df13 = -(gradR[t[0]] * e31x + gradZ[t[0]] * e31y);

		// Bézier ordinates c[i][j][k], i+j+k+l = 3, for coordinates (b1,b2,b3,b4)
		double[][][] c = new double[4][4][4];
		double c3000 = f1;
		double c2100 = (df12 + 3 * c3000) / 3;
		double c2010 = (df13 + 3 * c3000) / 3;
		double c0300 = f2;
		double c1200 = (df21 + 3 * c0300) / 3;
		double c0210 = (df23 + 3 * c0300) / 3;
		double c0030 = f3;
		double c1020 = (df31 + 3 * c0030) / 3;
		double c0120 = (df32 + 3 * c0030) / 3;

		double c2001 = (c2100 + c2010 + c3000) / 3;
		double c0201 = (c1200 + c0300 + c0210) / 3;
		double c0021 = (c1020 + c0120 + c0030) / 3;

		double g0 = g[3 * f], g1 = g[3 * f + 1], g2 = g[3 * f + 2];
		double c0111 = (g0 * (-c0300 + 3 * c0210 - 3 * c0120 + c0030) + (-c0300 + 2 * c0210 - c0120 + c0021 + c0201)) / 2;
		double c1011 = (g1 * (-c0030 + 3 * c1020 - 3 * c2010 + c3000) + (-c0030 + 2 * c1020 - c2010 + c2001 + c0021)) / 2;
		double c1101 = (g2 * (-c3000 + 3 * c2100 - 3 * c1200 + c0300) + (-c3000 + 2 * c2100 - c1200 + c2001 + c0201)) / 2;

		double c1002 = (c1101 + c1011 + c2001) / 3;
		double c0102 = (c1101 + c0111 + c0201) / 3;
		double c0012 = (c1011 + c0111 + c0021) / 3;
		double c0003 = (c1002 + c0102 + c0012) / 3;

		c[3][0][0] = c3000;
		c[2][1][0] = c2100;
		c[2][0][1] = c2010;
		c[2][0][0] = c2001;
		c[0][3][0] = c0300;
		c[1][2][0] = c1200;
		c[0][2][1] = c0210;
		c[0][2][0] = c0201;
		c[0][0][3] = c0030;
		c[1][0][2] = c1020;
		c[0][1][2] = c0120;
		c[0][0][2] = c0021;
		c[0][1][1] = c0111;
		c[1][0][1] = c1011;
		c[1][1][0] = c1101;
		c[1][0][0] = c1002;
		c[0][1][0] = c0102;
		c[0][0][1] = c0012;
		c[0][0][0] = c0003;
		// c[1][1][1] stays 0: one of b1..b3 is always zero in the active sub-triangle

		// extended barycentric coordinates of the sub-triangle holding the point
		int jmin = 0;
		for (int k = 1; k < 3; k++) {
			if (beta[k] < beta[jmin]) {
				jmin = k;
			}
		}
		double m = beta[jmin];
		double[] b = { beta[0] - m, beta[1] - m, beta[2] - m, 3 * m };

		double w = 0;
		double[] dw = new double[4];
		for (int i = 0; i <= 3; i++) {
			for (int j = 0; i + j <= 3; j++) {
				for (int k = 0; i + j + k <= 3; k++) {
					int l = 3 - i - j - k;
					double coef = c[i][j][k] * multinomial(i, j, k, l);
					if (coef == 0) {
						continue;
					}
					double p1 = MathUtil.ipow(b[0], i), p2 = MathUtil.ipow(b[1], j);
					double p3 = MathUtil.ipow(b[2], k), p4 = MathUtil.ipow(b[3], l);
					w += coef * p1 * p2 * p3 * p4;
					if (i > 0) {
						dw[0] += coef * i * MathUtil.ipow(b[0], i - 1) * p2 * p3 * p4;
					}
					if (j > 0) {
						dw[1] += coef * j * p1 * MathUtil.ipow(b[1], j - 1) * p3 * p4;
					}
					if (k > 0) {
						dw[2] += coef * k * p1 * p2 * MathUtil.ipow(b[2], k - 1) * p4;
					}
					if (l > 0) {
						dw[3] += coef * l * p1 * p2 * p3 * MathUtil.ipow(b[3], l - 1);
					}
				}
			}
		}

		// chain rule back to the face barycentrics, then to (R,Z)
		double[] dBeta = new double[3];
		double sumOthers = 0;
		for (int k = 0; k < 3; k++) {
			if (k != jmin) {
				dBeta[k] = dw[k];
				sumOthers += dw[k];
			}
		}
		dBeta[jmin] = -sumOthers + 3 * dw[3];

		double b0r = tr[o], b0z = tr[o + 1];
		double b1r = tr[o + 2], b1z = tr[o + 3];
		double b2r = -b0r - b1r, b2z = -b0z - b1z;

		out[0] = w;
		out[1] = dBeta[0] * b0r + dBeta[1] * b1r + dBeta[2] * b2r;
		out[2] = dBeta[0] * b0z + dBeta[1] * b1z + dBeta[2] * b2z;
	}

	private static final int[] FACTORIAL = { 1, 1, 2, 6 };

	private static double multinomial(int i, int j, int k, int l) {
		return 6.0 / (FACTORIAL[i] * FACTORIAL[j] * FACTORIAL[k] * FACTORIAL[l]);
	}
}
