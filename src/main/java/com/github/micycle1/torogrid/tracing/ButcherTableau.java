package com.github.micycle1.torogrid.tracing;

/**
 * Coefficients of an explicit Runge–Kutta method: stage nodes c, the strictly
 * lower triangular matrix a and the weights b.
 */
public final class ButcherTableau {

	private final int order;
	private final double[] c;
	private final double[][] a;
	private final double[] b;

	private ButcherTableau(int order, double[] c, double[][] a, double[] b) {
		this.order = order;
		this.c = c;
		this.a = a;
		this.b = b;
	}

	/**
	 * Forward Euler (1), explicit midpoint (2), Kutta's third-order method (3) or
	 * the classical fourth-order method (4).
	 */
	public static ButcherTableau ofOrder(int order) {
		switch (order) {
			case 1:
				return new ButcherTableau(1, new double[] { 0 }, new double[][] { {} }, new double[] { 1 });
			case 2:
				return new ButcherTableau(2, new double[] { 0, 0.5 }, new double[][] { {}, { 0.5 } }, new double[] { 0, 1 });
			case 3:
				return new ButcherTableau(3, new double[] { 0, 0.5, 1 }, new double[][] { {}, { 0.5 }, { -1, 2 } }, new double[] { 1 / 6.0, 2 / 3.0, 1 / 6.0 });
			case 4:
				return new ButcherTableau(4, new double[] { 0, 0.5, 0.5, 1 }, new double[][] { {}, { 0.5 }, { 0, 0.5 }, { 0, 0, 1 } },
						new double[] { 1 / 6.0, 1 / 3.0, 1 / 3.0, 1 / 6.0 });
			default:
				throw new IllegalArgumentException("Runge-Kutta order must be in 1..4, got " + order);
		}
	}

	public int getOrder() {
		return order;
	}

	public int getStages() {
		return b.length;
	}

	public double getC(int stage) {
		return c[stage];
	}

	public double getA(int stage, int j) {
		return a[stage][j];
	}

	public double getB(int stage) {
		return b[stage];
	}
}
