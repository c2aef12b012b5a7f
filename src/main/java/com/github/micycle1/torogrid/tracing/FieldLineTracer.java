package com.github.micycle1.torogrid.tracing;

import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.torogrid.data.MagneticEquilibrium;
import com.github.micycle1.torogrid.mesh.CloughTocherInterpolant;

/**
 * <p>
 * Follows equilibrium field lines from grid points to their bracketing planes.
 * </p>
 *
 * <p>
 * With φ as the independent variable the field line obeys
 * </p>
 *
 * <pre>
 * dR/dφ = R B_R / B_φ,   dZ/dφ = R B_Z / B_φ,   ds/dφ = R sqrt(1 + (B_R/B_φ)² + (B_Z/B_φ)²)
 * </pre>
 *
 * <p>
 * which is integrated with an explicit Runge–Kutta method in steps of one
 * N-th of the plane spacing; the last step takes the remainder. Outside the
 * mesh B_R = B_Z = 0, so the line runs purely toroidally there, and
 * non-finite ratios count as zero. Inside the mesh a B_φ that is zero or
 * non-finite stops the line: the point is reported undefined.
 * </p>
 *
 * The tracer holds no mutable state; calls may run concurrently.
 */
public final class FieldLineTracer {

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldLineTracer.class);

	private final CloughTocherInterpolant bR;
	private final CloughTocherInterpolant bZ;
	private final CloughTocherInterpolant bPhi;
	private final ButcherTableau tableau;
	private final int substeps;
	private final boolean parallel;

	public FieldLineTracer(MagneticEquilibrium field, ButcherTableau tableau, int substepsPerPlaneGap, boolean parallel) {
		Objects.requireNonNull(field, "field must not be null");
		this.tableau = Objects.requireNonNull(tableau, "tableau must not be null");
		if (substepsPerPlaneGap < 1) {
			throw new IllegalArgumentException("substepsPerPlaneGap must be >= 1, got " + substepsPerPlaneGap);
		}
		this.bR = field.getBRInterpolant();
		this.bZ = field.getBZInterpolant();
		this.bPhi = field.getBPhiInterpolant();
		this.substeps = substepsPerPlaneGap;
		this.parallel = parallel;
	}

	/**
	 * Traces every point of the table from (r[i], z[i]) to both bracketing planes.
	 */
	public LandingPositions trace(double[] r, double[] z, PlaneIndexTable planes) {
		int n = planes.size();
		if (r.length != n || z.length != n) {
			throw new IllegalArgumentException("Expected " + n + " points, got " + r.length + " R and " + z.length + " Z values");
		}
		double step = planes.getPlaneSpacing() / substeps;
		double[] rPrev = new double[n];
		double[] zPrev = new double[n];
		double[] rNext = new double[n];
		double[] zNext = new double[n];
		double[] fraction = new double[n];
		boolean[] defined = new boolean[n];

		IntStream range = IntStream.range(0, n);
		if (parallel) {
			range = range.parallel();
		}
		range.forEach(i -> {
			double[] back = new double[3];
			double[] forth = new double[3];
			boolean ok = integrate(r[i], z[i], planes.getOffsetPrev(i), step, back);
			ok &= integrate(r[i], z[i], planes.getOffsetNext(i), step, forth);
			if (!ok) {
				rPrev[i] = zPrev[i] = rNext[i] = zNext[i] = fraction[i] = Double.NaN;
				return;
			}
			rPrev[i] = back[0];
			zPrev[i] = back[1];
			rNext[i] = forth[0];
			zNext[i] = forth[1];
			double total = back[2] + forth[2];
			fraction[i] = total > 0 ? back[2] / total : 0;
			defined[i] = true;
		});

		LandingPositions out = new LandingPositions(rPrev, zPrev, rNext, zNext, fraction, defined);
		if (out.undefinedCount() > 0) {
			LOGGER.warn("{} of {} field lines stopped on a vanishing toroidal field", out.undefinedCount(), n);
		}
		return out;
	}

	/**
	 * Integrates from (r0, z0) over the signed toroidal angle dPhi.
	 *
	 * @param out receives {R, Z, arc length}
	 * @return false if the field line cannot advance toroidally
	 */
	boolean integrate(double r0, double z0, double dPhi, double step, double[] out) {
		int stages = tableau.getStages();
		double[][] k = new double[stages][3];
		double[] y = { r0, z0, 0 };
		double[] tmp = new double[3];
		double remaining = Math.abs(dPhi);
		double sign = Math.signum(dPhi);
		while (remaining > 0) {
			double h = Math.min(step, remaining);
			remaining = h == remaining ? 0 : remaining - h;
			h *= sign;
			for (int s = 0; s < stages; s++) {
				System.arraycopy(y, 0, tmp, 0, 3);
				for (int j = 0; j < s; j++) {
					double a = tableau.getA(s, j);
					if (a != 0) {
						for (int d = 0; d < 3; d++) {
							tmp[d] += h * a * k[j][d];
						}
					}
				}
				if (!derivative(tmp[0], tmp[1], k[s])) {
					return false;
				}
			}
			for (int s = 0; s < stages; s++) {
				double b = tableau.getB(s);
				for (int d = 0; d < 3; d++) {
					y[d] += h * b * k[s][d];
				}
			}
		}
		out[0] = y[0];
		out[1] = y[1];
		out[2] = Math.abs(y[2]);
		return true;
	}

	private boolean derivative(double r, double z, double[] dy) {
		double[] v = new double[3];
		double ratioR = 0;
		double ratioZ = 0;
		if (bPhi.evaluate(r, z, v)) {
			double bp = v[0];
			if (bp == 0 || !Double.isFinite(bp)) {
				return false;
			}
			bR.evaluate(r, z, v);
			ratioR = finiteOrZero(v[0] / bp);
			bZ.evaluate(r, z, v);
			ratioZ = finiteOrZero(v[0] / bp);
		}
		dy[0] = r * ratioR;
		dy[1] = r * ratioZ;
		dy[2] = r * Math.sqrt(1 + ratioR * ratioR + ratioZ * ratioZ);
		return true;
	}

	private static double finiteOrZero(double v) {
		return Double.isFinite(v) ? v : 0;
	}
}
