package com.github.micycle1.torogrid.decomposition;

import java.util.Arrays;

/**
 * <p>
 * Separates turbulent fluctuations from the slow axisymmetric relaxation of
 * the background profile.
 * </p>
 *
 * <p>
 * Relaxation is the same on every flux surface and hence along the toroidal
 * direction, so with no large n=0 turbulent mode the toroidal average of a
 * computed perturbation δ is mostly relaxation:
 * </p>
 * <ul>
 * <li>true fluctuation: δ̃ = δ - &lt;δ&gt;<sub>ζ</sub></li>
 * <li>relaxation kept for the equilibrium: &lt;δ&gt;<sub>ζt</sub> (average over
 * planes and time)</li>
 * </ul>
 *
 * All arrays are indexed {@code [plane][time][node]}; inputs are never
 * modified.
 */
public final class RelaxationDecomposition {

	private RelaxationDecomposition() {
	}

	/** &lt;δ&gt;<sub>ζ</sub>, indexed [time][node]. */
	public static double[][] toroidalAverage(double[][][] all) {
		int planes = all.length;
		int times = all[0].length;
		int nodes = all[0][0].length;
		double[][] avg = new double[times][nodes];
		for (int p = 0; p < planes; p++) {
			for (int t = 0; t < times; t++) {
				double[] src = all[p][t];
				double[] dst = avg[t];
				for (int i = 0; i < nodes; i++) {
					dst[i] += src[i];
				}
			}
		}
		for (double[] row : avg) {
			for (int i = 0; i < nodes; i++) {
				row[i] /= planes;
			}
		}
		return avg;
	}

	/** δ - &lt;δ&gt;<sub>ζ</sub> for every plane, as a new array. */
	public static double[][][] removeToroidalAverage(double[][][] all) {
		return subtract(all, toroidalAverage(all));
	}

	/** Time average of a [time][node] array. */
	public static double[] timeAverage(double[][] perTime) {
		int nodes = perTime[0].length;
		double[] out = new double[nodes];
		for (double[] row : perTime) {
			for (int i = 0; i < nodes; i++) {
				out[i] += row[i];
			}
		}
		for (int i = 0; i < nodes; i++) {
			out[i] /= perTime.length;
		}
		return out;
	}

	/**
	 * Legacy treatment: subtract from every value the mean over all planes and
	 * nodes of its timestep. Relaxation is not separated.
	 */
	public static double[][][] removeTimestepMean(double[][][] all) {
		int planes = all.length;
		int times = all[0].length;
		int nodes = all[0][0].length;
		double[][] mean = new double[times][nodes];
		for (int t = 0; t < times; t++) {
			double sum = 0;
			for (int p = 0; p < planes; p++) {
				for (double v : all[p][t]) {
					sum += v;
				}
			}
			Arrays.fill(mean[t], sum / ((double) planes * nodes));
		}
		return subtract(all, mean);
	}

	private static double[][][] subtract(double[][][] all, double[][] perTime) {
		int planes = all.length;
		int times = all[0].length;
		int nodes = all[0][0].length;
		double[][][] out = new double[planes][times][nodes];
		for (int p = 0; p < planes; p++) {
			for (int t = 0; t < times; t++) {
				double[] src = all[p][t];
				double[] sub = perTime[t];
				double[] dst = out[p][t];
				for (int i = 0; i < nodes; i++) {
					dst[i] = src[i] - sub[i];
				}
			}
		}
		return out;
	}
}
