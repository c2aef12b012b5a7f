package com.github.micycle1.torogrid.decomposition;

/**
 * Adiabatic (Boltzmann) electron density response to a potential fluctuation:
 * δn<sub>e,ad</sub> = n<sub>e0</sub> · φ̃ / T<sub>e0</sub>, in normalised units.
 * Nodes with T<sub>e0</sub> ≤ 0 get no response.
 */
public final class AdiabaticResponse {

	private AdiabaticResponse() {
	}

	/**
	 * @param potential [plane][time][node] potential fluctuation
	 * @param ne0       electron density at each node
	 * @param te0       electron temperature at each node
	 * @return [plane][time][node] adiabatic density response
	 */
	public static double[][][] compute(double[][][] potential, double[] ne0, double[] te0) {
		int planes = potential.length;
		int times = potential[0].length;
		int nodes = ne0.length;
		double[][][] out = new double[planes][times][nodes];
		for (int p = 0; p < planes; p++) {
			for (int t = 0; t < times; t++) {
				double[] phi = potential[p][t];
				double[] dst = out[p][t];
				for (int i = 0; i < nodes; i++) {
					if (te0[i] > 0) {
						dst[i] = ne0[i] * phi[i] / te0[i];
					}
				}
			}
		}
		return out;
	}
}
