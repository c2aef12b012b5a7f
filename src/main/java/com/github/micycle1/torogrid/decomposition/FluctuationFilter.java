package com.github.micycle1.torogrid.decomposition;

/**
 * Zeroes density fluctuations whose magnitude exceeds the local equilibrium
 * density, which would otherwise give a negative total density. This only
 * happens very close to the edge where the equilibrium density vanishes.
 */
public final class FluctuationFilter {

	private FluctuationFilter() {
	}

	/**
	 * Filters field in place.
	 *
	 * @param field     [plane][time][node] density fluctuation
	 * @param reference equilibrium density at each node
	 * @return number of values set to zero
	 */
	public static int apply(double[][][] field, double[] reference) {
		int zeroed = 0;
		for (double[][] plane : field) {
			for (double[] values : plane) {
				for (int i = 0; i < values.length; i++) {
					if (Math.abs(values[i]) > Math.abs(reference[i])) {
						values[i] = 0;
						zeroed++;
					}
				}
			}
		}
		return zeroed;
	}
}
