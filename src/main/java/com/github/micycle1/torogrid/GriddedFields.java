package com.github.micycle1.torogrid;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.github.micycle1.torogrid.check.AccuracyReport;
import com.github.micycle1.torogrid.data.Quantity;
import com.github.micycle1.torogrid.grid.StructuredGrid;
import com.github.micycle1.torogrid.mesh.MaskedValues;

/**
 * Result of one resampling pass. Fluctuations are kept per quantity,
 * cross-section and timestep, each as grid-ordered values with a validity
 * mask; equilibrium quantities are complete arrays in grid order.
 */
public final class GriddedFields {

	private final StructuredGrid grid;
	private final Map<Quantity, MaskedValues[][]> fluctuations;
	private final Map<EquilibriumQuantity, double[]> equilibrium;
	private final AccuracyReport accuracy;

	GriddedFields(StructuredGrid grid, Map<Quantity, MaskedValues[][]> fluctuations, Map<EquilibriumQuantity, double[]> equilibrium,
			AccuracyReport accuracy) {
		this.grid = grid;
		this.fluctuations = fluctuations;
		this.equilibrium = equilibrium;
		this.accuracy = accuracy;
	}

	GriddedFields withAccuracy(AccuracyReport report) {
		return new GriddedFields(grid, fluctuations, equilibrium, report);
	}

	public StructuredGrid getGrid() {
		return grid;
	}

	public Set<Quantity> getQuantities() {
		return Collections.unmodifiableSet(fluctuations.keySet());
	}

	public int getCrossSectionCount() {
		return fluctuations.values().iterator().next().length;
	}

	public int getTimeCount() {
		return fluctuations.values().iterator().next()[0].length;
	}

	/** Fluctuation of q on the grid; points whose field line could not be followed are undefined. */
	public MaskedValues getField(Quantity q, int crossSection, int time) {
		MaskedValues[][] f = fluctuations.get(q);
		if (f == null) {
			throw new IllegalArgumentException(q + " was not resampled");
		}
		return f[crossSection][time];
	}

	/** Values of q with undefined points replaced by fill. */
	public double[] getValues(Quantity q, int crossSection, int time, double fill) {
		return getField(q, crossSection, time).filled(fill);
	}

	public boolean hasEquilibrium(EquilibriumQuantity q) {
		return equilibrium.containsKey(q);
	}

	public double[] getEquilibrium(EquilibriumQuantity q) {
		double[] v = equilibrium.get(q);
		if (v == null) {
			throw new IllegalArgumentException(q + " is not available on a " + grid.getDimension() + "-D grid");
		}
		return v.clone();
	}

	public Set<EquilibriumQuantity> getEquilibriumQuantities() {
		return Collections.unmodifiableSet(equilibrium.keySet());
	}

	public AccuracyReport getAccuracyReport() {
		return accuracy;
	}
}
