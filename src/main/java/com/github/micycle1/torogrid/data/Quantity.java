package com.github.micycle1.torogrid.data;

/**
 * Fluctuating scalar quantities stored per toroidal plane and timestep.
 */
public enum Quantity {

	/** Electrostatic potential fluctuation. */
	POTENTIAL,
	/** Non-adiabatic electron density perturbation (runs with electron dynamics). */
	NONADIABATIC_ELECTRON_DENSITY,
	/** Ion density perturbation (loaded on request). */
	ION_DENSITY,
	/** Adiabatic electron response derived from the potential. */
	ADIABATIC_ELECTRON_DENSITY;

	/** True for quantities that are densities (and so may be filtered against n0). */
	public boolean isDensity() {
		return this != POTENTIAL;
	}
}
