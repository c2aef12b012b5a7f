package com.github.micycle1.torogrid;

/**
 * Equilibrium quantities written onto a grid. They are defined at every grid
 * point: values outside the mesh are extrapolated.
 */
public enum EquilibriumQuantity {

	PSI,
	B_R,
	/** Vertical component of the field. */
	B_Z,
	B_PHI,
	B_TOTAL,
	/** Cartesian components, 3-D grids only. */
	B_X,
	B_Y,
	B_CARTESIAN_Z,
	TE0,
	TI0,
	/** Electron density including the folded-in relaxation. */
	NE0,
	/** Ion density including the folded-in relaxation. */
	NI0
}
