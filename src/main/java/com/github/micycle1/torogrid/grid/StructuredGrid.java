package com.github.micycle1.torogrid.grid;

/**
 * A structured query grid. Points are addressed by a flat index; each grid
 * documents its own axis order.
 */
public interface StructuredGrid {

	/** 2 for poloidal (R,Z) grids, 3 for grids carrying a toroidal angle. */
	int getDimension();

	/** Number of query points. */
	int size();

	/** Shape of the grid, slowest-varying axis first. */
	int[] getShape();

	/** Major radius of point i. */
	double getR(int i);

	/** Vertical coordinate of point i. */
	double getZ(int i);
}
