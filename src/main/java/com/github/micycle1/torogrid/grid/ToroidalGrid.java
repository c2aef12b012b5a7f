package com.github.micycle1.torogrid.grid;

/**
 * A 3-D query grid whose points carry cylindrical coordinates. The toroidal
 * angle is always reported in [0, 2π).
 */
public interface ToroidalGrid extends StructuredGrid {

	@Override
	default int getDimension() {
		return 3;
	}

	/** Toroidal angle of point i, in [0, 2π). */
	double getPhi(int i);

	/** Wraps an angle into [0, 2π). */
	static double wrapAngle(double phi) {
		double twoPi = 2 * Math.PI;
		double w = phi % twoPi;
		if (w < 0) {
			w += twoPi;
		}
		// -0.0 and values that round up to 2π after the shift
		if (w >= twoPi || w == 0) {
			w = 0.0;
		}
		return w;
	}
}
