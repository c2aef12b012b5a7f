package com.github.micycle1.torogrid;

/**
 * Thrown before any resampling work starts when the loaded simulation data
 * disagree with each other or with the requested grid (plane counts, node
 * counts, timestep counts, cross-section counts).
 */
public class DataInconsistencyException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public DataInconsistencyException(String message) {
		super(message);
	}

	public static void require(boolean condition, String format, Object... args) {
		if (!condition) {
			throw new DataInconsistencyException(String.format(format, args));
		}
	}
}
