package com.github.micycle1.torogrid;

/**
 * Thrown when a poloidal mesh or a structured grid cannot be built from the
 * supplied geometry (too few nodes, non-finite, duplicated or collinear
 * coordinates, unusable grid axes).
 */
public class MeshConstructionException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public MeshConstructionException(String message) {
		super(message);
	}

	public MeshConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}
