package com.github.micycle1.heightmesh.error;

/**
 * Raised when a heightfield, option or raster cannot be converted: a grid
 * smaller than 2x2, a non-finite sample, an unsupported bit depth, or an
 * out-of-range setting. Nothing has been written when this is thrown.
 */
public class InvalidInputException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidInputException(String message) {
		super(message);
	}
}
