package com.github.micycle1.heightmesh.error;

/**
 * Internal invariant violation during mesh synthesis, such as a cell without a
 * resolved geometry variant. Indicates a logic defect rather than bad input.
 */
public class GeometryException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public GeometryException(String message) {
		super(message);
	}
}
