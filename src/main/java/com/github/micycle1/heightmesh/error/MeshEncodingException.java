package com.github.micycle1.heightmesh.error;

import com.github.micycle1.heightmesh.config.MeshFormat;

/**
 * A numeric value could not be represented in the target format's grammar
 * (NaN or infinity). Values are never clamped.
 */
public class MeshEncodingException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final MeshFormat format;
	private final double value;

	public MeshEncodingException(MeshFormat format, double value) {
		super("Value " + value + " cannot be encoded in " + format + " output");
		this.format = format;
		this.value = value;
	}

	public MeshFormat getFormat() {
		return format;
	}

	public double getValue() {
		return value;
	}
}
