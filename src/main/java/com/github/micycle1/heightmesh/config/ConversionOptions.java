package com.github.micycle1.heightmesh.config;

import java.util.Objects;

import com.github.micycle1.heightmesh.error.InvalidInputException;

/**
 * Settings for one conversion. Instances are immutable and passed explicitly
 * through the pipeline, so concurrent conversions with different settings do
 * not interfere.
 *
 * @param threshold     local contrast above which a cell switches to hybrid
 *                      geometry
 * @param format        output format
 * @param baseElevation elevation of the flat bottom of solid formats
 * @param placement     output footprint placement
 * @param parallel      whether per-row work may run on the common fork-join
 *                      pool
 */
public record ConversionOptions(double threshold, MeshFormat format, double baseElevation, Placement placement, boolean parallel) {

	/** Ad hoc contrast threshold, tuned by eye on photographs and renders. */
	public static final double DEFAULT_THRESHOLD = 0.05;
	public static final double DEFAULT_BASE_ELEVATION = 0.0;

	public ConversionOptions {
		Objects.requireNonNull(format, "format");
		Objects.requireNonNull(placement, "placement");
		if (!Double.isFinite(threshold) || threshold < 0) {
			throw new InvalidInputException("Threshold must be finite and >= 0, was " + threshold);
		}
		if (!Double.isFinite(baseElevation)) {
			throw new InvalidInputException("Base elevation must be finite, was " + baseElevation);
		}
	}

	public static ConversionOptions defaults() {
		return new ConversionOptions(DEFAULT_THRESHOLD, MeshFormat.OBJ, DEFAULT_BASE_ELEVATION, Placement.CENTERED, false);
	}

	public static ConversionOptions of(MeshFormat format) {
		return defaults().withFormat(format);
	}

	public ConversionOptions withThreshold(double threshold) {
		return new ConversionOptions(threshold, format, baseElevation, placement, parallel);
	}

	public ConversionOptions withFormat(MeshFormat format) {
		return new ConversionOptions(threshold, format, baseElevation, placement, parallel);
	}

	public ConversionOptions withBaseElevation(double baseElevation) {
		return new ConversionOptions(threshold, format, baseElevation, placement, parallel);
	}

	public ConversionOptions withPlacement(Placement placement) {
		return new ConversionOptions(threshold, format, baseElevation, placement, parallel);
	}

	public ConversionOptions withParallel(boolean parallel) {
		return new ConversionOptions(threshold, format, baseElevation, placement, parallel);
	}
}
