package com.github.micycle1.heightmesh.input;

/**
 * Converts an external input type into a {@link HeightField}.
 * <p>
 * Implementations must return a validated heightfield: at least 2x2 samples,
 * all finite, normalised so that 1.0 is the brightest representable level of
 * the source bit depth.
 * </p>
 * <p>
 * The mesh pipeline depends on {@link HeightField} only, so new raster sources
 * are supported by adding an adapter rather than changing the builder.
 * </p>
 *
 * @param <T> source input type
 */
public interface Adapter<T> {

	HeightField toHeightField(T input);
}
