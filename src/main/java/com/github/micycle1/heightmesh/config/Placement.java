package com.github.micycle1.heightmesh.config;

/**
 * Where the unit-scaled footprint is placed in output coordinates.
 */
public enum Placement {
	/** Footprint centred on the origin. */
	CENTERED,
	/** Footprint starting at the origin, all x and y non-negative. */
	POSITIVE_OCTANT
}
