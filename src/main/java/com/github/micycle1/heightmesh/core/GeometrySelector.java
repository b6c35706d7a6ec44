package com.github.micycle1.heightmesh.core;

import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.heightmesh.error.InvalidInputException;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.CellVariants;
import com.github.micycle1.heightmesh.model.Model.GeometryVariant;

/**
 * Chooses the triangulation of every grid cell from its local contrast.
 * <p>
 * Corners of the cell at {@code (column, row)} are numbered clockwise in image
 * space starting top left:
 *
 * <pre>
 * 1 ─ 2
 * │   │
 * 4 ─ 3
 * </pre>
 *
 * Contrast is the larger absolute difference across the two diagonals,
 * {@code max(|v1 - v3|, |v2 - v4|)}. Cells above the threshold turn
 * {@link GeometryVariant#HYBRID}, all others stay
 * {@link GeometryVariant#STANDARD}. Decisions are per cell and independent.
 */
public final class GeometrySelector {

	private static final Logger LOGGER = LoggerFactory.getLogger(GeometrySelector.class);

	private GeometrySelector() {
	}

	public static double contrast(double v1, double v2, double v3, double v4) {
		return Math.max(Math.abs(v1 - v3), Math.abs(v2 - v4));
	}

	public static GeometryVariant select(double v1, double v2, double v3, double v4, double threshold) {
		return contrast(v1, v2, v3, v4) > threshold ? GeometryVariant.HYBRID : GeometryVariant.STANDARD;
	}

	/**
	 * Selects a variant for every cell of a heightfield.
	 *
	 * @param field     heightfield to inspect
	 * @param threshold contrast threshold, finite and non-negative
	 * @param parallel  evaluate rows on the common fork-join pool
	 * @return one variant per cell, row-major
	 */
	public static CellVariants select(HeightField field, double threshold, boolean parallel) {
		if (!Double.isFinite(threshold) || threshold < 0) {
			throw new InvalidInputException("Threshold must be finite and >= 0, was " + threshold);
		}
		int columns = field.width - 1;
		int rows = field.height - 1;
		GeometryVariant[] variants = new GeometryVariant[columns * rows];

		IntStream rowStream = IntStream.range(0, rows);
		if (parallel) {
			rowStream = rowStream.parallel();
		}
		// each row writes a disjoint slice of the array
		rowStream.forEach(r -> {
			for (int c = 0; c < columns; c++) {
				double v1 = field.elevation(c, r);
				double v2 = field.elevation(c + 1, r);
				double v3 = field.elevation(c + 1, r + 1);
				double v4 = field.elevation(c, r + 1);
				variants[r * columns + c] = select(v1, v2, v3, v4, threshold);
			}
		});

		CellVariants result = new CellVariants(columns, rows, variants);
		LOGGER.debug("Selected geometry for {} cells: {} hybrid (threshold {})", variants.length, result.count(GeometryVariant.HYBRID),
				threshold);
		return result;
	}
}
