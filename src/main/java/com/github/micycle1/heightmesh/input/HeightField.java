package com.github.micycle1.heightmesh.input;

import java.util.Arrays;

import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.heightmesh.error.InvalidInputException;

/**
 * Immutable grid of normalised elevation samples consumed by the mesh
 * builder.
 * <p>
 * Samples are stored row-major with row 0 being the top row of the source
 * image. Grid spacing is one unit per sample in both directions. Input
 * adapters (see {@link Adapter}) translate decoded rasters into this type;
 * everything downstream depends on it only.
 */
public final class HeightField {

	public final int width;
	public final int height;
	public final int bitDepth;
	private final double[] samples;
	private final double minElevation;
	private final double maxElevation;

	private HeightField(int width, int height, int bitDepth, double[] samples) {
		this.width = width;
		this.height = height;
		this.bitDepth = bitDepth;
		this.samples = samples;
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double s : samples) {
			min = Math.min(min, s);
			max = Math.max(max, s);
		}
		this.minElevation = min;
		this.maxElevation = max;
	}

	/**
	 * Creates a heightfield from rows of normalised elevations.
	 *
	 * @param rows     elevation rows, top row first; all rows must have equal
	 *                 length
	 * @param bitDepth bit depth of the source raster, 8 or 16
	 * @return validated heightfield (the input array is copied)
	 * @throws InvalidInputException if the grid is smaller than 2x2, ragged,
	 *                               holds a non-finite sample, or the bit depth
	 *                               is unsupported
	 */
	public static HeightField of(double[][] rows, int bitDepth) {
		if (rows == null || rows.length < 2) {
			throw new InvalidInputException("Heightfield needs at least 2 rows, got " + (rows == null ? 0 : rows.length));
		}
		int width = rows[0] == null ? 0 : rows[0].length;
		double[] samples = new double[width * rows.length];
		for (int r = 0; r < rows.length; r++) {
			if (rows[r] == null || rows[r].length != width) {
				throw new InvalidInputException("Row " + r + " length differs from row 0 length " + width);
			}
			System.arraycopy(rows[r], 0, samples, r * width, width);
		}
		return of(width, rows.length, samples, bitDepth);
	}

	/**
	 * Creates a heightfield from a row-major sample array.
	 *
	 * @param width    samples per row
	 * @param height   number of rows
	 * @param samples  row-major normalised elevations, length
	 *                 {@code width * height}
	 * @param bitDepth bit depth of the source raster, 8 or 16
	 * @return validated heightfield (the input array is copied)
	 */
	public static HeightField of(int width, int height, double[] samples, int bitDepth) {
		if (width < 2 || height < 2) {
			throw new InvalidInputException("Heightfield must be at least 2x2, got " + width + "x" + height);
		}
		if (bitDepth != 8 && bitDepth != 16) {
			throw new InvalidInputException("Bit depth must be 8 or 16, got " + bitDepth);
		}
		if (samples == null || samples.length != width * height) {
			throw new InvalidInputException(
					"Sample count " + (samples == null ? 0 : samples.length) + " does not match " + width + "x" + height);
		}
		for (int i = 0; i < samples.length; i++) {
			if (!Double.isFinite(samples[i])) {
				throw new InvalidInputException("Sample at column " + (i % width) + ", row " + (i / width) + " is not finite: " + samples[i]);
			}
		}
		return new HeightField(width, height, bitDepth, samples.clone());
	}

	/**
	 * Creates a heightfield from integer levels, normalising by the maximum level
	 * of the bit depth (255 or 65535).
	 *
	 * @param levels   level rows, top row first
	 * @param bitDepth 8 or 16
	 * @return validated heightfield
	 */
	public static HeightField ofLevels(int[][] levels, int bitDepth) {
		if (bitDepth != 8 && bitDepth != 16) {
			throw new InvalidInputException("Bit depth must be 8 or 16, got " + bitDepth);
		}
		if (levels == null) {
			throw new InvalidInputException("Heightfield needs at least 2 rows, got 0");
		}
		double max = maxValue(bitDepth);
		double[][] rows = new double[levels.length][];
		for (int r = 0; r < levels.length; r++) {
			if (levels[r] == null) {
				throw new InvalidInputException("Row " + r + " is missing");
			}
			rows[r] = new double[levels[r].length];
			for (int c = 0; c < levels[r].length; c++) {
				rows[r][c] = levels[r][c] / max;
			}
		}
		return of(rows, bitDepth);
	}

	public static int maxValue(int bitDepth) {
		return bitDepth == 16 ? 65535 : 255;
	}

	/**
	 * @param column sample column, 0 at the left
	 * @param row    sample row, 0 at the top
	 * @return elevation sample
	 */
	public double elevation(int column, int row) {
		if (column < 0 || column >= width || row < 0 || row >= height) {
			throw new IndexOutOfBoundsException("Sample (" + column + ", " + row + ") outside " + width + "x" + height);
		}
		return samples[row * width + column];
	}

	public int maxValue() {
		return maxValue(bitDepth);
	}

	public int cellCount() {
		return (width - 1) * (height - 1);
	}

	public double minElevation() {
		return minElevation;
	}

	public double maxElevation() {
		return maxElevation;
	}

	/**
	 * Planar extent of the grid in mesh coordinates: x spans columns, y spans
	 * rows (bottom row at y = 0).
	 *
	 * @return envelope {@code [0, width-1] x [0, height-1]}
	 */
	public Envelope extent() {
		return new Envelope(0, width - 1, 0, height - 1);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof HeightField other)) {
			return false;
		}
		return width == other.width && height == other.height && bitDepth == other.bitDepth && Arrays.equals(samples, other.samples);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * (31 * width + height) + bitDepth) + Arrays.hashCode(samples);
	}

	@Override
	public String toString() {
		return "HeightField[" + width + "x" + height + ", " + bitDepth + " bit]";
	}
}
