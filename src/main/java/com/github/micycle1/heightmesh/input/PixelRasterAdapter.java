package com.github.micycle1.heightmesh.input;

import com.github.micycle1.heightmesh.error.InvalidInputException;

/**
 * Adapter that converts a decoded {@link PixelRaster} into a
 * {@link HeightField} of brightness values.
 * <p>
 * Colour pixels are reduced to Rec. 601 luma; an alpha channel multiplies the
 * brightness so that transparent pixels sink to zero. Results are divided by
 * the raster's maximum channel value.
 */
public class PixelRasterAdapter implements Adapter<PixelRaster> {

	private static final double LUMA_R = 0.298936021293775;
	private static final double LUMA_G = 0.587043074451121;
	private static final double LUMA_B = 0.114020904255103;

	@Override
	public HeightField toHeightField(PixelRaster raster) {
		if (raster == null || raster.pixels() == null) {
			throw new InvalidInputException("Raster is missing");
		}
		int bitDepth = bitDepthOf(raster.maxValue());
		double max = raster.maxValue();
		int[][][] pixels = raster.pixels();
		if (pixels.length == 0 || pixels[0] == null) {
			throw new InvalidInputException("Raster has no rows");
		}
		int width = pixels[0].length;
		int height = pixels.length;
		double[] samples = new double[width * height];
		for (int r = 0; r < height; r++) {
			if (pixels[r] == null || pixels[r].length != width) {
				throw new InvalidInputException("Raster row " + r + " length differs from row 0 length " + width);
			}
			for (int c = 0; c < width; c++) {
				samples[r * width + c] = brightness(pixels[r][c], max, c, r);
			}
		}
		return HeightField.of(width, height, samples, bitDepth);
	}

	public static HeightField fromRaster(PixelRaster raster) {
		return new PixelRasterAdapter().toHeightField(raster);
	}

	private static double brightness(int[] px, double max, int column, int row) {
		if (px == null || px.length < 1 || px.length > 4) {
			throw new InvalidInputException("Pixel (" + column + ", " + row + ") must have 1 to 4 channels");
		}
		for (int v : px) {
			if (v < 0 || v > max) {
				throw new InvalidInputException("Pixel (" + column + ", " + row + ") channel value " + v + " outside 0.." + (int) max);
			}
		}
		double intensity = switch (px.length) {
			case 1 -> px[0];
			case 2 -> px[0] * px[1] / max;
			case 3 -> luma(px);
			default -> luma(px) * px[3] / max;
		};
		return intensity / max;
	}

	private static double luma(int[] px) {
		return LUMA_R * px[0] + LUMA_G * px[1] + LUMA_B * px[2];
	}

	private static int bitDepthOf(int maxValue) {
		if (maxValue == 255) {
			return 8;
		}
		if (maxValue == 65535) {
			return 16;
		}
		throw new InvalidInputException("Raster max value must be 255 or 65535, got " + maxValue);
	}
}
