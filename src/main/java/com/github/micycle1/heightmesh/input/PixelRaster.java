package com.github.micycle1.heightmesh.input;

/**
 * Decoded raster handed over by an image reader.
 *
 * @param pixels   channel values indexed {@code [row][column][channel]}, row 0
 *                 at the top; 1 to 4 channels (L, LA, RGB, RGBA)
 * @param maxValue maximum channel value, 255 for 8 bit and 65535 for 16 bit
 *                 sources
 */
public record PixelRaster(int[][][] pixels, int maxValue) {
}
