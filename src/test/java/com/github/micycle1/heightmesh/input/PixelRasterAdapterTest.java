package com.github.micycle1.heightmesh.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.github.micycle1.heightmesh.error.InvalidInputException;

class PixelRasterAdapterTest {

	private final PixelRasterAdapter adapter = new PixelRasterAdapter();

	@Test
	void greyscaleIsNormalised() {
		HeightField field = adapter.toHeightField(raster(255, new int[] { 0 }, new int[] { 255 }, new int[] { 51 }, new int[] { 102 }));
		assertEquals(8, field.bitDepth);
		assertEquals(0.0, field.elevation(0, 0));
		assertEquals(1.0, field.elevation(1, 0));
		assertEquals(0.2, field.elevation(0, 1), 1e-12);
		assertEquals(0.4, field.elevation(1, 1), 1e-12);
	}

	@Test
	void alphaScalesLuminance() {
		HeightField field = adapter.toHeightField(raster(255, new int[] { 255, 51 }, new int[] { 255, 0 }, new int[] { 255, 255 }, new int[] { 0, 255 }));
		assertEquals(0.2, field.elevation(0, 0), 1e-12);
		assertEquals(0.0, field.elevation(1, 0), "Transparent pixel should sink to zero");
		assertEquals(1.0, field.elevation(0, 1), 1e-12);
		assertEquals(0.0, field.elevation(1, 1));
	}

	@Test
	void colourUsesLuma() {
		HeightField field = adapter.toHeightField(
				raster(255, new int[] { 255, 255, 255 }, new int[] { 255, 0, 0 }, new int[] { 0, 255, 0 }, new int[] { 0, 0, 255 }));
		assertEquals(1.0, field.elevation(0, 0), 1e-12);
		assertEquals(0.298936021293775, field.elevation(1, 0), 1e-12);
		assertEquals(0.587043074451121, field.elevation(0, 1), 1e-12);
		assertEquals(0.114020904255103, field.elevation(1, 1), 1e-12);
	}

	@Test
	void colourWithAlpha() {
		HeightField field = adapter.toHeightField(raster(255, new int[] { 255, 255, 255, 0 }, new int[] { 255, 255, 255, 255 },
				new int[] { 255, 0, 0, 255 }, new int[] { 0, 0, 0, 255 }));
		assertEquals(0.0, field.elevation(0, 0), 1e-12);
		assertEquals(1.0, field.elevation(1, 0), 1e-12);
		assertEquals(0.298936021293775, field.elevation(0, 1), 1e-12);
	}

	@Test
	void sixteenBitRaster() {
		HeightField field = PixelRasterAdapter.fromRaster(raster(65535, new int[] { 65535 }, new int[] { 0 }, new int[] { 0 }, new int[] { 0 }));
		assertEquals(16, field.bitDepth);
		assertEquals(1.0, field.elevation(0, 0));
	}

	@Test
	void rejectsBadRasters() {
		assertThrows(InvalidInputException.class, () -> adapter.toHeightField(raster(1000, new int[] { 0 }, new int[] { 0 }, new int[] { 0 }, new int[] { 0 })));
		assertThrows(InvalidInputException.class, () -> adapter.toHeightField(raster(255, new int[] { 300 }, new int[] { 0 }, new int[] { 0 }, new int[] { 0 })));
		assertThrows(InvalidInputException.class,
				() -> adapter.toHeightField(raster(255, new int[] { 0, 0, 0, 0, 0 }, new int[] { 0 }, new int[] { 0 }, new int[] { 0 })));
		assertThrows(InvalidInputException.class, () -> adapter.toHeightField(new PixelRaster(new int[][][] { { { 0 }, { 0 } } }, 255)));
		assertThrows(InvalidInputException.class, () -> adapter.toHeightField(null));
	}

	/**
	 * 2x2 raster from pixels in row-major order.
	 */
	private static PixelRaster raster(int maxValue, int[] p00, int[] p10, int[] p01, int[] p11) {
		return new PixelRaster(new int[][][] { { p00, p10 }, { p01, p11 } }, maxValue);
	}
}
