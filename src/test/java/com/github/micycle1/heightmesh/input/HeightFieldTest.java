package com.github.micycle1.heightmesh.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.heightmesh.error.InvalidInputException;

class HeightFieldTest {

	@Test
	void rowsAreCopiedRowMajor() {
		double[][] rows = { { 0.1, 0.2, 0.3 }, { 0.4, 0.5, 0.6 } };
		HeightField field = HeightField.of(rows, 8);
		rows[0][0] = 0.9;

		assertEquals(3, field.width);
		assertEquals(2, field.height);
		assertEquals(0.1, field.elevation(0, 0), "Input array should be copied");
		assertEquals(0.6, field.elevation(2, 1));
		assertEquals(2, field.cellCount());
		assertEquals(0.1, field.minElevation());
		assertEquals(0.6, field.maxElevation());
	}

	@Test
	void levelsAreNormalisedByBitDepth() {
		HeightField eight = HeightField.ofLevels(new int[][] { { 0, 255 }, { 51, 102 } }, 8);
		assertEquals(1.0, eight.elevation(1, 0));
		assertEquals(0.2, eight.elevation(0, 1), 1e-15);

		HeightField sixteen = HeightField.ofLevels(new int[][] { { 0, 65535 }, { 0, 0 } }, 16);
		assertEquals(1.0, sixteen.elevation(1, 0));
		assertEquals(65535, sixteen.maxValue());
	}

	@Test
	void extentSpansGrid() {
		HeightField field = HeightField.of(5, 3, new double[15], 8);
		assertEquals(new Envelope(0, 4, 0, 2), field.extent());
	}

	@Test
	void rejectsDegenerateGrid() {
		assertThrows(InvalidInputException.class, () -> HeightField.of(new double[][] { { 0.0, 0.0 } }, 8));
		assertThrows(InvalidInputException.class, () -> HeightField.of(1, 4, new double[4], 8));
	}

	@Test
	void rejectsRaggedRows() {
		assertThrows(InvalidInputException.class, () -> HeightField.of(new double[][] { { 0.0, 0.0 }, { 0.0 } }, 8));
	}

	@Test
	void rejectsNonFiniteSamples() {
		InvalidInputException e = assertThrows(InvalidInputException.class,
				() -> HeightField.of(new double[][] { { 0.0, 0.0 }, { 0.0, Double.NaN } }, 8));
		assertTrue(e.getMessage().contains("column 1, row 1"), "Message should locate the sample: " + e.getMessage());
		assertThrows(InvalidInputException.class, () -> HeightField.of(new double[][] { { 0.0, Double.POSITIVE_INFINITY }, { 0.0, 0.0 } }, 8));
	}

	@Test
	void rejectsUnsupportedBitDepth() {
		assertThrows(InvalidInputException.class, () -> HeightField.of(2, 2, new double[4], 12));
		assertThrows(InvalidInputException.class, () -> HeightField.ofLevels(new int[][] { { 0, 0 }, { 0, 0 } }, 1));
	}

	@Test
	void elevationOutsideGridThrows() {
		HeightField field = HeightField.of(2, 2, new double[4], 8);
		assertThrows(IndexOutOfBoundsException.class, () -> field.elevation(2, 0));
	}

	@Test
	void equalFieldsAreEqual() {
		HeightField a = HeightField.of(2, 2, new double[] { 0, 0.5, 1, 0 }, 8);
		HeightField b = HeightField.of(new double[][] { { 0, 0.5 }, { 1, 0 } }, 8);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}
}
