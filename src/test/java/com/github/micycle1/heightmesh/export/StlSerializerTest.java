package com.github.micycle1.heightmesh.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.error.InvalidInputException;
import com.github.micycle1.heightmesh.error.MeshWriteException;
import com.github.micycle1.heightmesh.error.MeshWriteException.Stage;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.Mesh;

class StlSerializerTest {

	@Test
	void flatSquareIsTwelveAxisAlignedFacets() {
		HeightField field = SerializerFixtures.constant(2, 2, 0.0);
		Mesh mesh = SerializerFixtures.mesh(field);
		List<String> lines = SerializerFixtures.lines(new StlSerializer().encode(mesh, SerializerFixtures.solid(field, mesh)));

		assertEquals("solid heightfield", lines.get(0));
		assertEquals("endsolid heightfield", lines.get(lines.size() - 1));
		List<double[]> normals = normals(lines);
		assertEquals(12, normals.size());
		for (double[] n : normals) {
			int unit = 0;
			for (double component : n) {
				if (Math.abs(component) == 1.0) {
					unit++;
				} else {
					assertEquals(0.0, component, "Normal should be axis-aligned");
				}
			}
			assertEquals(1, unit, "Normal should have exactly one unit component");
		}
	}

	@Test
	void surfaceNormalsPointUp() {
		HeightField field = HeightField.of(new double[][] { { 0.0, 0.2, 0.4 }, { 0.1, 0.9, 0.3 }, { 0.0, 0.5, 1.0 } }, 8);
		Mesh mesh = SerializerFixtures.mesh(field);
		List<String> lines = SerializerFixtures.lines(new StlSerializer().encode(mesh, SerializerFixtures.solid(field, mesh)));
		List<double[]> normals = normals(lines);

		int surface = mesh.triangles().size();
		for (int i = 0; i < surface; i++) {
			double[] n = normals.get(i);
			assertTrue(n[2] > 0, "Surface facet " + i + " should face up");
			assertEquals(1.0, Math.sqrt(n[0] * n[0] + n[1] * n[1] + n[2] * n[2]), 1e-5);
		}
		assertEquals(-1.0, normals.get(normals.size() - 1)[2], "Last facet is on the bottom");
	}

	@Test
	void facetsHaveThreeVertices() {
		HeightField field = SerializerFixtures.constant(3, 2, 0.5);
		Mesh mesh = SerializerFixtures.mesh(field);
		List<String> lines = SerializerFixtures.lines(new StlSerializer().encode(mesh, SerializerFixtures.solid(field, mesh)));
		long facets = lines.stream().filter(l -> l.trim().startsWith("facet normal")).count();
		long vertices = lines.stream().filter(l -> l.trim().startsWith("vertex ")).count();
		assertEquals(3 * facets, vertices);
		assertTrue(lines.contains("      vertex -5.000000e-01 2.500000e-01 5.000000e-01"), "Top left corner, centred");
	}

	@Test
	void requiresSolidExtension() {
		HeightField field = SerializerFixtures.constant(2, 2, 0.0);
		Mesh mesh = SerializerFixtures.mesh(field);
		assertThrows(InvalidInputException.class, () -> new StlSerializer().encode(mesh, Optional.empty()));
	}

	@Test
	void failingSinkReportsWriteStage() {
		HeightField field = SerializerFixtures.constant(2, 2, 0.0);
		Mesh mesh = SerializerFixtures.mesh(field);

		MeshWriteException e = assertThrows(MeshWriteException.class,
				() -> new StlSerializer().write(mesh, SerializerFixtures.solid(field, mesh), new SerializerFixtures.ClosedWriter()));
		assertEquals(MeshFormat.STL, e.getFormat());
		assertEquals(Stage.WRITE, e.getStage());
	}

	private static List<double[]> normals(List<String> lines) {
		List<double[]> normals = new ArrayList<>();
		for (String line : lines) {
			String trimmed = line.trim();
			if (trimmed.startsWith("facet normal ")) {
				String[] parts = trimmed.split(" ");
				normals.add(new double[] { Double.parseDouble(parts[2]), Double.parseDouble(parts[3]), Double.parseDouble(parts[4]) });
			}
		}
		return normals;
	}
}
