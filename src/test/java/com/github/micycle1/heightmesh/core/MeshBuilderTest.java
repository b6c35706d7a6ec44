package com.github.micycle1.heightmesh.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.heightmesh.error.GeometryException;
import com.github.micycle1.heightmesh.geom.Geom;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.CellVariants;
import com.github.micycle1.heightmesh.model.Model.GeometryVariant;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;

class MeshBuilderTest {

	@Test
	void constantFieldHasTwoTrianglesPerCell() {
		HeightField field = constant(3, 3, 0.5);
		Mesh mesh = MeshBuilder.build(field, GeometrySelector.select(field, 0.05, false));
		assertEquals(9, mesh.vertices().size());
		assertEquals(8, mesh.triangles().size());
		assertEquals(new Vertex(0, 2, 0.5), mesh.vertices().get(0), "Row 0 is the top of the image");
		assertEquals(new Triangle(0, 3, 4), mesh.triangles().get(0));
	}

	@Test
	void hybridCellJustBelowContrast() {
		HeightField field = HeightField.of(new double[][] { { 0, 0 }, { 0, 1 } }, 8);
		Mesh mesh = MeshBuilder.build(field, GeometrySelector.select(field, 0.99, false));

		assertEquals(5, mesh.vertices().size());
		assertEquals(4, mesh.triangles().size());
		Vertex centre = mesh.vertices().get(4);
		assertEquals(0.5, centre.x());
		assertEquals(0.5, centre.y());
		assertEquals(0.25, centre.z(), "Zero fold mean falls back to the corner average");
		for (Triangle t : mesh.triangles()) {
			assertEquals(4, t.c(), "Every hybrid triangle shares the centre");
		}
	}

	@Test
	void standardCellJustAboveContrast() {
		HeightField field = HeightField.of(new double[][] { { 0, 0 }, { 0, 1 } }, 8);
		Mesh mesh = MeshBuilder.build(field, GeometrySelector.select(field, 1.01, false));
		assertEquals(4, mesh.vertices().size());
		assertEquals(2, mesh.triangles().size());
	}

	@Test
	void centreUsesFoldDiagonal() {
		// |v1 - v3| = 0.8 is the steep diagonal, so the centre sits on v2-v4
		HeightField field = HeightField.of(new double[][] { { 0.9, 0.4 }, { 0.2, 0.1 } }, 8);
		assertEquals(0.3, MeshBuilder.centreElevation(field, 0, 0), 1e-12);

		HeightField other = HeightField.of(new double[][] { { 0.6, 1.0 }, { 0.0, 0.2 } }, 8);
		assertEquals(0.4, MeshBuilder.centreElevation(other, 0, 0), 1e-12);
	}

	@Test
	void trianglesFaceUpAndGridIsShared() {
		HeightField field = GeometrySelectorTest.randomField(new Random(11), 17, 12);
		Mesh mesh = MeshBuilder.build(field, GeometrySelector.select(field, 0.2, false));
		assertSurfaceIntegrity(field, mesh);
	}

	@Test
	void hybridNeverReducesTriangleCount() {
		HeightField field = GeometrySelectorTest.randomField(new Random(3), 9, 9);
		int standard = MeshBuilder.build(field, GeometrySelector.select(field, 1.0, false)).triangles().size();
		int mixed = MeshBuilder.build(field, GeometrySelector.select(field, 0.1, false)).triangles().size();
		assertEquals(8 * 8 * 2, standard);
		assertTrue(mixed >= standard, "Hybrid cells add triangles");
	}

	@Test
	void parallelMatchesSequential() {
		HeightField field = GeometrySelectorTest.randomField(new Random(5), 64, 41);
		CellVariants variants = GeometrySelector.select(field, 0.25, false);
		Mesh sequential = MeshBuilder.build(field, variants, false);
		Mesh parallel = MeshBuilder.build(field, variants, true);
		assertEquals(sequential.vertices(), parallel.vertices());
		assertEquals(sequential.triangles(), parallel.triangles());
	}

	@Test
	void rejectsMismatchedVariants() {
		HeightField field = constant(3, 3, 0);
		CellVariants variants = new CellVariants(1, 1, new GeometryVariant[] { GeometryVariant.STANDARD });
		assertThrows(GeometryException.class, () -> MeshBuilder.build(field, variants));
	}

	@Test
	void rejectsUndecidedCell() {
		HeightField field = constant(2, 2, 0);
		CellVariants variants = new CellVariants(1, 1, new GeometryVariant[1]);
		assertThrows(GeometryException.class, () -> MeshBuilder.build(field, variants));
	}

	static void assertSurfaceIntegrity(HeightField field, Mesh mesh) {
		List<Vertex> vertices = mesh.vertices();
		Set<Coordinate> planar = new HashSet<>();
		for (Vertex v : vertices) {
			assertTrue(planar.add(new Coordinate(v.x(), v.y())), "Duplicate planar vertex " + v);
		}
		for (Triangle t : mesh.triangles()) {
			assertTrue(Geom.isCounterClockwise(vertices.get(t.a()), vertices.get(t.b()), vertices.get(t.c())), "Triangle " + t + " should face +z");
		}
		int border = 2 * (field.width - 1) + 2 * (field.height - 1);
		assertEquals(border, MeshTopology.boundaryEdges(mesh.triangles()).size(), "Only the grid border is open");
		assertTrue(MeshTopology.isConsistentlyOriented(mesh.triangles()));
	}

	static HeightField constant(int width, int height, double value) {
		double[] samples = new double[width * height];
		Arrays.fill(samples, value);
		return HeightField.of(width, height, samples, 8);
	}
}
