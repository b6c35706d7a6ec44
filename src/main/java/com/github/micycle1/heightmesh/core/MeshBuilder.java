package com.github.micycle1.heightmesh.core;

import static com.github.micycle1.heightmesh.geom.Geom.mean;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.heightmesh.error.GeometryException;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.CellVariants;
import com.github.micycle1.heightmesh.model.Model.GeometryVariant;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * Builds the elevation surface of a heightfield as an indexed triangle mesh.
 * <p>
 * Mesh coordinates put sample {@code (column, row)} at
 * {@code x = column, y = height - 1 - row}, so the image reads upright when
 * viewed from +z. Every triangle winds counter-clockwise in that frame.
 * <p>
 * Grid vertices are addressed by their sample index, which is what keeps
 * neighbouring cells crack-free: a shared corner is one vertex no matter how
 * many cells reference it. Rows are built as independent fragments and merged
 * in row order, so a parallel build produces exactly the sequential result.
 */
public final class MeshBuilder {

	private static final Logger LOGGER = LoggerFactory.getLogger(MeshBuilder.class);

	private MeshBuilder() {
	}

	/**
	 * Triangles of one row. Centre vertices are referenced by {@code -(k + 1)}
	 * where {@code k} is the centre's position within the row, and renumbered
	 * during the merge.
	 */
	private record RowFragment(int[] corners, int cornerCount, List<Vertex> centres) {
	}

	public static Mesh build(HeightField field, CellVariants variants) {
		return build(field, variants, false);
	}

	/**
	 * Builds the mesh.
	 *
	 * @param field    source heightfield
	 * @param variants one decision per cell, as produced by
	 *                 {@link GeometrySelector}
	 * @param parallel build rows on the common fork-join pool
	 * @return immutable mesh
	 * @throws GeometryException if the variants do not cover the grid
	 */
	public static Mesh build(HeightField field, CellVariants variants, boolean parallel) {
		if (variants.columns != field.width - 1 || variants.rows != field.height - 1) {
			throw new GeometryException("Cell variants " + variants.columns + "x" + variants.rows + " do not match heightfield cells "
					+ (field.width - 1) + "x" + (field.height - 1));
		}

		IntStream rowStream = IntStream.range(0, variants.rows);
		if (parallel) {
			rowStream = rowStream.parallel();
		}
		List<RowFragment> fragments = rowStream.mapToObj(r -> buildRow(field, variants, r)).toList();

		List<Vertex> vertices = new ArrayList<>(field.width * field.height);
		for (int r = 0; r < field.height; r++) {
			for (int c = 0; c < field.width; c++) {
				vertices.add(new Vertex(c, yOf(field, r), field.elevation(c, r)));
			}
		}

		List<Triangle> triangles = new ArrayList<>();
		for (RowFragment fragment : fragments) {
			int centreBase = vertices.size();
			vertices.addAll(fragment.centres());
			int[] corners = fragment.corners();
			for (int i = 0; i < fragment.cornerCount(); i += 3) {
				triangles.add(new Triangle(resolve(corners[i], centreBase), resolve(corners[i + 1], centreBase),
						resolve(corners[i + 2], centreBase)));
			}
		}

		Mesh mesh = new Mesh(field.width, field.height, field.bitDepth, vertices, triangles);
		LOGGER.debug("Built mesh for {}: {} vertices, {} triangles", field, vertices.size(), triangles.size());
		return mesh;
	}

	private static RowFragment buildRow(HeightField field, CellVariants variants, int r) {
		int[] corners = new int[variants.columns * 12];
		int n = 0;
		List<Vertex> centres = new ArrayList<>();
		for (int c = 0; c < variants.columns; c++) {
			int i1 = r * field.width + c;
			int i2 = i1 + 1;
			int i3 = i2 + field.width;
			int i4 = i1 + field.width;
			GeometryVariant variant = variants.get(c, r);
			switch (variant) {
				case STANDARD -> {
					n = put(corners, n, i1, i4, i3);
					n = put(corners, n, i1, i3, i2);
				}
				case HYBRID -> {
					centres.add(new Vertex(c + 0.5, yOf(field, r) - 0.5, centreElevation(field, c, r)));
					int centre = -centres.size();
					n = put(corners, n, i1, i4, centre);
					n = put(corners, n, i4, i3, centre);
					n = put(corners, n, i3, i2, centre);
					n = put(corners, n, i2, i1, centre);
				}
			}
		}
		return new RowFragment(corners, n, centres);
	}

	/**
	 * Elevation of a hybrid cell's centre: the mean of the fold diagonal, which
	 * is the diagonal other than the steeper one. Falls back to the mean of all
	 * four corners when the fold mean is exactly zero, so a lone raised corner
	 * still lifts the centre.
	 */
	static double centreElevation(HeightField field, int c, int r) {
		double v1 = field.elevation(c, r);
		double v2 = field.elevation(c + 1, r);
		double v3 = field.elevation(c + 1, r + 1);
		double v4 = field.elevation(c, r + 1);
		double centre = Math.abs(v1 - v3) > Math.abs(v2 - v4) ? mean(v2, v4) : mean(v1, v3);
		if (centre == 0) {
			centre = mean(v1, v2, v3, v4);
		}
		return centre;
	}

	private static double yOf(HeightField field, int row) {
		return field.height - 1 - row;
	}

	private static int put(int[] corners, int n, int a, int b, int c) {
		corners[n] = a;
		corners[n + 1] = b;
		corners[n + 2] = c;
		return n + 3;
	}

	private static int resolve(int corner, int centreBase) {
		return corner >= 0 ? corner : centreBase - corner - 1;
	}
}
