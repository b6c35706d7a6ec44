package com.github.micycle1.heightmesh.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.heightmesh.error.GeometryException;

/**
 * Domain model types shared by the mesh builder, the solid extruder and the
 * serializers.
 * <p>
 * A {@link Mesh} is an indexed arena of vertices and triangles. It is built
 * once per conversion and only read afterwards; solid formats read an
 * additional {@link SolidExtension} that is never merged back into the mesh.
 */
public final class Model {

	private Model() {
	}

	/**
	 * Triangulation chosen for one grid cell.
	 */
	public enum GeometryVariant {
		/** Two triangles split along the fixed 1-3 diagonal. */
		STANDARD,
		/** Four triangles around a synthesized centre vertex. */
		HYBRID
	}

	/**
	 * Face of the solid an extension triangle belongs to, with its outward
	 * normal in mesh coordinates.
	 */
	public enum WallSide {
		WEST(-1, 0, 0), EAST(1, 0, 0), SOUTH(0, -1, 0), NORTH(0, 1, 0), BOTTOM(0, 0, -1);

		public final int nx, ny, nz;

		WallSide(int nx, int ny, int nz) {
			this.nx = nx;
			this.ny = ny;
			this.nz = nz;
		}
	}

	public record Vertex(double x, double y, double z) {

		public Coordinate toCoordinate() {
			return new Coordinate(x, y, z);
		}
	}

	/**
	 * Vertex index triple, counter-clockwise when seen from outside the surface.
	 */
	public record Triangle(int a, int b, int c) {
		public Triangle {
			if (a < 0 || b < 0 || c < 0) {
				throw new GeometryException("Triangle indices must be non-negative: " + a + ", " + b + ", " + c);
			}
			if (a == b || b == c || a == c) {
				throw new GeometryException("Triangle vertices must be distinct: " + a + ", " + b + ", " + c);
			}
		}

		public int get(int i) {
			return switch (i) {
				case 0 -> a;
				case 1 -> b;
				case 2 -> c;
				default -> throw new IndexOutOfBoundsException(i);
			};
		}
	}

	/**
	 * Per-cell geometry decisions in row-major cell order (row 0 at the top of
	 * the source image).
	 */
	public static final class CellVariants {
		public final int columns;
		public final int rows;
		private final GeometryVariant[] variants;

		public CellVariants(int columns, int rows, GeometryVariant[] variants) {
			if (variants == null || variants.length != columns * rows) {
				throw new GeometryException("Expected " + columns * rows + " cell variants, got " + (variants == null ? 0 : variants.length));
			}
			this.columns = columns;
			this.rows = rows;
			this.variants = variants.clone();
		}

		public GeometryVariant get(int column, int row) {
			GeometryVariant v = variants[row * columns + column];
			if (v == null) {
				throw new GeometryException("Cell (" + column + ", " + row + ") has no geometry variant");
			}
			return v;
		}

		public int count(GeometryVariant variant) {
			int n = 0;
			for (GeometryVariant v : variants) {
				if (v == variant) {
					n++;
				}
			}
			return n;
		}
	}

	/**
	 * Elevation surface produced by the mesh builder.
	 * <p>
	 * Grid vertices come first, one per sample, at index
	 * {@code row * columns + column}; synthesized cell centres follow in cell
	 * order.
	 */
	public static final class Mesh {
		public final int columns;
		public final int rows;
		public final int bitDepth;
		private final List<Vertex> vertices;
		private final List<Triangle> triangles;

		public Mesh(int columns, int rows, int bitDepth, List<Vertex> vertices, List<Triangle> triangles) {
			this.columns = columns;
			this.rows = rows;
			this.bitDepth = bitDepth;
			this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
			this.triangles = Collections.unmodifiableList(new ArrayList<>(triangles));
			for (Triangle t : this.triangles) {
				if (t.a() >= this.vertices.size() || t.b() >= this.vertices.size() || t.c() >= this.vertices.size()) {
					throw new GeometryException("Triangle " + t + " references a vertex outside " + this.vertices.size());
				}
			}
		}

		public List<Vertex> vertices() {
			return vertices;
		}

		public List<Triangle> triangles() {
			return triangles;
		}

		public int gridVertexCount() {
			return columns * rows;
		}

		/**
		 * @return index of the grid vertex for a sample (row 0 at the top)
		 */
		public int gridIndex(int column, int row) {
			return row * columns + column;
		}

		/**
		 * Planar extent in mesh coordinates.
		 */
		public Envelope extent() {
			return new Envelope(0, columns - 1, 0, rows - 1);
		}

		public double maxElevation() {
			double max = Double.NEGATIVE_INFINITY;
			for (Vertex v : vertices) {
				max = Math.max(max, v.z());
			}
			return max;
		}
	}

	/**
	 * Side walls and bottom that close the elevation surface into a solid.
	 * <p>
	 * Triangle indices address the concatenation of the mesh vertices followed
	 * by this extension's vertices, so the extension is meaningless without the
	 * mesh it was built for.
	 */
	public static final class SolidExtension {
		public final int vertexOffset;
		public final double baseElevation;
		private final Envelope extent;
		private final List<Vertex> vertices;
		private final List<Triangle> triangles;
		private final List<WallSide> sides;

		public SolidExtension(int vertexOffset, double baseElevation, Envelope extent, List<Vertex> vertices, List<Triangle> triangles,
				List<WallSide> sides) {
			if (triangles.size() != sides.size()) {
				throw new GeometryException("Every extension triangle needs a wall side (" + triangles.size() + " vs " + sides.size() + ")");
			}
			this.vertexOffset = vertexOffset;
			this.baseElevation = baseElevation;
			this.extent = new Envelope(extent);
			this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
			this.triangles = Collections.unmodifiableList(new ArrayList<>(triangles));
			this.sides = Collections.unmodifiableList(new ArrayList<>(sides));
		}

		public List<Vertex> vertices() {
			return vertices;
		}

		public List<Triangle> triangles() {
			return triangles;
		}

		public WallSide side(int triangle) {
			return sides.get(triangle);
		}

		public Envelope extent() {
			return new Envelope(extent);
		}

		/**
		 * Resolves a combined index against the mesh and this extension.
		 */
		public Vertex vertex(Mesh mesh, int index) {
			return index < vertexOffset ? mesh.vertices().get(index) : vertices.get(index - vertexOffset);
		}

		public int count(WallSide side) {
			int n = 0;
			for (WallSide s : sides) {
				if (s == side) {
					n++;
				}
			}
			return n;
		}
	}
}
