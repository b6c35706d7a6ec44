package com.github.micycle1.heightmesh.core;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.heightmesh.core.MeshTopology.DirectedEdge;
import com.github.micycle1.heightmesh.error.GeometryException;
import com.github.micycle1.heightmesh.error.InvalidInputException;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;
import com.github.micycle1.heightmesh.model.Model.WallSide;

/**
 * Closes an elevation surface into a solid by adding side walls down to a flat
 * base and a bottom over the base.
 * <p>
 * One base vertex is placed under every grid vertex. Each boundary edge
 * {@code a -> b} of the surface (as wound by its triangle) becomes the wall
 * quad {@code b, a, a', b'}, which runs the shared edge the opposite way and so
 * keeps the outward orientation across the seam. The bottom mirrors the
 * standard split of every cell with reversed winding, facing -z.
 */
public final class SolidExtruder {

	private static final Logger LOGGER = LoggerFactory.getLogger(SolidExtruder.class);

	private SolidExtruder() {
	}

	/**
	 * Builds the solid extension of a mesh.
	 *
	 * @param mesh          elevation surface
	 * @param extent        planar extent of the heightfield in mesh coordinates
	 * @param baseElevation elevation of the bottom; not above the lowest sample
	 * @return walls and bottom, indexed after the mesh vertices
	 * @throws InvalidInputException if the base is not finite, lies above the
	 *                               surface, or the extent does not match the
	 *                               mesh
	 * @throws GeometryException     if the surface boundary is not on the grid
	 *                               border or the result is not closed
	 */
	public static SolidExtension extrude(Mesh mesh, Envelope extent, double baseElevation) {
		if (!Double.isFinite(baseElevation)) {
			throw new InvalidInputException("Base elevation must be finite, was " + baseElevation);
		}
		if (!extent.equals(mesh.extent())) {
			throw new InvalidInputException("Extent " + extent + " does not match mesh extent " + mesh.extent());
		}
		int gridCount = mesh.gridVertexCount();
		List<Vertex> meshVertices = mesh.vertices();
		double lowest = Double.POSITIVE_INFINITY;
		for (int i = 0; i < gridCount; i++) {
			lowest = Math.min(lowest, meshVertices.get(i).z());
		}
		if (baseElevation > lowest) {
			throw new InvalidInputException("Base elevation " + baseElevation + " lies above the lowest sample " + lowest);
		}

		int offset = meshVertices.size();
		List<Vertex> base = new ArrayList<>(gridCount);
		for (int i = 0; i < gridCount; i++) {
			Vertex v = meshVertices.get(i);
			base.add(new Vertex(v.x(), v.y(), baseElevation));
		}

		List<Triangle> triangles = new ArrayList<>();
		List<WallSide> sides = new ArrayList<>();

		for (DirectedEdge edge : MeshTopology.boundaryEdges(mesh.triangles())) {
			if (edge.from() >= gridCount || edge.to() >= gridCount) {
				throw new GeometryException("Boundary edge " + edge + " does not lie on the grid border");
			}
			WallSide side = sideOf(meshVertices.get(edge.from()), meshVertices.get(edge.to()), extent);
			int a = edge.from();
			int b = edge.to();
			int aBase = offset + a;
			int bBase = offset + b;
			triangles.add(new Triangle(b, a, aBase));
			triangles.add(new Triangle(b, aBase, bBase));
			sides.add(side);
			sides.add(side);
		}
		int wallCount = triangles.size();

		for (int r = 0; r < mesh.rows - 1; r++) {
			for (int c = 0; c < mesh.columns - 1; c++) {
				int i1 = offset + mesh.gridIndex(c, r);
				int i2 = offset + mesh.gridIndex(c + 1, r);
				int i3 = offset + mesh.gridIndex(c + 1, r + 1);
				int i4 = offset + mesh.gridIndex(c, r + 1);
				triangles.add(new Triangle(i1, i3, i4));
				triangles.add(new Triangle(i1, i2, i3));
				sides.add(WallSide.BOTTOM);
				sides.add(WallSide.BOTTOM);
			}
		}

		List<Triangle> combined = new ArrayList<>(mesh.triangles());
		combined.addAll(triangles);
		if (!MeshTopology.isWatertight(combined) || !MeshTopology.isConsistentlyOriented(combined)) {
			throw new GeometryException("Extruded solid is not closed and consistently oriented");
		}

		LOGGER.debug("Extruded solid to base {}: {} wall triangles, {} bottom triangles", baseElevation, wallCount,
				triangles.size() - wallCount);
		return new SolidExtension(offset, baseElevation, extent, base, triangles, sides);
	}

	private static WallSide sideOf(Vertex a, Vertex b, Envelope extent) {
		if (a.x() == extent.getMinX() && b.x() == extent.getMinX()) {
			return WallSide.WEST;
		}
		if (a.x() == extent.getMaxX() && b.x() == extent.getMaxX()) {
			return WallSide.EAST;
		}
		if (a.y() == extent.getMinY() && b.y() == extent.getMinY()) {
			return WallSide.SOUTH;
		}
		if (a.y() == extent.getMaxY() && b.y() == extent.getMaxY()) {
			return WallSide.NORTH;
		}
		throw new GeometryException("Boundary edge " + a + " -> " + b + " is not on the extent border " + extent);
	}
}
