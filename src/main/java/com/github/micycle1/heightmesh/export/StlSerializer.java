package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;

import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.error.GeometryException;
import com.github.micycle1.heightmesh.geom.Geom;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;
import com.github.micycle1.heightmesh.model.Model.WallSide;

/**
 * ASCII STL of the closed solid: surface facets first, then walls and bottom
 * in extension order.
 * <p>
 * Surface normals are computed from the written coordinates. Wall and bottom
 * normals are taken from their {@link WallSide}, since a wall under a
 * zero-elevation edge has no area to derive one from.
 */
public final class StlSerializer extends AbstractMeshSerializer {

	static final String SOLID_NAME = "heightfield";

	public StlSerializer() {
		this(Placement.CENTERED);
	}

	public StlSerializer(Placement placement) {
		super(MeshFormat.STL, placement);
	}

	@Override
	void writeBody(Mesh mesh, Optional<SolidExtension> solid, OutputFrame frame, Decimals d, Writer out) throws IOException {
		SolidExtension extension = solid.orElseThrow();
		List<Vertex> vertices = mesh.vertices();
		out.write("solid " + SOLID_NAME + "\n");
		for (Triangle t : mesh.triangles()) {
			Vertex a = frame.apply(vertices.get(t.a()));
			Vertex b = frame.apply(vertices.get(t.b()));
			Vertex c = frame.apply(vertices.get(t.c()));
			Vector3D n = Geom.unitNormal(a, b, c);
			if (n == null) {
				throw new GeometryException("Surface triangle " + t + " is degenerate");
			}
			writeFacet(n.getX(), n.getY(), n.getZ(), a, b, c, d, out);
		}
		List<Triangle> closing = extension.triangles();
		for (int i = 0; i < closing.size(); i++) {
			Triangle t = closing.get(i);
			WallSide side = extension.side(i);
			writeFacet(side.nx, side.ny, side.nz, frame.apply(extension.vertex(mesh, t.a())), frame.apply(extension.vertex(mesh, t.b())),
					frame.apply(extension.vertex(mesh, t.c())), d, out);
		}
		out.write("endsolid " + SOLID_NAME + "\n");
	}

	private static void writeFacet(double nx, double ny, double nz, Vertex a, Vertex b, Vertex c, Decimals d, Writer out) throws IOException {
		out.write("  facet normal " + d.scientific(nx) + " " + d.scientific(ny) + " " + d.scientific(nz) + "\n");
		out.write("    outer loop\n");
		writeVertex(a, d, out);
		writeVertex(b, d, out);
		writeVertex(c, d, out);
		out.write("    endloop\n");
		out.write("  endfacet\n");
	}

	private static void writeVertex(Vertex v, Decimals d, Writer out) throws IOException {
		out.write("      vertex " + d.scientific(v.x()) + " " + d.scientific(v.y()) + " " + d.scientific(v.z()) + "\n");
	}
}
