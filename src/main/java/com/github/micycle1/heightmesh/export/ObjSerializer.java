package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.util.Optional;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * Wavefront OBJ with one object, {@code heightfield}, holding the surface
 * only. Face indices are 1-based.
 */
public final class ObjSerializer extends AbstractMeshSerializer {

	static final String OBJECT_NAME = "heightfield";

	public ObjSerializer() {
		this(Placement.CENTERED);
	}

	public ObjSerializer(Placement placement) {
		super(MeshFormat.OBJ, placement);
	}

	@Override
	void writeBody(Mesh mesh, Optional<SolidExtension> solid, OutputFrame frame, Decimals d, Writer out) throws IOException {
		out.write("# Generated by " + GENERATOR + "\n");
		out.write("# Source heightfield: " + mesh.columns + " x " + mesh.rows + ", " + mesh.bitDepth + " bit\n");
		out.write("# " + mesh.vertices().size() + " vertices, " + mesh.triangles().size() + " faces\n");
		out.write("o " + OBJECT_NAME + "\n");
		for (Vertex v : mesh.vertices()) {
			out.write("v " + d.trimmed(frame.x(v.x())) + " " + d.trimmed(frame.y(v.y())) + " " + d.trimmed(v.z()) + "\n");
		}
		for (Triangle t : mesh.triangles()) {
			out.write("f " + (t.a() + 1) + " " + (t.b() + 1) + " " + (t.c() + 1) + "\n");
		}
		out.write("# end " + OBJECT_NAME + "\n");
	}
}
