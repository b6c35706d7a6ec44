package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * ASCII DXF with every surface triangle as a {@code 3DFACE} on layer
 * {@code HEIGHTFIELD}. Output is a sequence of group code / value line pairs;
 * triangles repeat their third corner as the fourth.
 */
public final class DxfSerializer extends AbstractMeshSerializer {

	static final String LAYER = "HEIGHTFIELD";

	public DxfSerializer() {
		this(Placement.CENTERED);
	}

	public DxfSerializer(Placement placement) {
		super(MeshFormat.DXF, placement);
	}

	@Override
	void writeBody(Mesh mesh, Optional<SolidExtension> solid, OutputFrame frame, Decimals d, Writer out) throws IOException {
		group(out, 999, "Generated by " + GENERATOR + " from a " + mesh.columns + " x " + mesh.rows + " heightfield");

		group(out, 0, "SECTION");
		group(out, 2, "HEADER");
		group(out, 0, "ENDSEC");

		group(out, 0, "SECTION");
		group(out, 2, "TABLES");
		group(out, 0, "TABLE");
		group(out, 2, "LAYER");
		group(out, 70, "1");
		group(out, 0, "LAYER");
		group(out, 2, LAYER);
		group(out, 70, "0");
		group(out, 62, "7");
		group(out, 6, "CONTINUOUS");
		group(out, 0, "ENDTAB");
		group(out, 0, "ENDSEC");

		List<Vertex> vertices = mesh.vertices();
		group(out, 0, "SECTION");
		group(out, 2, "ENTITIES");
		for (Triangle t : mesh.triangles()) {
			group(out, 0, "3DFACE");
			group(out, 8, LAYER);
			Vertex c = vertices.get(t.c());
			corner(out, 0, vertices.get(t.a()), frame, d);
			corner(out, 1, vertices.get(t.b()), frame, d);
			corner(out, 2, c, frame, d);
			corner(out, 3, c, frame, d);
		}
		group(out, 0, "ENDSEC");
		group(out, 0, "EOF");
	}

	private static void corner(Writer out, int i, Vertex v, OutputFrame frame, Decimals d) throws IOException {
		group(out, 10 + i, d.fixed(frame.x(v.x())));
		group(out, 20 + i, d.fixed(frame.y(v.y())));
		group(out, 30 + i, d.fixed(v.z()));
	}

	private static void group(Writer out, int code, String value) throws IOException {
		out.write(code + "\n" + value + "\n");
	}
}
