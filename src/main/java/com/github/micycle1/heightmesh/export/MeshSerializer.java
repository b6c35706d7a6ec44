package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.error.MeshWriteException;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;

/**
 * Encodes a mesh, and for solid formats its extension, as text in one target
 * format.
 * <p>
 * Serializers are stateless and never modify their input; the same mesh always
 * produces the same characters. Lines end with {@code \n}.
 */
public interface MeshSerializer {

	MeshFormat format();

	/**
	 * Writes the encoded mesh to a sink. The sink is flushed but not closed.
	 *
	 * @param mesh  elevation surface
	 * @param solid solid extension; required by formats where
	 *              {@link MeshFormat#needsSolid()} is true, ignored otherwise
	 * @param out   destination
	 * @throws MeshWriteException if the sink rejects the output
	 */
	void write(Mesh mesh, Optional<SolidExtension> solid, Writer out) throws MeshWriteException;

	/**
	 * Encodes to UTF-8 bytes in memory.
	 */
	default byte[] encode(Mesh mesh, Optional<SolidExtension> solid) {
		StringWriter out = new StringWriter();
		try {
			write(mesh, solid, out);
		} catch (IOException e) {
			// StringWriter does not fail
			throw new UncheckedIOException(e);
		}
		return out.toString().getBytes(StandardCharsets.UTF_8);
	}

	static MeshSerializer forFormat(MeshFormat format) {
		return forFormat(format, Placement.CENTERED);
	}

	static MeshSerializer forFormat(MeshFormat format, Placement placement) {
		return switch (format) {
			case POV -> new PovSerializer(placement);
			case OBJ -> new ObjSerializer(placement);
			case STL -> new StlSerializer(placement);
			case DXF -> new DxfSerializer(placement);
		};
	}
}
