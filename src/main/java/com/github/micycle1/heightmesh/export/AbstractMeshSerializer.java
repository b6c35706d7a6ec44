package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import java.util.Optional;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.error.InvalidInputException;
import com.github.micycle1.heightmesh.error.MeshWriteException;
import com.github.micycle1.heightmesh.error.MeshWriteException.Stage;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;

/**
 * Common plumbing: frame and precision set-up, solid requirement checks, and
 * translation of sink failures into {@link MeshWriteException}.
 */
abstract class AbstractMeshSerializer implements MeshSerializer {

	static final String GENERATOR = "heightmesh4j";

	private final MeshFormat format;
	private final Placement placement;

	AbstractMeshSerializer(MeshFormat format, Placement placement) {
		this.format = format;
		this.placement = Objects.requireNonNull(placement, "placement");
	}

	@Override
	public MeshFormat format() {
		return format;
	}

	@Override
	public final void write(Mesh mesh, Optional<SolidExtension> solid, Writer out) throws MeshWriteException {
		Objects.requireNonNull(mesh, "mesh");
		Objects.requireNonNull(solid, "solid");
		if (format.needsSolid() && solid.isEmpty()) {
			throw new InvalidInputException(format + " output needs a solid extension");
		}
		if (solid.isPresent() && solid.get().vertexOffset != mesh.vertices().size()) {
			throw new InvalidInputException("Solid extension was built for a different mesh");
		}
		OutputFrame frame = OutputFrame.of(mesh, placement);
		Decimals decimals = Decimals.forBitDepth(format, mesh.bitDepth);
		try {
			writeBody(mesh, solid, frame, decimals, out);
			out.flush();
		} catch (MeshWriteException e) {
			throw e;
		} catch (IOException e) {
			throw new MeshWriteException(format, Stage.WRITE, e.getMessage(), e);
		}
	}

	abstract void writeBody(Mesh mesh, Optional<SolidExtension> solid, OutputFrame frame, Decimals decimals, Writer out) throws IOException;
}
