package com.github.micycle1.heightmesh;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.heightmesh.config.ConversionOptions;
import com.github.micycle1.heightmesh.core.GeometrySelector;
import com.github.micycle1.heightmesh.core.MeshBuilder;
import com.github.micycle1.heightmesh.core.SolidExtruder;
import com.github.micycle1.heightmesh.error.MeshWriteException;
import com.github.micycle1.heightmesh.export.MeshFiles;
import com.github.micycle1.heightmesh.export.MeshSerializer;
import com.github.micycle1.heightmesh.input.Adapter;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.CellVariants;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;

/**
 * Public API for converting a heightfield into a triangle mesh file.
 * <p>
 * The pipeline runs leaf first: every cell is assigned a geometry variant from
 * its local contrast, the mesh is assembled with shared grid vertices, solid
 * formats get walls and a bottom, and the result is serialized. Adapters map
 * external raster types into {@link HeightField}; the rest of the pipeline
 * never sees them.
 * <p>
 * All methods are stateless. Concurrent conversions with different
 * {@link ConversionOptions} do not interfere.
 */
public class HeightMesh {

	private static final Logger LOGGER = LoggerFactory.getLogger(HeightMesh.class);

	private HeightMesh() {
	}

	/**
	 * Builds the elevation surface, choosing standard or hybrid geometry per
	 * cell with {@link ConversionOptions#threshold()}.
	 *
	 * @param field   source heightfield
	 * @param options conversion settings
	 * @return surface mesh, every triangle counter-clockwise seen from +z
	 */
	public static Mesh buildMesh(HeightField field, ConversionOptions options) {
		Objects.requireNonNull(field, "field");
		Objects.requireNonNull(options, "options");
		CellVariants variants = GeometrySelector.select(field, options.threshold(), options.parallel());
		return MeshBuilder.build(field, variants, options.parallel());
	}

	/**
	 * Closes a surface built from {@code field} into a solid resting on
	 * {@link ConversionOptions#baseElevation()}.
	 */
	public static SolidExtension extrude(Mesh mesh, HeightField field, ConversionOptions options) {
		Objects.requireNonNull(mesh, "mesh");
		Objects.requireNonNull(field, "field");
		Objects.requireNonNull(options, "options");
		return SolidExtruder.extrude(mesh, field.extent(), options.baseElevation());
	}

	/**
	 * Converts a heightfield to the bytes of a mesh file in
	 * {@link ConversionOptions#format()}.
	 *
	 * @return UTF-8 encoded file contents
	 */
	public static byte[] convert(HeightField field, ConversionOptions options) {
		Mesh mesh = buildMesh(field, options);
		return serializer(options).encode(mesh, solidFor(mesh, field, options));
	}

	/**
	 * Converts user-supplied input via an adapter.
	 *
	 * @param <T>     source input type
	 * @param input   source input object
	 * @param adapter converts {@code input} into a {@link HeightField}
	 * @param options conversion settings
	 * @return UTF-8 encoded file contents
	 */
	public static <T> byte[] convert(T input, Adapter<T> adapter, ConversionOptions options) {
		Objects.requireNonNull(adapter, "adapter");
		return convert(adapter.toHeightField(input), options);
	}

	/**
	 * Converts a heightfield and writes the result to {@code target}. The target
	 * is replaced atomically where the file system allows it and is left
	 * untouched on failure.
	 *
	 * @return the target path
	 * @throws MeshWriteException if the file cannot be written
	 */
	public static Path export(HeightField field, ConversionOptions options, Path target) throws MeshWriteException {
		Objects.requireNonNull(target, "target");
		Mesh mesh = buildMesh(field, options);
		Optional<SolidExtension> solid = solidFor(mesh, field, options);
		Path written = MeshFiles.write(serializer(options), mesh, solid, target);
		LOGGER.info("Exported {} {}x{} heightfield to {} ({} vertices, {} triangles)", options.format(), field.width, field.height, written,
				mesh.vertices().size() + solid.map(s -> s.vertices().size()).orElse(0),
				mesh.triangles().size() + solid.map(s -> s.triangles().size()).orElse(0));
		return written;
	}

	private static Optional<SolidExtension> solidFor(Mesh mesh, HeightField field, ConversionOptions options) {
		return options.format().needsSolid() ? Optional.of(extrude(mesh, field, options)) : Optional.empty();
	}

	private static MeshSerializer serializer(ConversionOptions options) {
		return MeshSerializer.forFormat(options.format(), options.placement());
	}
}
