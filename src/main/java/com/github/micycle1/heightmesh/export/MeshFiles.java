package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.heightmesh.error.MeshWriteException;
import com.github.micycle1.heightmesh.error.MeshWriteException.Stage;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;

/**
 * Writes serialized meshes to disk so that the target is either the complete
 * new file or untouched.
 * <p>
 * Output goes to a temporary file next to the target, which is then moved into
 * place. The temporary file is removed on any failure.
 */
public final class MeshFiles {

	private static final Logger LOGGER = LoggerFactory.getLogger(MeshFiles.class);

	private MeshFiles() {
	}

	/**
	 * @param serializer format writer
	 * @param mesh       surface
	 * @param solid      solid extension, where the format needs one
	 * @param target     destination file; replaced if it exists
	 * @return the target path
	 * @throws MeshWriteException if the temporary file cannot be created or
	 *                            written, or cannot be moved onto the target
	 */
	public static Path write(MeshSerializer serializer, Mesh mesh, Optional<SolidExtension> solid, Path target) throws MeshWriteException {
		Path absolute = target.toAbsolutePath();
		Path dir = absolute.getParent();
		Path temp;
		try {
			temp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
		} catch (IOException e) {
			throw new MeshWriteException(serializer.format(), Stage.WRITE, "cannot create temporary file in " + dir, e);
		}
		LOGGER.debug("Writing {} output to temporary file {}", serializer.format(), temp);

		boolean committed = false;
		try {
			try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
				serializer.write(mesh, solid, out);
			} catch (MeshWriteException e) {
				throw e;
			} catch (IOException e) {
				throw new MeshWriteException(serializer.format(), Stage.WRITE, temp.toString(), e);
			}
			commit(serializer, temp, absolute);
			committed = true;
		} finally {
			if (!committed) {
				deleteQuietly(temp);
			}
		}
		return target;
	}

	private static void commit(MeshSerializer serializer, Path temp, Path target) throws MeshWriteException {
		try {
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				LOGGER.warn("Atomic move not supported for {}, replacing non-atomically", target);
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException e) {
			throw new MeshWriteException(serializer.format(), Stage.COMMIT, "cannot move output onto " + target, e);
		}
	}

	private static void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			LOGGER.warn("Could not delete temporary file {}", temp, e);
		}
	}
}
