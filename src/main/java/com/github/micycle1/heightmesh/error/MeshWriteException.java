package com.github.micycle1.heightmesh.error;

import java.io.IOException;
import java.util.Locale;

import com.github.micycle1.heightmesh.config.MeshFormat;

/**
 * The destination did not accept the full output. Carries the format being
 * written and the stage that failed so callers can report it.
 */
public class MeshWriteException extends IOException {

	private static final long serialVersionUID = 1L;

	public enum Stage {
		/** Streaming text to the sink or temporary file. */
		WRITE,
		/** Moving the finished temporary file onto the target path. */
		COMMIT
	}

	private final MeshFormat format;
	private final Stage stage;

	public MeshWriteException(MeshFormat format, Stage stage, String detail, Throwable cause) {
		super(format + " " + stage.name().toLowerCase(Locale.ROOT) + " failed: " + detail, cause);
		this.format = format;
		this.stage = stage;
	}

	public MeshFormat getFormat() {
		return format;
	}

	public Stage getStage() {
		return stage;
	}
}
