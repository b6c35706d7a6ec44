package com.github.micycle1.heightmesh.config;

/**
 * Output formats supported by the serializers.
 */
public enum MeshFormat {

	POV("pov", true), OBJ("obj", false), STL("stl", true), DXF("dxf", false);

	private final String extension;
	private final boolean solid;

	MeshFormat(String extension, boolean solid) {
		this.extension = extension;
		this.solid = solid;
	}

	/**
	 * @return file name extension without the leading dot
	 */
	public String extension() {
		return extension;
	}

	/**
	 * @return whether the format consumes a solid extension (side walls and
	 *         bottom) in addition to the elevation surface
	 */
	public boolean needsSolid() {
		return solid;
	}
}
