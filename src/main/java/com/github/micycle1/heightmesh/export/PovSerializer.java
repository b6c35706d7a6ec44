package com.github.micycle1.heightmesh.export;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;

import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.heightmesh.config.MeshFormat;
import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.input.HeightField;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.SolidExtension;
import com.github.micycle1.heightmesh.model.Model.Triangle;
import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * POV-Ray 3.7 scene.
 * <p>
 * The surface is written as a {@code mesh2} named {@code thething}; the
 * renderable object is {@code boxedthing}, the intersection of the textured
 * surface with a box spanning the solid extension, which closes the open mesh
 * without writing wall triangles. Everything a user tends to edit (the
 * elevation curve, the transform, materials, camera and lights) sits in
 * guarded blocks near the top, so the file doubles as an include:
 *
 * <pre>
 * #declare Main = 1;
 * #include "terrain.pov"
 * object { boxedthing }
 * </pre>
 */
public final class PovSerializer extends AbstractMeshSerializer {

	/** Inset of the clipping box from the footprint, keeps the side faces off the box walls. */
	static final String XY_CLIP = "1E-7";
	/** Headroom of the clipping box above the surface. */
	static final double TOP_MARGIN = 0.1;

	public PovSerializer() {
		this(Placement.CENTERED);
	}

	public PovSerializer(Placement placement) {
		super(MeshFormat.POV, placement);
	}

	@Override
	void writeBody(Mesh mesh, Optional<SolidExtension> solid, OutputFrame frame, Decimals d, Writer out) throws IOException {
		SolidExtension extension = solid.orElseThrow();
		writeHeader(mesh, out);
		writeSettings(mesh, out);
		writeSurface(mesh, frame, d, out);
		writeBox(mesh, extension, frame, d, out);
	}

	private static void writeHeader(Mesh mesh, Writer out) throws IOException {
		out.write("/*\n");
		out.write("Persistence of Vision Ray Tracer Scene Description File\n");
		out.write("Version: 3.7\n");
		out.write("Description: triangle mesh of an image heightfield.\n");
		out.write("   x runs to the right and y up the source image; z is elevation, 0 to 1.\n");
		out.write("\n");
		out.write("Use as an include by declaring Main first; camera, lights and the\n");
		out.write("final object are then left to the including scene:\n");
		out.write("\n");
		out.write("   #declare Main = 1;\n");
		out.write("   #declare thething_transform = transform {rotate <0, 0, 0>}\n");
		out.write("   #include \"this_file.pov\"\n");
		out.write("   object {boxedthing}\n");
		out.write("\n");
		out.write("Source heightfield: " + mesh.columns + " x " + mesh.rows + ", " + mesh.bitDepth + " bit, "
				+ (HeightField.maxValue(mesh.bitDepth) + 1) + " levels\n");
		out.write("Generated by " + GENERATOR + "\n");
		out.write("*/\n\n");
		out.write("#version 3.7;\n\n");
	}

	private static void writeSettings(Mesh mesh, Writer out) throws IOException {
		out.write("#ifndef (Main)\n");
		out.write("global_settings {\n");
		out.write("  max_trace_level 3\n");
		out.write("  adc_bailout 0.01\n");
		out.write("  ambient_light <0.5, 0.5, 0.5>\n");
		out.write("  assumed_gamma 1.0\n");
		out.write("}\n");
		out.write("#end\n\n");

		out.write("// Elevation curve applied to every z, identity by default. Control points\n");
		out.write("// may be edited or added in any order; the spline sorts them by entry value.\n");
		out.write("#ifndef (Curve)\n");
		out.write("#declare Curve = function {\n");
		out.write("  spline {\n");
		out.write("    linear_spline\n");
		out.write("    0.0, <0.0, 0>,\n");
		out.write("    0.25, <0.25, 0>,\n");
		out.write("    0.5, <0.5, 0>,\n");
		out.write("    0.75, <0.75, 0>,\n");
		out.write("    1.0, <1.0, 0>\n");
		out.write("  }\n");
		out.write("};\n");
		out.write("#end\n");
		out.write("#ifndef (Map) #declare Map = function(c) {Curve(c).u}; #end\n\n");

		out.write("// Transform the whole object here rather than afterwards, so the inside vector follows it\n");
		out.write("#ifndef (thething_transform)\n");
		out.write("#declare thething_transform = transform {rotate <0, 0, 0>}\n");
		out.write("#end\n\n");

		out.write("// ---- Materials ----\n");
		out.write("#ifndef (thething_texture)\n");
		out.write("#declare thething_texture_bottom = texture {\n");
		out.write("  pigment {\n");
		out.write("    gradient z\n");
		out.write("    colour_map {\n");
		out.write("      [0.0, rgb <1, 0, 0>]\n");
		out.write("      [0.5, rgb <0, 0, 1>]\n");
		out.write("      [1.0, rgb <1, 1, 1>]\n");
		out.write("    }\n");
		out.write("  }\n");
		out.write("  finish {phong 1.0}\n");
		out.write("}\n");
		out.write("#declare line_width = 0.01;\n");
		out.write("#declare thething_texture_top = texture {\n");
		out.write("  pigment {\n");
		out.write("    gradient z\n");
		out.write("    colour_map {\n");
		out.write("      [0.0, rgbt <0, 0, 0, 1>]\n");
		out.write("      [0.5 - line_width, rgbt <0, 0, 0, 1>]\n");
		out.write("      [0.5 - line_width, rgbt <0, 0, 0, 0>]\n");
		out.write("      [0.5 + line_width, rgbt <0, 0, 0, 0>]\n");
		out.write("      [0.5 + line_width, rgbt <0, 0, 0, 1>]\n");
		out.write("      [1.0, rgbt <0, 0, 0, 1>]\n");
		out.write("    }\n");
		out.write("  }\n");
		out.write("  scale 0.1\n");
		out.write("}\n");
		out.write("#declare thething_texture = texture {thething_texture_bottom} texture {thething_texture_top}\n");
		out.write("#end\n");
		out.write("// ---- End materials ----\n\n");

		out.write("// ---- Camera and lights ----\n");
		out.write("#ifndef (Main)\n");
		out.write("#declare image_X = " + mesh.columns + ";\n");
		out.write("#declare image_Y = " + mesh.rows + ";\n");
		out.write("#declare camera_position = <0.0, 0.0, 3.0>;\n");
		out.write("#declare camera_distance = vlength(camera_position - <0.0, 0.0, 1.0>);\n");
		out.write("camera {\n");
		out.write("  // orthographic\n");
		out.write("  location camera_position\n");
		out.write("  right -x*image_width/image_height\n");
		out.write("  up y\n");
		out.write("  sky <0, 1, 0>\n");
		out.write("  direction <0, 0, camera_distance>\n");
		out.write("  angle 2.0*degrees(atan2(0.5*image_width*max(image_X/image_width, image_Y/image_height)/max(image_X, image_Y), camera_distance))\n");
		out.write("  look_at <0.0, 0.0, 0.5>\n");
		out.write("}\n");
		out.write("light_source {<-5, 5, 5> color rgb <1, 1, 1>}\n");
		out.write("light_source {<7, 3, 3> color rgb <1, 1, 1>}\n");
		out.write("light_source {camera_position color rgb <0.01, 0.01, 0.01>}\n");
		out.write("#end\n");
		out.write("// ---- End camera and lights ----\n\n");
	}

	private static void writeSurface(Mesh mesh, OutputFrame frame, Decimals d, Writer out) throws IOException {
		List<Vertex> vertices = mesh.vertices();
		List<Triangle> triangles = mesh.triangles();
		out.write("#declare thething = mesh2 {\n");
		out.write("  vertex_vectors {\n");
		out.write("    " + vertices.size());
		for (Vertex v : vertices) {
			out.write(",\n    <" + d.trimmed(frame.x(v.x())) + ", " + d.trimmed(frame.y(v.y())) + ", Map(" + d.trimmed(v.z()) + ")>");
		}
		out.write("\n  }\n");
		out.write("  face_indices {\n");
		out.write("    " + triangles.size());
		for (Triangle t : triangles) {
			out.write(",\n    <" + t.a() + ", " + t.b() + ", " + t.c() + ">");
		}
		out.write("\n  }\n");
		out.write("  inside_vector <0, 0, 1>\n");
		out.write("}\n\n");
	}

	private static void writeBox(Mesh mesh, SolidExtension extension, OutputFrame frame, Decimals d, Writer out) throws IOException {
		Envelope footprint = frame.apply(extension.extent());
		double top = Math.max(1.0, mesh.maxElevation()) + TOP_MARGIN;
		out.write("#declare xy_clip = " + XY_CLIP + ";\n");
		out.write("#declare boxedthing = object {\n");
		out.write("  intersection {\n");
		out.write("    box {\n");
		out.write("      <" + d.trimmed(footprint.getMinX()) + " + xy_clip, " + d.trimmed(footprint.getMinY()) + " + xy_clip, "
				+ d.trimmed(extension.baseElevation) + ">,\n");
		out.write("      <" + d.trimmed(footprint.getMaxX()) + " - xy_clip, " + d.trimmed(footprint.getMaxY()) + " - xy_clip, "
				+ d.trimmed(top) + ">\n");
		out.write("    }\n");
		out.write("    object {thething}\n");
		out.write("  }\n");
		out.write("  texture {thething_texture}\n");
		out.write("  transform thething_transform\n");
		out.write("}\n\n");
		out.write("#ifndef (Main)\n");
		out.write("object {boxedthing}\n");
		out.write("#end\n");
	}
}
