package com.github.micycle1.heightmesh.export;

import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.heightmesh.config.Placement;
import com.github.micycle1.heightmesh.model.Model.Mesh;
import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * Maps mesh coordinates to output coordinates, shared by every format so the
 * same heightfield lands in the same place whatever the file type.
 * <p>
 * x and y are scaled by {@code 1 / (max(columns, rows) - 1)} so the longer
 * side spans one unit; z is kept as is, since elevations are already
 * normalised.
 */
record OutputFrame(double scale, double xOffset, double yOffset) {

	static OutputFrame of(Mesh mesh, Placement placement) {
		double scale = 1.0 / (Math.max(mesh.columns, mesh.rows) - 1.0);
		return switch (placement) {
			case CENTERED -> new OutputFrame(scale, -0.5 * (mesh.columns - 1.0), -0.5 * (mesh.rows - 1.0));
			case POSITIVE_OCTANT -> new OutputFrame(scale, 0.0, 0.0);
		};
	}

	double x(double meshX) {
		return scale * (meshX + xOffset);
	}

	double y(double meshY) {
		return scale * (meshY + yOffset);
	}

	Vertex apply(Vertex v) {
		return new Vertex(x(v.x()), y(v.y()), v.z());
	}

	Envelope apply(Envelope e) {
		return new Envelope(x(e.getMinX()), x(e.getMaxX()), y(e.getMinY()), y(e.getMaxY()));
	}
}
