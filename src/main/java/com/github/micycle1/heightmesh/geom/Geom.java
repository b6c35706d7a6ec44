package com.github.micycle1.heightmesh.geom;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.math.Vector3D;

import com.github.micycle1.heightmesh.model.Model.Vertex;

/**
 * Geometric primitives shared by the builder, the extruder and the writers.
 */
public final class Geom {

	private static final double NEAR_ZERO_EPS = 1e-12;

	private Geom() {
	}

	public static boolean nearZero(double val) {
		return Math.abs(val) <= NEAR_ZERO_EPS;
	}

	/**
	 * Cross product {@code (b - a) x (c - a)}; its direction is the outward
	 * normal of a counter-clockwise triangle, its length twice the area.
	 */
	public static Vector3D cross(Vertex a, Vertex b, Vertex c) {
		double ux = b.x() - a.x(), uy = b.y() - a.y(), uz = b.z() - a.z();
		double vx = c.x() - a.x(), vy = c.y() - a.y(), vz = c.z() - a.z();
		return new Vector3D(uy * vz - uz * vy, uz * vx - ux * vz, ux * vy - uy * vx);
	}

	/**
	 * Unit normal of triangle {@code abc}, or {@code null} when the triangle is
	 * degenerate.
	 */
	public static Vector3D unitNormal(Vertex a, Vertex b, Vertex c) {
		Vector3D n = cross(a, b, c);
		if (nearZero(n.length())) {
			return null;
		}
		return n.normalize();
	}

	/**
	 * Whether the planar projection of {@code abc} winds counter-clockwise, i.e.
	 * the triangle faces +z.
	 */
	public static boolean isCounterClockwise(Vertex a, Vertex b, Vertex c) {
		return Orientation.index(a.toCoordinate(), b.toCoordinate(), c.toCoordinate()) == Orientation.COUNTERCLOCKWISE;
	}

	/**
	 * Mean of two corners along a fold diagonal.
	 */
	public static double mean(double a, double b) {
		return (a + b) / 2;
	}

	public static double mean(double a, double b, double c, double d) {
		return (a + b + c + d) / 4;
	}
}
