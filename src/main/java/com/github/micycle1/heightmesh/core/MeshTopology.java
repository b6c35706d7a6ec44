package com.github.micycle1.heightmesh.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.micycle1.heightmesh.model.Model.Triangle;

/**
 * Edge bookkeeping over triangle index lists.
 * <p>
 * Each triangle side {@code i} runs from {@code v[i]} to {@code v[(i+1)%3]}
 * in winding order. Sides are grouped by their undirected {@link EdgeRef};
 * a closed, consistently oriented surface uses every undirected edge exactly
 * twice, once in each direction.
 */
public final class MeshTopology {

	private MeshTopology() {
	}

	public static record EdgeRef(int a, int b) {
		public EdgeRef {
			if (a < 0 || b < 0) {
				throw new IllegalArgumentException("Edge indices must be non-negative");
			}
			if (a == b) {
				throw new IllegalArgumentException("Edge endpoints must be distinct");
			}
			if (a > b) {
				int t = a;
				a = b;
				b = t;
			}
		}
	}

	/**
	 * A triangle side in winding order.
	 */
	public static record DirectedEdge(int from, int to, int triangle) {
	}

	/**
	 * Groups all triangle sides by undirected edge, in first-seen order.
	 */
	public static Map<EdgeRef, List<DirectedEdge>> edgeUses(List<Triangle> triangles) {
		Map<EdgeRef, List<DirectedEdge>> uses = new LinkedHashMap<>();
		for (int tIdx = 0; tIdx < triangles.size(); tIdx++) {
			Triangle t = triangles.get(tIdx);
			for (int side = 0; side < 3; side++) {
				int from = t.get(side);
				int to = t.get((side + 1) % 3);
				uses.computeIfAbsent(new EdgeRef(from, to), k -> new ArrayList<>(2)).add(new DirectedEdge(from, to, tIdx));
			}
		}
		return uses;
	}

	/**
	 * Sides used by exactly one triangle, directed as that triangle winds them.
	 */
	public static List<DirectedEdge> boundaryEdges(List<Triangle> triangles) {
		List<DirectedEdge> boundary = new ArrayList<>();
		for (List<DirectedEdge> sides : edgeUses(triangles).values()) {
			if (sides.size() == 1) {
				boundary.add(sides.get(0));
			}
		}
		return boundary;
	}

	/**
	 * @return true if every undirected edge is shared by exactly two triangles
	 */
	public static boolean isWatertight(List<Triangle> triangles) {
		for (List<DirectedEdge> sides : edgeUses(triangles).values()) {
			if (sides.size() != 2) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return true if no directed edge occurs twice, i.e. adjacent triangles
	 *         agree on which side is outside
	 */
	public static boolean isConsistentlyOriented(List<Triangle> triangles) {
		Set<Long> directed = new HashSet<>();
		for (Triangle t : triangles) {
			for (int side = 0; side < 3; side++) {
				long key = ((long) t.get(side) << 32) | (t.get((side + 1) % 3) & 0xffffffffL);
				if (!directed.add(key)) {
					return false;
				}
			}
		}
		return true;
	}
}
