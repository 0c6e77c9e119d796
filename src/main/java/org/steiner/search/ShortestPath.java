package org.steiner.search;

import java.util.List;

/**
 * Output of one point-to-point search.
 *
 * @param reachable whether the target is reachable from the source.
 * @param nodes path from source to target inclusive (empty when unreachable).
 * @param totalWeight sum of edge weights along the path ({@code +INF} when unreachable).
 * @param settledNodes number of nodes settled by the search.
 * @param <N> node value type.
 */
public record ShortestPath<N>(
        boolean reachable,
        List<N> nodes,
        double totalWeight,
        int settledNodes
) {
    public ShortestPath {
        nodes = List.copyOf(nodes);
    }

    /**
     * Creates a canonical unreachable result.
     */
    public static <N> ShortestPath<N> unreachable(int settledNodes) {
        return new ShortestPath<>(false, List.of(), Double.POSITIVE_INFINITY, settledNodes);
    }

    /**
     * @return first node of the path.
     * @throws IllegalStateException when unreachable.
     */
    public N source() {
        requireReachable();
        return nodes.get(0);
    }

    /**
     * @return last node of the path.
     * @throws IllegalStateException when unreachable.
     */
    public N target() {
        requireReachable();
        return nodes.get(nodes.size() - 1);
    }

    /**
     * @return number of edges on the path.
     */
    public int edgeCount() {
        return Math.max(0, nodes.size() - 1);
    }

    private void requireReachable() {
        if (!reachable) {
            throw new IllegalStateException("path is unreachable");
        }
    }
}
