package org.steiner.core;

import org.steiner.graph.WeightedGraph;
import org.steiner.search.ShortestPath;

import java.util.List;

/**
 * Builds the complete distance graph over the terminals.
 *
 * <p>One heuristic search per unordered terminal pair; the found path weight becomes the
 * pair's edge weight. Any unreachable pair aborts the whole build.</p>
 */
final class DistanceGraphBuilder {

    private DistanceGraphBuilder() {
    }

    /**
     * @param context call context holding the input graph.
     * @param terminals distinct terminals.
     * @return complete graph with {@code k} nodes and {@code k(k-1)/2} edges.
     * @throws SteinerTreeException with {@link SteinerTreeCore#REASON_UNREACHABLE_TERMINAL}.
     */
    static <N> WeightedGraph<N> build(SteinerQueryContext<N> context, List<N> terminals) {
        WeightedGraph<N> distanceGraph = new WeightedGraph<>();
        distanceGraph.addNodes(terminals);

        for (int i = 0; i < terminals.size(); i++) {
            N source = terminals.get(i);
            for (int j = i + 1; j < terminals.size(); j++) {
                N target = terminals.get(j);
                ShortestPath<N> path = context.shortestPath(source, target);
                if (!path.reachable()) {
                    throw new SteinerTreeException(
                            SteinerTreeCore.REASON_UNREACHABLE_TERMINAL,
                            "terminal " + target + " is unreachable from terminal " + source
                    );
                }
                distanceGraph.addEdge(source, target, context.weightKey(), path.totalWeight());
            }
        }
        return distanceGraph;
    }
}
