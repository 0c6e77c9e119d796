package org.steiner.core;

import org.steiner.graph.Edge;
import org.steiner.graph.WeightedGraph;
import org.steiner.search.ShortestPath;

import java.util.List;

/**
 * Expands every selected terminal pair back into its path in the input graph.
 *
 * <p>The accumulator starts with all terminals, so a single-terminal call still yields a
 * one-node graph. Each traversed edge is copied with its original attributes; overlapping
 * paths share edges and may close cycles.</p>
 */
final class PathExpander {

    private PathExpander() {
    }

    static <N> WeightedGraph<N> expand(SteinerQueryContext<N> context, WeightedGraph<N> spanningTree) {
        WeightedGraph<N> graph = context.graph();
        WeightedGraph<N> accumulator = new WeightedGraph<>();
        accumulator.addNodes(spanningTree.nodes());

        for (Edge<N> selected : spanningTree.edges()) {
            ShortestPath<N> path = context.shortestPath(selected.source(), selected.target());
            if (!path.reachable()) {
                throw new SteinerTreeException(
                        SteinerTreeCore.REASON_UNREACHABLE_TERMINAL,
                        "terminal " + selected.target() + " is unreachable from terminal " + selected.source()
                );
            }
            List<N> nodes = path.nodes();
            for (int i = 1; i < nodes.size(); i++) {
                accumulator.addEdgeLike(graph.getEdge(nodes.get(i - 1), nodes.get(i)));
            }
        }
        return accumulator;
    }
}
