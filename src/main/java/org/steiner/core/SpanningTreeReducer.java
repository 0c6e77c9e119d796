package org.steiner.core;

import org.steiner.graph.WeightedGraph;
import org.steiner.search.MinimumSpanningTree;

/**
 * Selects the terminal pairs to connect directly: an MST of the distance graph.
 */
final class SpanningTreeReducer {

    private SpanningTreeReducer() {
    }

    static <N> WeightedGraph<N> reduce(WeightedGraph<N> distanceGraph, String weightKey) {
        WeightedGraph<N> spanningTree = MinimumSpanningTree.of(distanceGraph, weightKey);
        if (spanningTree.edgeCount() != spanningTree.nodeCount() - 1) {
            throw new IllegalStateException(
                    "distance graph is not connected: " + spanningTree.edgeCount()
                            + " MST edges for " + spanningTree.nodeCount() + " terminals"
            );
        }
        return spanningTree;
    }
}
