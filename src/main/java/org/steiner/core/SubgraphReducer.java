package org.steiner.core;

import org.steiner.graph.WeightedGraph;
import org.steiner.search.MinimumSpanningTree;

/**
 * Removes cycles left by overlapping paths: an MST of the accumulator on original weights.
 */
final class SubgraphReducer {

    private SubgraphReducer() {
    }

    static <N> WeightedGraph<N> reduce(WeightedGraph<N> accumulator, String weightKey) {
        return MinimumSpanningTree.of(accumulator, weightKey);
    }
}
