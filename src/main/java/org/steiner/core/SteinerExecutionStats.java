package org.steiner.core;

/**
 * Deterministic counters for one Steiner tree computation.
 *
 * @param terminalCount distinct terminals.
 * @param shortestPathSearches A* searches actually executed.
 * @param reusedPaths paths served from the per-call path cache instead of a new search.
 * @param settledNodes nodes settled across all searches.
 * @param distanceGraphEdges edges of the complete terminal distance graph.
 * @param accumulatorNodes nodes of the union of expanded paths.
 * @param accumulatorEdges edges of the union of expanded paths.
 * @param prunedNodes non-terminal nodes removed by leaf pruning.
 */
public record SteinerExecutionStats(
        int terminalCount,
        int shortestPathSearches,
        int reusedPaths,
        long settledNodes,
        int distanceGraphEdges,
        int accumulatorNodes,
        int accumulatorEdges,
        int prunedNodes
) {
}
