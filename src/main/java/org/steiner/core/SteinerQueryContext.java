package org.steiner.core;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.steiner.core.id.NodeIndex;
import org.steiner.graph.WeightedGraph;
import org.steiner.heuristic.DistanceHeuristic;
import org.steiner.search.AStarShortestPath;
import org.steiner.search.ShortestPath;

/**
 * Call-confined state shared by the stages of one Steiner tree computation.
 *
 * <p>Owns the node index of the input graph and, when enabled, a cache of searched paths
 * keyed by the ordered {@code (source, target)} id pair. A cached path is only served for
 * the exact orientation it was searched in, so it is the path a new search would return.</p>
 */
final class SteinerQueryContext<N> {
    private final WeightedGraph<N> graph;
    private final NodeIndex<N> index;
    private final DistanceHeuristic<N> heuristic;
    private final String weightKey;
    private final AStarShortestPath search;
    private final Long2ObjectOpenHashMap<ShortestPath<N>> pathCache;

    private int searches;
    private int reusedPaths;
    private long settledNodes;

    SteinerQueryContext(
            WeightedGraph<N> graph,
            DistanceHeuristic<N> heuristic,
            String weightKey,
            AStarShortestPath search,
            boolean reusePaths
    ) {
        this.graph = graph;
        this.index = NodeIndex.createImmutable(graph.nodes());
        this.heuristic = heuristic;
        this.weightKey = weightKey;
        this.search = search;
        this.pathCache = reusePaths ? new Long2ObjectOpenHashMap<>() : null;
    }

    WeightedGraph<N> graph() {
        return graph;
    }

    String weightKey() {
        return weightKey;
    }

    /**
     * Returns the heuristic-guided path from {@code source} to {@code target}.
     */
    ShortestPath<N> shortestPath(N source, N target) {
        long key = pairKey(index.toInternal(source), index.toInternal(target));
        if (pathCache != null) {
            ShortestPath<N> cached = pathCache.get(key);
            if (cached != null) {
                reusedPaths++;
                return cached;
            }
        }
        ShortestPath<N> path = search.find(graph, index, source, target, heuristic, weightKey);
        searches++;
        settledNodes += path.settledNodes();
        if (pathCache != null && path.reachable()) {
            pathCache.put(key, path);
        }
        return path;
    }

    int searches() {
        return searches;
    }

    int reusedPaths() {
        return reusedPaths;
    }

    long settledNodes() {
        return settledNodes;
    }

    private static long pairKey(int sourceId, int targetId) {
        return ((long) sourceId << 32) | (targetId & 0xFFFF_FFFFL);
    }
}
