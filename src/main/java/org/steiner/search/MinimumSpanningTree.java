package org.steiner.search;

import lombok.experimental.UtilityClass;
import org.steiner.core.id.NodeIndex;
import org.steiner.graph.Edge;
import org.steiner.graph.WeightedGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Kruskal minimum spanning tree over a {@link WeightedGraph}.
 *
 * <p>Disconnected inputs yield a minimum spanning forest. Every input node is kept, isolated
 * nodes included. Equal-weight edges are taken in graph insertion order; which of several
 * optimal trees results is therefore deterministic but carries no further meaning.</p>
 */
@UtilityClass
public final class MinimumSpanningTree {

    /**
     * Computes a minimum spanning forest of {@code graph}.
     *
     * @param graph input graph; read only.
     * @param weightKey edge attribute holding weights; missing attributes weigh 1.
     * @return new graph with all nodes of {@code graph} and the selected edges, attributes copied.
     * @throws IllegalArgumentException when an edge weight is NaN.
     */
    public static <N> WeightedGraph<N> of(WeightedGraph<N> graph, String weightKey) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(weightKey, "weightKey");

        WeightedGraph<N> forest = new WeightedGraph<>();
        forest.addNodes(graph.nodes());
        if (graph.nodeCount() < 2) {
            return forest;
        }

        List<Edge<N>> ranked = new ArrayList<>(graph.edges());
        for (Edge<N> edge : ranked) {
            if (Double.isNaN(edge.weight(weightKey))) {
                throw new IllegalArgumentException("edge weight is NaN: " + edge);
            }
        }
        ranked.sort(Comparator.comparingDouble(edge -> edge.weight(weightKey)));

        NodeIndex<N> index = NodeIndex.createImmutable(graph.nodes());
        int nodeCount = index.size();
        int[] parent = new int[nodeCount];
        int[] rank = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            parent[i] = i;
        }

        int components = nodeCount;
        for (Edge<N> edge : ranked) {
            if (components == 1) {
                break;
            }
            int rootU = find(parent, index.toInternal(edge.source()));
            int rootV = find(parent, index.toInternal(edge.target()));
            if (rootU == rootV) {
                continue;
            }
            union(parent, rank, rootU, rootV);
            forest.addEdgeLike(edge);
            components--;
        }
        return forest;
    }

    /**
     * Root lookup with path halving.
     */
    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * Union by rank of two distinct roots.
     */
    private static void union(int[] parent, int[] rank, int a, int b) {
        if (rank[a] < rank[b]) {
            parent[a] = b;
        } else if (rank[a] > rank[b]) {
            parent[b] = a;
        } else {
            parent[b] = a;
            rank[a]++;
        }
    }
}
