package org.steiner.graph;

import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural queries over {@link WeightedGraph}: components, reachability and tree shape.
 *
 * <p>All traversals are breadth-first over an explicit queue.</p>
 */
@UtilityClass
public final class GraphConnectivity {

    /**
     * Returns the connected components of {@code graph} in node insertion order.
     */
    public static <N> List<Set<N>> connectedComponents(WeightedGraph<N> graph) {
        Objects.requireNonNull(graph, "graph");
        List<Set<N>> components = new ArrayList<>();
        Set<N> seen = new HashSet<>();
        for (N start : graph.nodes()) {
            if (seen.contains(start)) {
                continue;
            }
            Set<N> component = reachableFrom(graph, start);
            seen.addAll(component);
            components.add(component);
        }
        return components;
    }

    /**
     * Returns whether a path joins {@code source} and {@code target}.
     * Missing nodes are never connected.
     */
    public static <N> boolean hasPath(WeightedGraph<N> graph, N source, N target) {
        Objects.requireNonNull(graph, "graph");
        if (!graph.containsNode(source) || !graph.containsNode(target)) {
            return false;
        }
        if (source.equals(target)) {
            return true;
        }
        return reachableFrom(graph, source).contains(target);
    }

    /**
     * Returns whether every pair of {@code nodes} is connected in {@code graph}.
     */
    public static <N> boolean connectsAll(WeightedGraph<N> graph, Collection<N> nodes) {
        Iterator<N> iterator = nodes.iterator();
        if (!iterator.hasNext()) {
            return true;
        }
        N first = iterator.next();
        if (!graph.containsNode(first)) {
            return false;
        }
        Set<N> reachable = reachableFrom(graph, first);
        return reachable.containsAll(nodes);
    }

    /**
     * Returns whether {@code graph} is a tree: non-empty, connected and
     * {@code |edges| = |nodes| - 1}.
     */
    public static <N> boolean isTree(WeightedGraph<N> graph) {
        Objects.requireNonNull(graph, "graph");
        if (graph.isEmpty() || graph.edgeCount() != graph.nodeCount() - 1) {
            return false;
        }
        N first = graph.nodes().iterator().next();
        return reachableFrom(graph, first).size() == graph.nodeCount();
    }

    /**
     * Returns all nodes of degree one, in node insertion order.
     */
    public static <N> List<N> leaves(WeightedGraph<N> graph) {
        List<N> leaves = new ArrayList<>();
        for (N node : graph.nodes()) {
            if (graph.degree(node) == 1) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    private static <N> Set<N> reachableFrom(WeightedGraph<N> graph, N start) {
        Set<N> visited = new LinkedHashSet<>();
        ArrayDeque<N> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            N node = queue.poll();
            for (N neighbor : graph.neighbors(node)) {
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        return visited;
    }
}
