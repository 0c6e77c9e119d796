package org.steiner.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable undirected graph over opaque node values with weighted edges.
 *
 * <p><strong>Model:</strong></p>
 * <ul>
 * <li>Nodes are arbitrary non-null values with consistent {@code equals}/{@code hashCode}.</li>
 * <li>At most one edge joins any two distinct nodes; self-loops are rejected.</li>
 * <li>Each edge carries named numeric attributes. Weight lookups for a missing
 * attribute resolve to {@link #DEFAULT_WEIGHT}.</li>
 * <li>Node, neighbor and edge iteration follow insertion order, so every algorithm
 * running over the graph is deterministic.</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Not thread-safe for writes. Concurrent readers are safe
 * as long as no thread mutates the instance.</p>
 *
 * @param <N> node value type.
 */
public final class WeightedGraph<N> {
    public static final String DEFAULT_WEIGHT_KEY = "weight";
    public static final double DEFAULT_WEIGHT = 1.0d;

    private final Map<N, Map<N, Edge<N>>> adjacency = new LinkedHashMap<>();
    private final Set<Edge<N>> edges = new LinkedHashSet<>();

    /**
     * Adds a node if absent.
     *
     * @return true when the node was not present before.
     */
    public boolean addNode(N node) {
        Objects.requireNonNull(node, "node");
        if (adjacency.containsKey(node)) {
            return false;
        }
        adjacency.put(node, new LinkedHashMap<>());
        return true;
    }

    /**
     * Adds every node of {@code nodes} that is not present yet.
     */
    public void addNodes(Collection<? extends N> nodes) {
        for (N node : nodes) {
            addNode(node);
        }
    }

    /**
     * Adds an attribute-less edge (weight {@link #DEFAULT_WEIGHT} under any key).
     * Missing endpoints are added. An existing edge is returned unchanged.
     *
     * @throws IllegalArgumentException for self-loops.
     */
    public Edge<N> addEdge(N u, N v) {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        if (u.equals(v)) {
            throw new IllegalArgumentException("self-loops are not supported: " + u);
        }
        Edge<N> existing = getEdge(u, v);
        if (existing != null) {
            return existing;
        }
        addNode(u);
        addNode(v);
        Edge<N> edge = new Edge<>(u, v);
        adjacency.get(u).put(v, edge);
        adjacency.get(v).put(u, edge);
        edges.add(edge);
        return edge;
    }

    /**
     * Adds or updates an edge with its weight under {@link #DEFAULT_WEIGHT_KEY}.
     */
    public Edge<N> addEdge(N u, N v, double weight) {
        return addEdge(u, v, DEFAULT_WEIGHT_KEY, weight);
    }

    /**
     * Adds or updates an edge, storing {@code value} under attribute {@code key}.
     */
    public Edge<N> addEdge(N u, N v, String key, double value) {
        Edge<N> edge = addEdge(u, v);
        edge.putAttribute(key, value);
        return edge;
    }

    /**
     * Adds or updates an edge copying all attributes of {@code template}.
     */
    public Edge<N> addEdgeLike(Edge<N> template) {
        Edge<N> edge = addEdge(template.source(), template.target());
        edge.putAllAttributes(template);
        return edge;
    }

    /**
     * Sets one attribute on an existing edge.
     *
     * @throws IllegalArgumentException when the edge does not exist.
     */
    public void setEdgeAttribute(N u, N v, String key, double value) {
        requireEdge(u, v).putAttribute(key, value);
    }

    public boolean containsNode(N node) {
        return node != null && adjacency.containsKey(node);
    }

    public boolean containsEdge(N u, N v) {
        return getEdge(u, v) != null;
    }

    /**
     * @return the edge joining {@code u} and {@code v}, or {@code null} when absent.
     */
    public Edge<N> getEdge(N u, N v) {
        Map<N, Edge<N>> incident = adjacency.get(u);
        return incident == null ? null : incident.get(v);
    }

    /**
     * Returns the weight of edge {@code (u, v)} under {@code key}, defaulting to
     * {@link #DEFAULT_WEIGHT} when the edge carries no such attribute.
     *
     * @throws IllegalArgumentException when the edge does not exist.
     */
    public double weight(N u, N v, String key) {
        return requireEdge(u, v).weight(key);
    }

    /**
     * @return read-only view of the neighbors of {@code node}.
     * @throws IllegalArgumentException when the node does not exist.
     */
    public Set<N> neighbors(N node) {
        return Collections.unmodifiableSet(requireIncident(node).keySet());
    }

    /**
     * @return read-only view of the edges incident to {@code node}.
     * @throws IllegalArgumentException when the node does not exist.
     */
    public Collection<Edge<N>> incidentEdges(N node) {
        return Collections.unmodifiableCollection(requireIncident(node).values());
    }

    /**
     * @throws IllegalArgumentException when the node does not exist.
     */
    public int degree(N node) {
        return requireIncident(node).size();
    }

    /**
     * Removes a node and all incident edges.
     *
     * @return true when the node was present.
     */
    public boolean removeNode(N node) {
        Map<N, Edge<N>> incident = adjacency.remove(node);
        if (incident == null) {
            return false;
        }
        for (Map.Entry<N, Edge<N>> entry : incident.entrySet()) {
            adjacency.get(entry.getKey()).remove(node);
            edges.remove(entry.getValue());
        }
        return true;
    }

    /**
     * Removes the edge joining {@code u} and {@code v}; endpoints stay.
     *
     * @return true when the edge was present.
     */
    public boolean removeEdge(N u, N v) {
        Edge<N> edge = getEdge(u, v);
        if (edge == null) {
            return false;
        }
        adjacency.get(u).remove(v);
        adjacency.get(v).remove(u);
        edges.remove(edge);
        return true;
    }

    /**
     * @return read-only view of all nodes in insertion order.
     */
    public Set<N> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    /**
     * @return read-only view of all edges in insertion order.
     */
    public Collection<Edge<N>> edges() {
        return Collections.unmodifiableCollection(edges);
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    /**
     * Sums the weight of every edge under {@code key}.
     */
    public double totalWeight(String key) {
        double total = 0.0d;
        for (Edge<N> edge : edges) {
            total += edge.weight(key);
        }
        return total;
    }

    /**
     * Returns a deep copy: same nodes, same edges, independent attribute maps.
     */
    public WeightedGraph<N> copy() {
        WeightedGraph<N> copy = new WeightedGraph<>();
        copy.addNodes(adjacency.keySet());
        for (Edge<N> edge : edges) {
            copy.addEdgeLike(edge);
        }
        return copy;
    }

    private Map<N, Edge<N>> requireIncident(N node) {
        Map<N, Edge<N>> incident = adjacency.get(node);
        if (incident == null) {
            throw new IllegalArgumentException("node not in graph: " + node);
        }
        return incident;
    }

    private Edge<N> requireEdge(N u, N v) {
        Edge<N> edge = getEdge(u, v);
        if (edge == null) {
            throw new IllegalArgumentException("edge not in graph: " + u + " -- " + v);
        }
        return edge;
    }

    @Override
    public String toString() {
        return "WeightedGraph[nodes=" + adjacency.size() + ", edges=" + edges.size() + "]";
    }
}
