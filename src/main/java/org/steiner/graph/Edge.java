package org.steiner.graph;

import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMaps;

import java.util.Objects;

/**
 * Undirected edge of a {@link WeightedGraph} with named numeric attributes.
 *
 * <p>Endpoints keep their insertion orientation only for display; {@link #source()} and
 * {@link #target()} are interchangeable for every graph operation. Attributes are mutated
 * only through the owning graph.</p>
 *
 * @param <N> node value type.
 */
public final class Edge<N> {
    private final N source;
    private final N target;
    private final Object2DoubleLinkedOpenHashMap<String> attributes;

    Edge(N source, N target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.attributes = new Object2DoubleLinkedOpenHashMap<>(2);
        this.attributes.defaultReturnValue(Double.NaN);
    }

    public N source() {
        return source;
    }

    public N target() {
        return target;
    }

    /**
     * Returns the endpoint opposite to {@code node}.
     *
     * @throws IllegalArgumentException when {@code node} is not an endpoint.
     */
    public N opposite(N node) {
        if (source.equals(node)) {
            return target;
        }
        if (target.equals(node)) {
            return source;
        }
        throw new IllegalArgumentException(node + " is not an endpoint of " + this);
    }

    /**
     * Returns the numeric attribute stored under {@code key}, or
     * {@link WeightedGraph#DEFAULT_WEIGHT} when the edge carries no such attribute.
     */
    public double weight(String key) {
        if (!hasAttribute(key)) {
            return WeightedGraph.DEFAULT_WEIGHT;
        }
        return attributes.getDouble(key);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    /**
     * @return read-only view of all attributes in insertion order.
     */
    public Object2DoubleMap<String> attributes() {
        return Object2DoubleMaps.unmodifiable(attributes);
    }

    void putAttribute(String key, double value) {
        attributes.put(Objects.requireNonNull(key, "key"), value);
    }

    void putAllAttributes(Edge<N> other) {
        attributes.putAll(other.attributes);
    }

    @Override
    public String toString() {
        return source + " -- " + target + " " + attributes;
    }
}
