package org.steiner.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;

/**
 * NodeIndex implementation on top of fastutil.
 * <p>
 * Forward lookups avoid boxing; reverse lookups are a plain array read.
 * This class is immutable and thread-safe for concurrent reads.
 * </p>
 *
 * @param <N> node value type.
 */
public class FastUtilNodeIndex<N> implements NodeIndex<N> {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<N> forward;
    private final Object[] reverse;

    /**
     * Builds the index from distinct node values.
     *
     * @throws IllegalArgumentException if nodes is null, holds a null or a duplicate.
     */
    public FastUtilNodeIndex(Collection<N> nodes) {
        if (nodes == null) {
            throw new IllegalArgumentException("Nodes cannot be null");
        }
        int size = nodes.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new Object[size];

        int next = 0;
        for (N node : nodes) {
            if (node == null) {
                throw new IllegalArgumentException("Null node at position " + next);
            }
            if (forward.putIfAbsent(node, next) != MISSING) {
                throw new IllegalArgumentException("Duplicate node detected in input: " + node);
            }
            reverse[next++] = node;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(N node) throws UnknownNodeException {
        int id = forward.getInt(node);
        if (id == MISSING) {
            throw new UnknownNodeException("Node not indexed: " + node);
        }
        return id;
    }

    @Override
    @SuppressWarnings("unchecked")
    public N toNode(int internalId) {
        try {
            return (N) reverse[internalId];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
    }

    @Override
    public boolean containsNode(N node) {
        return forward.containsKey(node);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
