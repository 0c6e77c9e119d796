package org.steiner.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;

/**
 * Bidirectional mapping contract between opaque node values and internal dense integer ids.
 *
 * @param <N> node value type.
 */
public interface NodeIndex<N> {

    /**
     * Converts a node value to its internal integer index.
     * @param node The node value.
     * @return The internal integer index.
     * @throws UnknownNodeException If the node is not indexed.
     */
    int toInternal(N node) throws UnknownNodeException;

    /**
     * Converts an internal integer index back to its node value.
     * @param internalId The internal index.
     * @return The node value.
     * @throws IndexOutOfBoundsException If the internal ID is invalid.
     */
    N toNode(int internalId);

    /**
     * Checks whether a node value has a mapped internal id.
     *
     * @param node node to test.
     * @return true when the node is present.
     */
    boolean containsNode(N node);

    /**
     * Checks whether an internal id is within index bounds.
     *
     * @param internalId internal id to test.
     * @return true when the internal id is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of indexed nodes.
     *
     * @return total index size.
     */
    int size();

    /**
     * Exception thrown when a node value cannot be found in the index.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     * Ids are assigned densely from 0 in iteration order of {@code nodes}.
     *
     * @param nodes distinct node values.
     * @return An immutable NodeIndex instance.
     */
    static <N> NodeIndex<N> createImmutable(Collection<N> nodes) {
        return new FastUtilNodeIndex<>(nodes);
    }
}
