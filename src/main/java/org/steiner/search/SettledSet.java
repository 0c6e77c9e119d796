package org.steiner.search;

import java.util.BitSet;

/**
 * Closed set of a node-based search, one bit per dense node id.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; owned by a single search.
 * </p>
 */
public class SettledSet {

    private final BitSet settled;

    /**
     * @param nodeCount number of dense node ids the search may touch.
     */
    public SettledSet(int nodeCount) {
        this.settled = new BitSet(nodeCount);
    }

    /**
     * Marks a node as settled if it wasn't already.
     *
     * @return {@code true} if the node was newly marked, {@code false} if it was settled before.
     */
    public boolean markSettled(int nodeId) {
        if (settled.get(nodeId)) {
            return false;
        }
        settled.set(nodeId);
        return true;
    }

    public boolean isSettled(int nodeId) {
        return settled.get(nodeId);
    }

    /**
     * @return number of settled nodes.
     */
    public int cardinality() {
        return settled.cardinality();
    }

    /**
     * Marks every node unsettled for reuse.
     */
    public void clear() {
        settled.clear();
    }
}
