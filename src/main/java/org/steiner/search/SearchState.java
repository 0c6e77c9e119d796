package org.steiner.search;

/**
 * Mutable frontier entry of a node-based best-first search.
 * <p>
 * <strong>Design Pattern: Object Pooling</strong><br>
 * Instances are allocated once by a {@link SearchQueue} and recycled between
 * insertions, so a search creates no garbage per relaxation.
 * </p>
 */
public class SearchState implements Comparable<SearchState> {

    /** Dense internal id of the node this entry reaches. */
    public int nodeId;

    /** Search priority, {@code g + h} for A* and {@code g} for uniform-cost search. */
    public double priority;

    /** Cumulative path weight from the source. */
    public double gScore;

    /** Node id of the predecessor on the best known path, or -1 for the source. */
    public int predecessor;

    /**
     * Default constructor for pre-allocation within an object pool.
     */
    public SearchState() {
    }

    /**
     * Re-initializes the entry in place.
     *
     * @param nodeId      reached node id.
     * @param priority    search priority.
     * @param gScore      cumulative path weight.
     * @param predecessor predecessor node id.
     */
    public void set(int nodeId, double priority, double gScore, int predecessor) {
        this.nodeId = nodeId;
        this.priority = priority;
        this.gScore = gScore;
        this.predecessor = predecessor;
    }

    /**
     * Orders entries for the min-heap.
     * <ol>
     * <li><strong>Primary:</strong> priority (lower is better).</li>
     * <li><strong>Secondary:</strong> g-score (higher is better, i.e. closer to the goal).</li>
     * <li><strong>Tertiary:</strong> node id (lower is better) for a stable total order.</li>
     * </ol>
     */
    @Override
    public int compareTo(SearchState other) {
        int priorityCompare = Double.compare(this.priority, other.priority);
        if (priorityCompare != 0) {
            return priorityCompare;
        }
        int gCompare = Double.compare(other.gScore, this.gScore);
        if (gCompare != 0) {
            return gCompare;
        }
        return Integer.compare(this.nodeId, other.nodeId);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "node=" + nodeId +
                ", f=" + priority +
                ", g=" + gScore +
                ", pred=" + predecessor +
                '}';
    }
}
