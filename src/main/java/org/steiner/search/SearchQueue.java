package org.steiner.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indexed min-priority queue for node-based best-first search (Dijkstra/A*).
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Pooling:</strong> Reuses {@link SearchState} instances from an internal stack so the
 * relaxation loop does not allocate.</li>
 * <li><strong>Decrease-Key:</strong> At most one entry per node; a better path updates the entry in
 * O(log n) through a position index.</li>
 * <li><strong>Strict Contracts:</strong> Enforces pool limits to detect forgotten recycles.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class SearchQueue {
    // Binary heap, 1-based
    private final SearchState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[nodeId] = heap index, 0 when absent
    private final int[] positions;

    private final SearchState[] pool;
    private int poolTop;

    private int activeStates = 0;

    /**
     * Initializes the queue with fixed capacity.
     *
     * @param maxNodeId largest node id that will be inserted. Must be non-negative.
     * @param capacity  maximum number of entries held at once, also the pool size.
     * @throws IllegalArgumentException if maxNodeId is negative or capacity is not positive.
     */
    public SearchQueue(int maxNodeId, int capacity) {
        if (maxNodeId < 0) {
            throw new IllegalArgumentException("maxNodeId must be non-negative");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = new SearchState[capacity + 1];
        this.positions = new int[maxNodeId + 1];
        this.pool = new SearchState[capacity];
        for (int i = 0; i < capacity; i++) {
            pool[i] = new SearchState();
        }
        poolTop = capacity - 1;
    }

    /**
     * Inserts an entry for {@code nodeId}, or improves the existing one.
     * <p>
     * When the node is already queued the entry is replaced only if the candidate orders
     * strictly before it (see {@link SearchState#compareTo(SearchState)}).
     * </p>
     *
     * @param nodeId      node id (must be &le; maxNodeId).
     * @param priority    search priority.
     * @param gScore      cumulative path weight.
     * @param predecessor predecessor node id.
     * @return true when the queue changed.
     * @throws IllegalArgumentException if nodeId is out of bounds.
     * @throws IllegalStateException    if the pool is exhausted or the heap is full.
     */
    public boolean insert(int nodeId, double priority, double gScore, int predecessor) {
        if (nodeId < 0 || nodeId >= positions.length) {
            throw new IllegalArgumentException("nodeId " + nodeId + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[nodeId];
        if (existingIdx > 0 && existingIdx <= size) {
            SearchState existing = heap[existingIdx];
            if (ordersBefore(priority, gScore, existing)) {
                existing.set(nodeId, priority, gScore, predecessor);
                swim(existingIdx);
                return true;
            }
            return false;
        }

        if (size >= heap.length - 1) {
            throw new IllegalStateException("Heap full. Increase capacity.");
        }
        if (poolTop < 0) {
            throw new IllegalStateException(
                    "Pool exhausted. Recycle extracted states. " +
                            "Active: " + activeStates + ", Capacity: " + pool.length
            );
        }

        SearchState newState = pool[poolTop--];
        activeStates++;
        newState.set(nodeId, priority, gScore, predecessor);

        size++;
        heap[size] = newState;
        positions[nodeId] = size;
        swim(size);
        return true;
    }

    /**
     * Extracts the minimum entry.
     * <p>
     * <strong>Contract:</strong> The caller MUST hand the state back through
     * {@link #recycle(SearchState)} once done with it.
     * </p>
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public SearchState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        SearchState min = heap[1];
        int lastIndex = size;

        if (lastIndex == 1) {
            heap[1] = null;
            positions[min.nodeId] = 0;
            size = 0;
            return min;
        }

        SearchState last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;

        positions[last.nodeId] = 1;
        positions[min.nodeId] = 0;

        sink(1);
        return min;
    }

    /**
     * @return whether {@code nodeId} currently has a queued entry.
     */
    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < positions.length && positions[nodeId] > 0;
    }

    /**
     * Returns a state to the pool.
     *
     * @param state the state to recycle; null is ignored.
     * @throws IllegalStateException on pool overflow (double recycle).
     */
    public void recycle(SearchState state) {
        if (state == null) return;

        if (poolTop >= pool.length - 1) {
            throw new IllegalStateException("Pool overflow or double-recycle detected");
        }
        if (activeStates <= 0) {
            throw new IllegalStateException("Recycle called with no active states");
        }

        activeStates--;
        pool[++poolTop] = state;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private static boolean ordersBefore(double priority, double gScore, SearchState existing) {
        int priorityCompare = Double.compare(priority, existing.priority);
        if (priorityCompare != 0) {
            return priorityCompare < 0;
        }
        return Double.compare(gScore, existing.gScore) > 0;
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        SearchState s1 = heap[i];
        SearchState s2 = heap[j];
        heap[i] = s2;
        heap[j] = s1;
        positions[s1.nodeId] = j;
        positions[s2.nodeId] = i;
    }
}
