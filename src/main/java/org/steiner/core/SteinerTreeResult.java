package org.steiner.core;

import lombok.Builder;
import lombok.Value;
import org.steiner.graph.WeightedGraph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Output of one Steiner tree computation.
 *
 * <p>{@code tree} is connected and acyclic, contains every terminal and has only terminals
 * as leaves. It belongs to the caller; the core keeps no reference to it.</p>
 */
@Value
@Builder
public class SteinerTreeResult<N> {
    /** Approximate Steiner tree; edges keep their attributes from the input graph. */
    WeightedGraph<N> tree;
    /** Distinct terminals in request order. */
    Set<N> terminals;
    /** Edge attribute the weights were read from. */
    String weightKey;
    /** Sum of tree edge weights under {@code weightKey}. */
    double totalWeight;
    /** Execution counters. */
    SteinerExecutionStats stats;

    /**
     * @return non-terminal nodes kept in the tree, in tree insertion order.
     */
    public Set<N> steinerPoints() {
        Set<N> points = new LinkedHashSet<>(tree.nodes());
        points.removeAll(terminals);
        return points;
    }
}
