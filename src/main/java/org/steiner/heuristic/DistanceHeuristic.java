package org.steiner.heuristic;

import org.steiner.core.id.NodeIndex;

import java.util.Objects;

/**
 * Pluggable distance estimate between two node values, used to guide A* searches.
 *
 * <p>Implementations must be side-effect free: one instance may be evaluated by
 * concurrent searches. Admissibility (never overestimating) is what makes A* return
 * shortest paths; an inadmissible estimate still yields valid paths.</p>
 *
 * @param <N> node value type.
 */
@FunctionalInterface
public interface DistanceHeuristic<N> {

    /**
     * Estimates the path weight from {@code node} to {@code goal}.
     */
    double estimate(N node, N goal);

    /**
     * Binds a concrete goal and returns an estimator working in dense id space.
     *
     * @param index node index of the searched graph.
     * @param goal goal node value; must be indexed.
     * @return estimator bound to {@code goal}.
     */
    default GoalBoundHeuristic bindGoal(NodeIndex<N> index, N goal) {
        Objects.requireNonNull(index, "index");
        if (!index.containsNode(goal)) {
            throw new IllegalArgumentException("goal not indexed: " + goal);
        }
        return nodeId -> estimate(index.toNode(nodeId), goal);
    }
}
