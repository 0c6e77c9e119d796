package org.steiner.heuristic;

/**
 * Heuristic estimator bound to one goal node.
 *
 * <p>Hot path contract: {@link #estimateFromNode(int)} is called once per frontier insertion.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * Estimates remaining cost from a node to the pre-bound goal.
     *
     * @param nodeId dense source node id.
     * @return estimate; admissible estimates never exceed the true remaining cost.
     */
    double estimateFromNode(int nodeId);
}
