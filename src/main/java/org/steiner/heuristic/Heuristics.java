package org.steiner.heuristic;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Stock {@link DistanceHeuristic} strategies.
 */
@UtilityClass
public final class Heuristics {

    /**
     * Returns the zero estimate. A* guided by it behaves like plain Dijkstra.
     */
    public static <N> DistanceHeuristic<N> none() {
        return (node, goal) -> 0.0d;
    }

    /**
     * Scales another heuristic by a non-negative factor.
     *
     * <p>A factor below one keeps an admissible heuristic admissible; a factor above one
     * trades path optimality for fewer settled nodes.</p>
     */
    public static <N> DistanceHeuristic<N> scaled(DistanceHeuristic<N> heuristic, double factor) {
        Objects.requireNonNull(heuristic, "heuristic");
        if (!Double.isFinite(factor) || factor < 0.0d) {
            throw new IllegalArgumentException("factor must be finite and >= 0, got " + factor);
        }
        return (node, goal) -> factor * heuristic.estimate(node, goal);
    }
}
