package org.steiner.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Numeric guardrails applied while a search relaxes edges and orders its frontier.
 */
public final class TerminationPolicy {
    public static final String REASON_NON_FINITE_WEIGHT = "NUMERIC_NON_FINITE_WEIGHT";
    public static final String REASON_NEGATIVE_WEIGHT = "NUMERIC_NEGATIVE_WEIGHT";
    public static final String REASON_NON_FINITE_ESTIMATE = "NUMERIC_NON_FINITE_ESTIMATE";

    private static final TerminationPolicy DEFAULTS = new TerminationPolicy();

    private TerminationPolicy() {
    }

    public static TerminationPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Validates an edge weight about to be relaxed.
     */
    void ensureValidWeight(Object u, Object v, double weight) {
        if (!Double.isFinite(weight)) {
            throw new NumericSafetyException(
                    REASON_NON_FINITE_WEIGHT,
                    "edge " + u + " -- " + v + " weight must be finite, got " + weight
            );
        }
        if (weight < 0.0d) {
            throw new NumericSafetyException(
                    REASON_NEGATIVE_WEIGHT,
                    "edge " + u + " -- " + v + " weight must be >= 0, got " + weight
            );
        }
    }

    /**
     * Validates a heuristic estimate and returns the resulting frontier priority.
     * Negative estimates are accepted; they only reorder the frontier.
     */
    double priority(double gScore, double estimate) {
        if (!Double.isFinite(estimate)) {
            throw new NumericSafetyException(
                    REASON_NON_FINITE_ESTIMATE,
                    "heuristic estimate must be finite, got " + estimate
            );
        }
        return gScore + estimate;
    }

    /**
     * Deterministic exception for numeric guardrail failures.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class NumericSafetyException extends RuntimeException {
        private final String reasonCode;

        NumericSafetyException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
