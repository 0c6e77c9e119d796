package org.steiner.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-search deterministic bounds for work and frontier growth.
 *
 * <p>Non-positive bounds mean unbounded. {@link #defaults()} reads bounds from system
 * properties so deployments can cap runaway searches without code changes.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_SETTLED_EXCEEDED = "SEARCH_BUDGET_SETTLED_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "SEARCH_BUDGET_FRONTIER_EXCEEDED";

    public static final String PROP_MAX_SETTLED = "steiner.search.maxSettledNodes";
    public static final String PROP_MAX_FRONTIER = "steiner.search.maxFrontierSize";

    private static final SearchBudget UNBOUNDED_BUDGET = new SearchBudget(UNBOUNDED, UNBOUNDED);

    private final int maxSettledNodes;
    private final int maxFrontierSize;

    private SearchBudget(int maxSettledNodes, int maxFrontierSize) {
        this.maxSettledNodes = normalizeBound(maxSettledNodes);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static SearchBudget of(int maxSettledNodes, int maxFrontierSize) {
        return new SearchBudget(maxSettledNodes, maxFrontierSize);
    }

    public static SearchBudget unbounded() {
        return UNBOUNDED_BUDGET;
    }

    /**
     * Loads budget values from system properties; unset, blank or malformed values are unbounded.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_SETTLED),
                readBound(PROP_MAX_FRONTIER)
        );
    }

    public int maxSettledNodes() {
        return maxSettledNodes;
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    /**
     * Validates settled-node count against the configured bound.
     */
    void checkSettledNodes(int settledNodes) {
        if (settledNodes > maxSettledNodes) {
            throw new BudgetExceededException(
                    REASON_SETTLED_EXCEEDED,
                    "settled-node budget exceeded: " + settledNodes + " > " + maxSettledNodes
            );
        }
    }

    /**
     * Validates frontier size against the configured bound.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget[maxSettledNodes=" + maxSettledNodes + ", maxFrontierSize=" + maxFrontierSize + "]";
    }

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
