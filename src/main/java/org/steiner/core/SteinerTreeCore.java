package org.steiner.core;

import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.steiner.graph.WeightedGraph;
import org.steiner.heuristic.DistanceHeuristic;
import org.steiner.search.AStarShortestPath;
import org.steiner.search.SearchBudget;
import org.steiner.search.TerminationPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Steiner tree approximation entry point (Kou, Markowsky and Berman, 1981).
 *
 * <p>Validates the request before any graph is built, then runs the stages in order:</p>
 * <ul>
 * <li>Build the complete distance graph over the terminals with A* searches.</li>
 * <li>Take its minimum spanning tree to choose which terminal pairs to join.</li>
 * <li>Expand each chosen pair into its path in the input graph and union the paths.</li>
 * <li>Take the minimum spanning tree of that union to drop cycles.</li>
 * <li>Prune non-terminal leaves.</li>
 * </ul>
 * <p>Engine guardrail exceptions are wrapped into {@link SteinerTreeException} with stable
 * reason codes. With an admissible heuristic the tree weight is within {@code 2(1 - 1/k)}
 * of the optimum for {@code k} terminals.</p>
 *
 * <p>Instances are immutable. Concurrent calls are safe as long as the input graph is not
 * mutated and the heuristic is side-effect free during the call.</p>
 */
public final class SteinerTreeCore {
    public static final String REASON_GRAPH_REQUIRED = "STEINER_GRAPH_REQUIRED";
    public static final String REASON_HEURISTIC_REQUIRED = "STEINER_HEURISTIC_REQUIRED";
    public static final String REASON_WEIGHT_KEY_REQUIRED = "STEINER_WEIGHT_KEY_REQUIRED";
    public static final String REASON_TERMINALS_REQUIRED = "STEINER_TERMINALS_REQUIRED";
    public static final String REASON_UNKNOWN_TERMINAL = "STEINER_UNKNOWN_TERMINAL";
    public static final String REASON_UNREACHABLE_TERMINAL = "STEINER_UNREACHABLE_TERMINAL";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "STEINER_SEARCH_BUDGET_EXCEEDED";
    public static final String REASON_NUMERIC_SAFETY_BREACH = "STEINER_NUMERIC_SAFETY_BREACH";

    private static final Logger log = LoggerFactory.getLogger(SteinerTreeCore.class);

    private final AStarShortestPath search;
    private final boolean reuseDistancePaths;

    /**
     * Creates the facade.
     *
     * @param searchBudget optional per-search work bounds (unbounded when null).
     * @param reuseDistancePaths whether paths found while building the distance graph are
     *                           reused during path expansion (default true).
     */
    @Builder
    public SteinerTreeCore(SearchBudget searchBudget, Boolean reuseDistancePaths) {
        this.search = new AStarShortestPath(
                searchBudget == null ? SearchBudget.unbounded() : searchBudget,
                TerminationPolicy.defaults()
        );
        this.reuseDistancePaths = reuseDistancePaths == null || reuseDistancePaths;
    }

    /**
     * Creates a facade whose search budget is read from system properties.
     *
     * @see SearchBudget#defaults()
     */
    public static SteinerTreeCore defaults() {
        return SteinerTreeCore.builder()
                .searchBudget(SearchBudget.defaults())
                .build();
    }

    /**
     * Computes an approximate Steiner tree reading weights from
     * {@link WeightedGraph#DEFAULT_WEIGHT_KEY}.
     *
     * @see #compute(WeightedGraph, Collection, DistanceHeuristic, String)
     */
    public <N> SteinerTreeResult<N> compute(
            WeightedGraph<N> graph,
            Collection<N> terminals,
            DistanceHeuristic<N> heuristic
    ) {
        return compute(graph, terminals, heuristic, WeightedGraph.DEFAULT_WEIGHT_KEY);
    }

    /**
     * Computes an approximate Steiner tree.
     *
     * @param graph undirected input graph; never mutated.
     * @param terminals nodes to connect; duplicates are ignored.
     * @param heuristic distance estimate guiding every search.
     * @param weightKey edge attribute holding weights; edges without it weigh 1.
     * @return the tree with its weight and execution counters.
     * @throws SteinerTreeException on invalid input, unreachable terminals or search guardrail breaches.
     */
    public <N> SteinerTreeResult<N> compute(
            WeightedGraph<N> graph,
            Collection<N> terminals,
            DistanceHeuristic<N> heuristic,
            String weightKey
    ) {
        validate(graph, heuristic, weightKey);
        List<N> terminalList = normalizeTerminals(graph, terminals);

        try {
            return run(graph, terminalList, heuristic, weightKey);
        } catch (SearchBudget.BudgetExceededException ex) {
            throw new SteinerTreeException(
                    REASON_SEARCH_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        } catch (TerminationPolicy.NumericSafetyException ex) {
            throw new SteinerTreeException(
                    REASON_NUMERIC_SAFETY_BREACH,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
    }

    private <N> SteinerTreeResult<N> run(
            WeightedGraph<N> graph,
            List<N> terminals,
            DistanceHeuristic<N> heuristic,
            String weightKey
    ) {
        SteinerQueryContext<N> context = new SteinerQueryContext<>(
                graph,
                heuristic,
                weightKey,
                search,
                reuseDistancePaths
        );

        WeightedGraph<N> distanceGraph = DistanceGraphBuilder.build(context, terminals);
        log.debug("distance graph: {} terminals, {} edges, {} searches",
                distanceGraph.nodeCount(), distanceGraph.edgeCount(), context.searches());

        WeightedGraph<N> spanningTree = SpanningTreeReducer.reduce(distanceGraph, weightKey);

        WeightedGraph<N> accumulator = PathExpander.expand(context, spanningTree);
        log.debug("expanded {} terminal pairs into {} nodes, {} edges (reused paths: {})",
                spanningTree.edgeCount(), accumulator.nodeCount(), accumulator.edgeCount(), context.reusedPaths());

        WeightedGraph<N> reduced = SubgraphReducer.reduce(accumulator, weightKey);

        LeafPruner.Outcome<N> pruned = LeafPruner.pruneCounting(reduced, terminals);
        WeightedGraph<N> tree = pruned.tree();
        double totalWeight = tree.totalWeight(weightKey);
        log.debug("steiner tree: {} nodes, {} edges, weight {} ({} leaves pruned)",
                tree.nodeCount(), tree.edgeCount(), totalWeight, pruned.prunedNodes());

        SteinerExecutionStats stats = new SteinerExecutionStats(
                terminals.size(),
                context.searches(),
                context.reusedPaths(),
                context.settledNodes(),
                distanceGraph.edgeCount(),
                accumulator.nodeCount(),
                accumulator.edgeCount(),
                pruned.prunedNodes()
        );
        return SteinerTreeResult.<N>builder()
                .tree(tree)
                .terminals(Collections.unmodifiableSet(new LinkedHashSet<>(terminals)))
                .weightKey(weightKey)
                .totalWeight(totalWeight)
                .stats(stats)
                .build();
    }

    private static void validate(WeightedGraph<?> graph, DistanceHeuristic<?> heuristic, String weightKey) {
        if (graph == null) {
            throw new SteinerTreeException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (heuristic == null) {
            throw new SteinerTreeException(REASON_HEURISTIC_REQUIRED, "heuristic must be provided");
        }
        if (weightKey == null || weightKey.isBlank()) {
            throw new SteinerTreeException(REASON_WEIGHT_KEY_REQUIRED, "weightKey must be non-blank");
        }
    }

    /**
     * Deduplicates terminals in request order and checks each one against the graph.
     */
    private static <N> List<N> normalizeTerminals(WeightedGraph<N> graph, Collection<N> terminals) {
        if (terminals == null || terminals.isEmpty()) {
            throw new SteinerTreeException(REASON_TERMINALS_REQUIRED, "terminals must be non-empty");
        }
        Set<N> distinct = new LinkedHashSet<>();
        int position = 0;
        for (N terminal : terminals) {
            if (terminal == null) {
                throw new SteinerTreeException(REASON_TERMINALS_REQUIRED, "terminals[" + position + "] must be non-null");
            }
            if (!graph.containsNode(terminal)) {
                throw new SteinerTreeException(REASON_UNKNOWN_TERMINAL, "terminal not in graph: " + terminal);
            }
            distinct.add(terminal);
            position++;
        }
        return new ArrayList<>(distinct);
    }
}
