package org.steiner.search;

import org.steiner.core.id.NodeIndex;
import org.steiner.graph.Edge;
import org.steiner.graph.WeightedGraph;
import org.steiner.heuristic.DistanceHeuristic;
import org.steiner.heuristic.GoalBoundHeuristic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Point-to-point best-first search over a {@link WeightedGraph} with A* priority {@code g + h}.
 *
 * <p>Search state lives in primitive arrays addressed through a {@link NodeIndex}. Each node
 * has at most one frontier entry (decrease-key) and is expanded at most once (closed set).
 * With an admissible, consistent heuristic the returned path is a shortest path; with any
 * other finite heuristic it is still a valid source-to-target path.</p>
 *
 * <p>Frontier ties are broken by larger g-score, then by lower node id, so repeated searches
 * over the same graph and index return identical paths.</p>
 *
 * <p>Instances are immutable and may be shared across threads; every call owns its state.</p>
 */
public final class AStarShortestPath {
    private static final int NO_PREDECESSOR = -1;

    private final SearchBudget budget;
    private final TerminationPolicy terminationPolicy;

    /**
     * Creates a search with explicit guardrails.
     */
    public AStarShortestPath(SearchBudget budget, TerminationPolicy terminationPolicy) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.terminationPolicy = Objects.requireNonNull(terminationPolicy, "terminationPolicy");
    }

    /**
     * Creates a search with no work bounds.
     */
    public AStarShortestPath() {
        this(SearchBudget.unbounded(), TerminationPolicy.defaults());
    }

    /**
     * Searches {@code graph}, indexing its nodes for this call only.
     *
     * @see #find(WeightedGraph, NodeIndex, Object, Object, DistanceHeuristic, String)
     */
    public <N> ShortestPath<N> find(
            WeightedGraph<N> graph,
            N source,
            N target,
            DistanceHeuristic<N> heuristic,
            String weightKey
    ) {
        Objects.requireNonNull(graph, "graph");
        return find(graph, NodeIndex.createImmutable(graph.nodes()), source, target, heuristic, weightKey);
    }

    /**
     * Finds a path from {@code source} to {@code target}.
     *
     * @param graph graph to search; read only.
     * @param index dense index over exactly the nodes of {@code graph}.
     * @param source start node.
     * @param target goal node.
     * @param heuristic estimate guiding the search.
     * @param weightKey edge attribute holding weights; missing attributes weigh 1.
     * @return the path, or {@link ShortestPath#unreachable(int)} when no path exists.
     * @throws IllegalArgumentException when an endpoint is not in the graph or the index does not match it.
     * @throws SearchBudget.BudgetExceededException when the search outgrows its budget.
     * @throws TerminationPolicy.NumericSafetyException on negative/non-finite weights or estimates.
     */
    public <N> ShortestPath<N> find(
            WeightedGraph<N> graph,
            NodeIndex<N> index,
            N source,
            N target,
            DistanceHeuristic<N> heuristic,
            String weightKey
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(weightKey, "weightKey");
        if (index.size() != graph.nodeCount()) {
            throw new IllegalArgumentException(
                    "index size " + index.size() + " does not match graph node count " + graph.nodeCount()
            );
        }
        requireNode(graph, source, "source");
        requireNode(graph, target, "target");

        if (source.equals(target)) {
            return new ShortestPath<>(true, List.of(source), 0.0d, 0);
        }

        int sourceId = index.toInternal(source);
        int targetId = index.toInternal(target);
        GoalBoundHeuristic goalBound = heuristic.bindGoal(index, target);

        int nodeCount = index.size();
        SearchQueue frontier = new SearchQueue(nodeCount - 1, nodeCount);
        SettledSet settled = new SettledSet(nodeCount);
        int[] predecessors = new int[nodeCount];
        Arrays.fill(predecessors, NO_PREDECESSOR);

        frontier.insert(
                sourceId,
                terminationPolicy.priority(0.0d, goalBound.estimateFromNode(sourceId)),
                0.0d,
                NO_PREDECESSOR
        );

        int settledNodes = 0;
        while (!frontier.isEmpty()) {
            SearchState state = frontier.extractMin();
            int nodeId = state.nodeId;
            double gScore = state.gScore;
            int predecessor = state.predecessor;
            frontier.recycle(state);

            if (!settled.markSettled(nodeId)) {
                continue;
            }
            predecessors[nodeId] = predecessor;
            settledNodes++;
            budget.checkSettledNodes(settledNodes);

            if (nodeId == targetId) {
                return new ShortestPath<>(true, buildPath(index, predecessors, targetId), gScore, settledNodes);
            }

            N node = index.toNode(nodeId);
            for (Edge<N> edge : graph.incidentEdges(node)) {
                N neighbor = edge.opposite(node);
                int neighborId = index.toInternal(neighbor);
                if (settled.isSettled(neighborId)) {
                    continue;
                }
                double weight = edge.weight(weightKey);
                terminationPolicy.ensureValidWeight(node, neighbor, weight);
                double nextG = gScore + weight;
                double priority = terminationPolicy.priority(nextG, goalBound.estimateFromNode(neighborId));
                frontier.insert(neighborId, priority, nextG, nodeId);
            }
            budget.checkFrontierSize(frontier.size());
        }
        return ShortestPath.unreachable(settledNodes);
    }

    /**
     * Walks predecessor links back from the goal.
     */
    private static <N> List<N> buildPath(NodeIndex<N> index, int[] predecessors, int targetId) {
        List<N> path = new ArrayList<>();
        int current = targetId;
        while (current != NO_PREDECESSOR) {
            path.add(index.toNode(current));
            current = predecessors[current];
        }
        Collections.reverse(path);
        return path;
    }

    private static <N> void requireNode(WeightedGraph<N> graph, N node, String role) {
        if (!graph.containsNode(node)) {
            throw new IllegalArgumentException(role + " node not in graph: " + node);
        }
    }
}
