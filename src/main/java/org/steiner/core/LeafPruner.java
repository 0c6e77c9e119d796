package org.steiner.core;

import org.steiner.graph.WeightedGraph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Strips non-terminal leaves until every leaf of the tree is a terminal.
 *
 * <p>Runs as an explicit worklist loop, never recursion:</p>
 * <ul>
 * <li>The worklist starts with every non-terminal node of degree one.</li>
 * <li>Each step removes one queued node with its edge, then inspects the former neighbor.</li>
 * <li>A neighbor is queued when it is a non-terminal, is not queued yet and is left with
 * at most one edge.</li>
 * <li>The loop ends when the worklist is empty.</li>
 * </ul>
 * <p>Every step removes a node, so the loop runs at most {@code |tree| - |terminals|} times.
 * Pruning an already pruned tree changes nothing.</p>
 */
public final class LeafPruner {

    private LeafPruner() {
    }

    /**
     * Returns a pruned copy of {@code tree}; the input is not modified.
     *
     * @param tree acyclic graph to prune.
     * @param terminals nodes that must never be removed.
     * @return pruned copy.
     */
    public static <N> WeightedGraph<N> prune(WeightedGraph<N> tree, Collection<N> terminals) {
        return pruneCounting(tree, terminals).tree();
    }

    /**
     * Prunes a copy of {@code tree} and reports how many nodes were removed.
     */
    static <N> Outcome<N> pruneCounting(WeightedGraph<N> tree, Collection<N> terminals) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(terminals, "terminals");
        Set<N> terminalSet = new HashSet<>(terminals);
        WeightedGraph<N> pruned = tree.copy();

        ArrayDeque<N> worklist = new ArrayDeque<>();
        Set<N> queued = new HashSet<>();
        for (N node : pruned.nodes()) {
            if (pruned.degree(node) == 1 && !terminalSet.contains(node)) {
                worklist.add(node);
                queued.add(node);
            }
        }

        int removed = 0;
        while (!worklist.isEmpty()) {
            N leaf = worklist.poll();
            if (!pruned.containsNode(leaf) || pruned.degree(leaf) > 1) {
                continue;
            }
            N neighbor = pruned.degree(leaf) == 1 ? pruned.neighbors(leaf).iterator().next() : null;
            pruned.removeNode(leaf);
            removed++;

            if (neighbor != null
                    && !terminalSet.contains(neighbor)
                    && pruned.degree(neighbor) <= 1
                    && queued.add(neighbor)) {
                worklist.add(neighbor);
            }
        }
        return new Outcome<>(pruned, removed);
    }

    /**
     * Pruned tree plus the number of removed nodes.
     */
    record Outcome<N>(WeightedGraph<N> tree, int prunedNodes) {
    }
}
