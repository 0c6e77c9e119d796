package org.steiner.testutil;

import org.steiner.graph.WeightedGraph;
import org.steiner.heuristic.DistanceHeuristic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shared test fixture factory for graph and Steiner tree tests.
 */
public final class SteinerFixtureFactory {

    private SteinerFixtureFactory() {
    }

    /**
     * Grid coordinate used as node value.
     */
    public record Cell(int x, int y) {
        @Override
        public String toString() {
            return "(" + x + "," + y + ")";
        }
    }

    /**
     * Manhattan distance; admissible and consistent on unit-weight grids.
     */
    public static final DistanceHeuristic<Cell> TAXICAB =
            (a, b) -> Math.abs(a.x() - b.x()) + Math.abs(a.y() - b.y());

    /**
     * Builds an {@code n x n} 4-connected grid with every edge weighing {@code weight}.
     */
    public static WeightedGraph<Cell> grid(int n, double weight) {
        WeightedGraph<Cell> graph = new WeightedGraph<>();
        for (int x = 0; x < n; x++) {
            for (int y = 0; y < n; y++) {
                graph.addNode(new Cell(x, y));
            }
        }
        for (int x = 0; x < n; x++) {
            for (int y = 0; y < n; y++) {
                if (x + 1 < n) {
                    graph.addEdge(new Cell(x, y), new Cell(x + 1, y), weight);
                }
                if (y + 1 < n) {
                    graph.addEdge(new Cell(x, y), new Cell(x, y + 1), weight);
                }
            }
        }
        return graph;
    }

    /**
     * Samples {@code count} distinct nodes with a fixed seed.
     */
    public static <N> List<N> sample(WeightedGraph<N> graph, int count, long seed) {
        List<N> nodes = new ArrayList<>(graph.nodes());
        Collections.shuffle(nodes, new Random(seed));
        return new ArrayList<>(nodes.subList(0, Math.min(count, nodes.size())));
    }

    /**
     * Path graph {@code A - B - C} with unit weights.
     */
    public static WeightedGraph<String> pathAbc() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        graph.addEdge("A", "B", 1.0d);
        graph.addEdge("B", "C", 1.0d);
        return graph;
    }

    /**
     * Two disjoint triangles {@code A,B,C} and {@code X,Y,Z}.
     */
    public static WeightedGraph<String> twoTriangles() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        graph.addEdge("A", "B", 1.0d);
        graph.addEdge("B", "C", 1.0d);
        graph.addEdge("C", "A", 1.0d);
        graph.addEdge("X", "Y", 1.0d);
        graph.addEdge("Y", "Z", 1.0d);
        graph.addEdge("Z", "X", 1.0d);
        return graph;
    }

    /**
     * Star with hub {@code H} and spokes {@code S1..S4} weighing 1, plus a ring
     * {@code S1-S2-S3-S4-S1} weighing 3. The optimal tree for all spokes uses the hub.
     */
    public static WeightedGraph<String> hubAndRing() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        for (int i = 1; i <= 4; i++) {
            graph.addEdge("H", "S" + i, 1.0d);
        }
        graph.addEdge("S1", "S2", 3.0d);
        graph.addEdge("S2", "S3", 3.0d);
        graph.addEdge("S3", "S4", 3.0d);
        graph.addEdge("S4", "S1", 3.0d);
        return graph;
    }
}
