package org.steiner.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.steiner.graph.GraphConnectivity;
import org.steiner.graph.WeightedGraph;
import org.steiner.testutil.SteinerFixtureFactory;
import org.steiner.testutil.SteinerFixtureFactory.Cell;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MinimumSpanningTree Tests")
class MinimumSpanningTreeTest {

    @Test
    @DisplayName("Classic graph: picks the known minimum edges")
    void testKnownMinimum() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        graph.addEdge("A", "B", 4.0d);
        graph.addEdge("A", "C", 1.0d);
        graph.addEdge("B", "C", 2.0d);
        graph.addEdge("B", "D", 5.0d);
        graph.addEdge("C", "D", 8.0d);
        graph.addEdge("D", "E", 3.0d);

        WeightedGraph<String> mst = MinimumSpanningTree.of(graph, "weight");

        assertEquals(5, mst.nodeCount());
        assertEquals(4, mst.edgeCount());
        assertEquals(11.0d, mst.totalWeight("weight"), 1e-9d);
        assertTrue(mst.containsEdge("A", "C"));
        assertTrue(mst.containsEdge("B", "C"));
        assertTrue(mst.containsEdge("B", "D"));
        assertTrue(mst.containsEdge("D", "E"));
        assertTrue(GraphConnectivity.isTree(mst));
    }

    @Test
    @DisplayName("Attributes are copied onto selected edges")
    void testAttributesCopied() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        graph.addEdge("A", "B", "cost", 2.0d);
        graph.setEdgeAttribute("A", "B", "capacity", 10.0d);

        WeightedGraph<String> mst = MinimumSpanningTree.of(graph, "cost");

        assertEquals(2.0d, mst.weight("A", "B", "cost"), 1e-9d);
        assertEquals(10.0d, mst.weight("A", "B", "capacity"), 1e-9d);
    }

    @Test
    @DisplayName("Disconnected input yields a spanning forest with every node")
    void testForest() {
        WeightedGraph<String> graph = SteinerFixtureFactory.twoTriangles();
        graph.addNode("LONE");

        WeightedGraph<String> forest = MinimumSpanningTree.of(graph, "weight");

        assertEquals(7, forest.nodeCount());
        assertEquals(4, forest.edgeCount());
        assertEquals(3, GraphConnectivity.connectedComponents(forest).size());
    }

    @Test
    @DisplayName("Single node and empty graphs")
    void testDegenerate() {
        WeightedGraph<String> single = new WeightedGraph<>();
        single.addNode("A");
        WeightedGraph<String> mst = MinimumSpanningTree.of(single, "weight");
        assertEquals(1, mst.nodeCount());
        assertEquals(0, mst.edgeCount());

        assertTrue(MinimumSpanningTree.of(new WeightedGraph<String>(), "weight").isEmpty());
    }

    @Test
    @DisplayName("Unit-weight grid: tree with n^2 - 1 edges")
    void testGrid() {
        WeightedGraph<Cell> grid = SteinerFixtureFactory.grid(6, 1.0d);
        WeightedGraph<Cell> mst = MinimumSpanningTree.of(grid, "weight");

        assertTrue(GraphConnectivity.isTree(mst));
        assertEquals(35.0d, mst.totalWeight("weight"), 1e-9d);
    }

    @Test
    @DisplayName("Input graph is not mutated")
    void testInputUntouched() {
        WeightedGraph<String> graph = SteinerFixtureFactory.twoTriangles();
        MinimumSpanningTree.of(graph, "weight");
        assertEquals(6, graph.edgeCount());
    }

    @Test
    @DisplayName("Validation: NaN weights are rejected")
    void testNaNRejected() {
        WeightedGraph<String> graph = new WeightedGraph<>();
        graph.addEdge("A", "B", Double.NaN);
        graph.addEdge("B", "C", 1.0d);
        assertThrows(IllegalArgumentException.class, () -> MinimumSpanningTree.of(graph, "weight"));
    }
}
