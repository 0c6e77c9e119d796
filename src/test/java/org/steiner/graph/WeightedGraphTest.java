package org.steiner.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeightedGraph Tests")
class WeightedGraphTest {

    @Nested
    @DisplayName("1. Construction")
    class ConstructionTests {

        @Test
        @DisplayName("addEdge adds missing endpoints and links both directions")
        void testAddEdgeAddsNodes() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B", 2.5d);

            assertEquals(2, graph.nodeCount());
            assertEquals(1, graph.edgeCount());
            assertTrue(graph.containsEdge("A", "B"));
            assertTrue(graph.containsEdge("B", "A"));
            assertSame(graph.getEdge("A", "B"), graph.getEdge("B", "A"));
        }

        @Test
        @DisplayName("addNode is idempotent")
        void testAddNodeIdempotent() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            assertTrue(graph.addNode("A"));
            assertFalse(graph.addNode("A"));
            assertEquals(1, graph.nodeCount());
        }

        @Test
        @DisplayName("Re-adding an edge updates attributes without duplicating it")
        void testReAddUpdates() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B", 2.0d);
            graph.addEdge("B", "A", 5.0d);

            assertEquals(1, graph.edgeCount());
            assertEquals(5.0d, graph.weight("A", "B", WeightedGraph.DEFAULT_WEIGHT_KEY), 1e-9d);
        }

        @Test
        @DisplayName("Validation: self-loops and null nodes are rejected")
        void testValidation() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            assertThrows(IllegalArgumentException.class, () -> graph.addEdge("A", "A"));
            assertThrows(NullPointerException.class, () -> graph.addNode(null));
            assertThrows(NullPointerException.class, () -> graph.addEdge("A", null));
        }
    }

    @Nested
    @DisplayName("2. Weights")
    class WeightTests {

        @Test
        @DisplayName("Missing weight attribute defaults to 1")
        void testDefaultWeight() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B");
            graph.addEdge("B", "C", "cost", 4.0d);

            assertEquals(1.0d, graph.weight("A", "B", "weight"), 1e-9d);
            assertEquals(1.0d, graph.weight("B", "C", "weight"), 1e-9d);
            assertEquals(4.0d, graph.weight("B", "C", "cost"), 1e-9d);
            assertFalse(graph.getEdge("A", "B").hasAttribute("weight"));
        }

        @Test
        @DisplayName("Multiple named attributes coexist on one edge")
        void testNamedAttributes() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B", "length", 10.0d);
            graph.setEdgeAttribute("A", "B", "latency", 2.0d);

            Edge<String> edge = graph.getEdge("B", "A");
            assertEquals(10.0d, edge.weight("length"), 1e-9d);
            assertEquals(2.0d, edge.weight("latency"), 1e-9d);
            assertEquals(2, edge.attributes().size());
        }

        @Test
        @DisplayName("Weight lookups on missing edges fail")
        void testMissingEdgeWeight() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addNode("A");
            graph.addNode("B");
            assertThrows(IllegalArgumentException.class, () -> graph.weight("A", "B", "weight"));
            assertThrows(IllegalArgumentException.class, () -> graph.setEdgeAttribute("A", "B", "weight", 1.0d));
        }

        @Test
        @DisplayName("totalWeight sums every edge under one key")
        void testTotalWeight() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B", 2.0d);
            graph.addEdge("B", "C", 3.0d);
            graph.addEdge("C", "D");

            assertEquals(6.0d, graph.totalWeight("weight"), 1e-9d);
            assertEquals(3.0d, graph.totalWeight("other"), 1e-9d);
        }
    }

    @Nested
    @DisplayName("3. Topology")
    class TopologyTests {

        @Test
        @DisplayName("Neighbors and degree follow insertion order")
        void testNeighbors() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("H", "C");
            graph.addEdge("H", "A");
            graph.addEdge("H", "B");

            assertEquals(List.of("C", "A", "B"), List.copyOf(graph.neighbors("H")));
            assertEquals(3, graph.degree("H"));
            assertEquals(1, graph.degree("A"));
            assertThrows(IllegalArgumentException.class, () -> graph.degree("Z"));
        }

        @Test
        @DisplayName("removeNode drops incident edges")
        void testRemoveNode() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B");
            graph.addEdge("B", "C");

            assertTrue(graph.removeNode("B"));
            assertFalse(graph.removeNode("B"));
            assertEquals(0, graph.edgeCount());
            assertEquals(0, graph.degree("A"));
            assertEquals(0, graph.degree("C"));
        }

        @Test
        @DisplayName("removeEdge keeps endpoints")
        void testRemoveEdge() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B");

            assertTrue(graph.removeEdge("B", "A"));
            assertFalse(graph.removeEdge("A", "B"));
            assertTrue(graph.containsNode("A"));
            assertTrue(graph.containsNode("B"));
            assertEquals(0, graph.edgeCount());
        }

        @Test
        @DisplayName("Views are read-only")
        void testReadOnlyViews() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B");

            assertThrows(UnsupportedOperationException.class, () -> graph.nodes().add("C"));
            assertThrows(UnsupportedOperationException.class, () -> graph.neighbors("A").clear());
            assertThrows(UnsupportedOperationException.class, () -> graph.edges().clear());
        }

        @Test
        @DisplayName("copy is deep: mutating the copy leaves the source intact")
        void testCopyIsDeep() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            graph.addEdge("A", "B", 2.0d);
            graph.addNode("Z");

            WeightedGraph<String> copy = graph.copy();
            copy.setEdgeAttribute("A", "B", "weight", 9.0d);
            copy.removeNode("Z");

            assertEquals(2.0d, graph.weight("A", "B", "weight"), 1e-9d);
            assertTrue(graph.containsNode("Z"));
            assertEquals(9.0d, copy.weight("A", "B", "weight"), 1e-9d);
        }

        @Test
        @DisplayName("Edge.opposite resolves the other endpoint")
        void testOpposite() {
            WeightedGraph<String> graph = new WeightedGraph<>();
            Edge<String> edge = graph.addEdge("A", "B");

            assertEquals("B", edge.opposite("A"));
            assertEquals("A", edge.opposite("B"));
            assertThrows(IllegalArgumentException.class, () -> edge.opposite("C"));
        }
    }
}
