package org.Aayush.topo.connectivity;

import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.Aayush.topo.graph.Directedness;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphBuilder;
import org.Aayush.topo.graph.GraphPolicy;
import org.Aayush.topo.graph.GraphQueryException;
import org.Aayush.topo.graph.GraphVariants;
import org.Aayush.topo.testutil.GraphFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Critical Component Tests")
class CriticalComponentsTest {

    private static final GraphPolicy UNDIRECTED_MULTI = GraphPolicy.builder()
            .directedness(Directedness.UNDIRECTED)
            .allowParallelEdges(true)
            .build();

    @Nested
    @DisplayName("Known graphs")
    class KnownGraphs {

        @Test
        @DisplayName("Triangle has no bridges and no articulation points")
        void testTriangle() {
            CriticalResult<Integer> result = CriticalComponents.findCritical(GraphFixtureFactory.triangle());
            assertTrue(result.getBridges().isEmpty());
            assertTrue(result.getArticulationPoints().isEmpty());
        }

        @Test
        @DisplayName("Path graph: every edge is a bridge, every inner node an articulation point")
        void testPath() {
            CriticalResult<Integer> result = CriticalComponents.findCritical(GraphFixtureFactory.pathGraph(4));
            assertEquals(List.of(Edge.of(0, 1, 1.0), Edge.of(1, 2, 1.0), Edge.of(2, 3, 1.0)), result.getBridges());
            assertEquals(List.of(1, 2), result.getArticulationPoints());
            assertEquals(3, result.getNumBridges());
            assertEquals(2, result.getNumArticulationPoints());
        }

        @Test
        @DisplayName("Two triangles joined by one edge")
        void testBowtieBridge() {
            Graph<Integer> graph = GraphVariants.connectivityGraph(List.of(
                    Edge.of(0, 1, 1.0), Edge.of(1, 2, 1.0), Edge.of(2, 0, 1.0),
                    Edge.of(3, 4, 1.0), Edge.of(4, 5, 1.0), Edge.of(5, 3, 1.0),
                    Edge.of(2, 3, 1.0)
            ));
            CriticalResult<Integer> result = CriticalComponents.findCritical(graph);
            assertEquals(List.of(Edge.of(2, 3, 1.0)), result.getBridges());
            assertEquals(List.of(2, 3), result.getArticulationPoints());
        }

        @Test
        @DisplayName("Star center is the only articulation point; root handling")
        void testStar() {
            Graph<Integer> graph = GraphVariants.connectivityGraph(List.of(
                    Edge.of(0, 1, 1.0), Edge.of(0, 2, 1.0), Edge.of(0, 3, 1.0)));
            CriticalResult<Integer> result = CriticalComponents.findCritical(graph);
            assertEquals(List.of(0), result.getArticulationPoints());
            assertEquals(3, result.getNumBridges());
        }

        @Test
        @DisplayName("Bridges are reported by canonical pair order")
        void testBridgeOrdering() {
            Graph<Integer> graph = GraphVariants.connectivityGraph(List.of(
                    Edge.of(9, 3, 1.0), Edge.of(2, 1, 1.0)));
            CriticalResult<Integer> result = CriticalComponents.findCritical(graph);
            assertEquals(List.of(Edge.of(2, 1, 1.0), Edge.of(9, 3, 1.0)), result.getBridges());
            assertTrue(result.getArticulationPoints().isEmpty());
        }

        @Test
        @DisplayName("Parallel edges are never bridges")
        void testParallelEdges() {
            Graph<Integer> graph = GraphBuilder.build(
                    List.of(0, 1, 2),
                    List.of(Edge.of(0, 1, 1.0), Edge.of(1, 0, 2.0), Edge.of(1, 2, 1.0)),
                    UNDIRECTED_MULTI
            );
            CriticalResult<Integer> result = CriticalComponents.findCritical(graph);
            assertEquals(List.of(Edge.of(1, 2, 1.0)), result.getBridges());
            assertEquals(List.of(1), result.getArticulationPoints());
        }

        @Test
        @DisplayName("Directed graphs are rejected")
        void testDirectedRejected() {
            GraphQueryException ex = assertThrows(GraphQueryException.class,
                    () -> CriticalComponents.findCritical(GraphFixtureFactory.serviceGraph()));
            assertEquals(GraphQueryException.REASON_UNDIRECTED_GRAPH_REQUIRED, ex.getReasonCode());
        }

        @Test
        @DisplayName("Empty graph")
        void testEmpty() {
            CriticalResult<Integer> result = CriticalComponents.findCritical(GraphVariants.connectivityGraph(List.of()));
            assertEquals(0, result.getNumBridges());
            assertEquals(0, result.getNumArticulationPoints());
        }
    }

    @Test
    @DisplayName("Bridges and articulation points agree with removal-based component counts")
    void testAgainstRemoval() {
        Random random = new Random(19);
        for (int round = 0; round < 80; round++) {
            GraphPolicy policy = round % 3 == 0 ? UNDIRECTED_MULTI : GraphPolicy.connectivity();
            Graph<Integer> graph = GraphFixtureFactory.randomGraph(random, 3 + random.nextInt(8), 12, 5, policy);
            CriticalResult<Integer> result = CriticalComponents.findCritical(graph);
            int base = ConnectivityScan.countComponents(graph);

            Set<Edge<Integer>> bridges = new HashSet<>(result.getBridges());
            for (int e = 0; e < graph.edgeCount(); e++) {
                IntSet removed = IntSets.singleton(e);
                boolean disconnects = ConnectivityScan.countComponents(graph, removed, IntSets.EMPTY_SET) > base;
                assertEquals(disconnects, bridges.contains(graph.edge(e)), "round " + round + " edge " + graph.edge(e));
            }

            Set<Integer> points = new HashSet<>(result.getArticulationPoints());
            for (int n = 0; n < graph.nodeCount(); n++) {
                IntSet removed = IntSets.singleton(n);
                boolean disconnects = ConnectivityScan.countComponents(graph, IntSets.EMPTY_SET, removed) > base;
                assertEquals(disconnects, points.contains(graph.nodeAt(n)), "round " + round + " node " + n);
            }
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Deep path graph does not overflow the stack")
    void testDeepPath() {
        int n = 100_000;
        CriticalResult<Integer> result = CriticalComponents.findCritical(GraphFixtureFactory.pathGraph(n));
        assertEquals(n - 1, result.getNumBridges());
        assertEquals(n - 2, result.getNumArticulationPoints());
    }
}
