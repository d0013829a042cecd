package org.Aayush.topo.path;

import org.Aayush.topo.graph.Directedness;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.EdgeKey;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphBuilder;
import org.Aayush.topo.graph.GraphPolicy;
import org.Aayush.topo.graph.GraphQueryException;
import org.Aayush.topo.graph.GraphValidationException;
import org.Aayush.topo.graph.GraphVariants;
import org.Aayush.topo.graph.ViolationKind;
import org.Aayush.topo.testutil.GraphFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Simulation Tests")
class SimulationsTest {

    private final Graph<String> graph = GraphFixtureFactory.serviceGraph();

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("No modifications reproduces the original path")
        void testNoChanges() {
            SimulationResult<String> result = Simulations.simulate(graph, "api", "db", List.of(), List.of());

            assertEquals(SimulationOutcome.COMPARED, result.getOutcome());
            assertEquals(result.getOriginal(), result.getModified());
            assertEquals(0.0, result.getLatencyChange().getAsDouble());
            assertEquals(0, result.getDroppedEdgeCount());
            assertEquals(0, result.getOverriddenEdgeCount());
            assertTrue(result.getUnmatchedOverrides().isEmpty());
        }

        @Test
        @DisplayName("Override reroutes and reports positive latency change")
        void testOverrideReroutes() {
            SimulationResult<String> result = Simulations.simulate(
                    graph, "api", "db", List.of(EdgeOverride.of("auth", "db", 100.0)), List.of());

            assertEquals(8.0, result.getOriginal().getTotalWeight());
            assertEquals(List.of("api", "cache", "db"), result.getModified().getPath());
            assertEquals(9.0, result.getModified().getTotalWeight());
            assertEquals(1.0, result.getLatencyChange().getAsDouble());
            assertEquals(1, result.getOverriddenEdgeCount());
        }

        @Test
        @DisplayName("Override can lower latency")
        void testOverrideImproves() {
            SimulationResult<String> result = Simulations.simulate(
                    graph, "api", "db", List.of(EdgeOverride.of("api", "cache", 1.0)), List.of());
            assertEquals(List.of("api", "cache", "db"), result.getModified().getPath());
            assertEquals(-5.0, result.getLatencyChange().getAsDouble());
        }

        @Test
        @DisplayName("Dropping every route removes the path")
        void testPathRemoved() {
            SimulationResult<String> result = Simulations.simulate(
                    graph, "api", "db", List.of(), List.of(EdgeKey.of("auth", "db"), EdgeKey.of("cache", "db")));

            assertEquals(SimulationOutcome.PATH_REMOVED, result.getOutcome());
            assertTrue(result.isPathRemoved());
            assertTrue(result.getOriginal().isReachable());
            assertFalse(result.getModified().isReachable());
            assertTrue(result.getLatencyChange().isEmpty());
            assertEquals(2, result.getDroppedEdgeCount());
        }

        @Test
        @DisplayName("Missing original path is reported without a latency change")
        void testNoOriginalPath() {
            SimulationResult<String> result = Simulations.simulate(graph, "db", "api", List.of(), List.of());
            assertEquals(SimulationOutcome.NO_ORIGINAL_PATH, result.getOutcome());
            assertTrue(result.getLatencyChange().isEmpty());
        }
    }

    @Nested
    @DisplayName("Modification semantics")
    class Semantics {

        @Test
        @DisplayName("Drop wins over override on the same pair")
        void testDropWins() {
            SimulationResult<String> result = Simulations.simulate(
                    graph, "api", "db",
                    List.of(EdgeOverride.of("auth", "db", 0.0)),
                    List.of(EdgeKey.of("auth", "db"))
            );
            assertEquals(List.of("api", "cache", "db"), result.getModified().getPath());
            assertEquals(1, result.getDroppedEdgeCount());
            assertEquals(0, result.getOverriddenEdgeCount());
            assertEquals(List.of(EdgeOverride.of("auth", "db", 0.0)), result.getUnmatchedOverrides());
            assertFalse(result.getModifiedGraph().edges().contains(Edge.of("auth", "db", 0.0)));
        }

        @Test
        @DisplayName("Override on a missing edge is a no-op and reported")
        void testUnmatchedOverride() {
            SimulationResult<String> result = Simulations.simulate(
                    graph, "api", "db", List.of(EdgeOverride.of("db", "api", 1.0)), List.of());
            assertEquals(result.getOriginal(), result.getModified());
            assertEquals(1, result.getUnmatchedOverrides().size());
            assertEquals(graph.edgeCount(), result.getModifiedGraph().edgeCount());
        }

        @Test
        @DisplayName("Last override on a pair wins")
        void testLastOverrideWins() {
            Graph<String> derived = Simulations.deriveGraph(
                    graph,
                    List.of(EdgeOverride.of("api", "auth", 50.0), EdgeOverride.of("api", "auth", 1.0)),
                    List.of()
            );
            assertTrue(derived.edges().contains(Edge.of("api", "auth", 1.0)));
            assertFalse(derived.edges().contains(Edge.of("api", "auth", 50.0)));
        }

        @Test
        @DisplayName("Override rewrites only the first parallel edge; drop removes them all")
        void testParallelEdges() {
            Graph<String> parallel = GraphVariants.latencyGraph(
                    List.of("a", "b"), List.of(Edge.of("a", "b", 5.0), Edge.of("a", "b", 9.0)));

            SimulationResult<String> result = Simulations.simulate(
                    parallel, "a", "b", List.of(EdgeOverride.of("a", "b", 20.0)), List.of());
            assertEquals(List.of(Edge.of("a", "b", 20.0), Edge.of("a", "b", 9.0)), result.getModifiedGraph().edges());
            assertEquals(1, result.getOverriddenEdgeCount());
            assertTrue(result.getUnmatchedOverrides().isEmpty());
            assertEquals(5.0, result.getOriginal().getTotalWeight());
            assertEquals(9.0, result.getModified().getTotalWeight());
            assertEquals(4.0, result.getLatencyChange().getAsDouble());

            Graph<String> dropped = Simulations.deriveGraph(parallel, List.of(), List.of(EdgeKey.of("a", "b")));
            assertEquals(0, dropped.edgeCount());
            assertEquals(2, dropped.nodeCount());
        }

        @Test
        @DisplayName("Undirected override matches the first edge of the pair in either orientation")
        void testUndirectedParallelFirstMatch() {
            GraphPolicy undirectedMulti = GraphPolicy.builder()
                    .directedness(Directedness.UNDIRECTED)
                    .build();
            Graph<Integer> graph = GraphBuilder.build(
                    List.of(0, 1),
                    List.of(Edge.of(1, 0, 4.0), Edge.of(0, 1, 6.0)),
                    undirectedMulti
            );
            Graph<Integer> derived = Simulations.deriveGraph(graph, List.of(EdgeOverride.of(0, 1, 1.0)), List.of());
            assertEquals(List.of(Edge.of(1, 0, 1.0), Edge.of(0, 1, 6.0)), derived.edges());
        }

        @Test
        @DisplayName("Directed graphs match pairs by orientation")
        void testDirectedOrientation() {
            Graph<String> derived = Simulations.deriveGraph(graph, List.of(), List.of(EdgeKey.of("db", "auth")));
            assertEquals(graph.edges(), derived.edges());
        }

        @Test
        @DisplayName("Undirected graphs match pairs in either orientation")
        void testUndirectedMatching() {
            Graph<Integer> undirected = GraphFixtureFactory.triangle();
            Graph<Integer> derived = Simulations.deriveGraph(
                    undirected,
                    List.of(EdgeOverride.of(0, 2, 9.0)),
                    List.of(EdgeKey.of(1, 0))
            );
            assertEquals(List.of(Edge.of(1, 2, 2.0), Edge.of(2, 0, 9.0)), derived.edges());
        }

        @Test
        @DisplayName("Original graph is never modified")
        void testOriginalUntouched() {
            List<Edge<String>> before = new ArrayList<>(graph.edges());
            Simulations.simulate(graph, "api", "db",
                    List.of(EdgeOverride.of("api", "auth", 42.0)), List.of(EdgeKey.of("cache", "db")));
            assertEquals(before, graph.edges());
            assertEquals(8.0, ShortestPaths.shortestPath(graph, "api", "db").getTotalWeight());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unknown node in override or drop fails before any work")
        void testUnknownNodes() {
            GraphQueryException override = assertThrows(GraphQueryException.class, () -> Simulations.simulate(
                    graph, "api", "db", List.of(EdgeOverride.of("api", "ghost", 1.0)), List.of()));
            assertEquals(GraphQueryException.REASON_UNKNOWN_NODE, override.getReasonCode());

            GraphQueryException drop = assertThrows(GraphQueryException.class, () -> Simulations.simulate(
                    graph, "api", "db", List.of(), List.of(EdgeKey.of("ghost", "db"))));
            assertEquals(GraphQueryException.REASON_UNKNOWN_NODE, drop.getReasonCode());

            assertThrows(GraphQueryException.class, () -> Simulations.simulate(
                    graph, "api", "ghost", List.of(), List.of()));
        }

        @Test
        @DisplayName("Override requires both endpoints")
        void testOverrideNullEndpoint() {
            assertThrows(NullPointerException.class, () -> EdgeOverride.of("api", null, 1.0));
            assertEquals(EdgeOverride.of("a", "b", 2.0), EdgeOverride.of("a", "b", 2.0));
            assertEquals("a:b:2.0", EdgeOverride.of("a", "b", 2.0).toString());
        }

        @Test
        @DisplayName("Invalid override weight fails validation of the derived graph")
        void testInvalidOverrideWeight() {
            GraphValidationException ex = assertThrows(GraphValidationException.class, () -> Simulations.simulate(
                    graph, "api", "db", List.of(EdgeOverride.of("auth", "db", -3.0)), List.of()));
            assertEquals(ViolationKind.INVALID_WEIGHT, ex.firstKind());
        }
    }

    @Test
    @DisplayName("Dropping edges never lowers the shortest-path total")
    void testDropMonotonicity() {
        Random random = new Random(11);
        for (int round = 0; round < 40; round++) {
            Graph<Integer> random6 = GraphFixtureFactory.randomGraph(random, 6, 14, 9, GraphPolicy.pathAnalysis());
            if (random6.edgeCount() == 0) {
                continue;
            }
            Edge<Integer> victim = random6.edge(random.nextInt(random6.edgeCount()));
            SimulationResult<Integer> result = Simulations.simulate(
                    random6, 0, 5, List.of(), List.of(victim.key()));
            assertTrue(result.getModified().getTotalWeight() >= result.getOriginal().getTotalWeight());
        }
    }
}
