package org.Aayush.topo.path;

import lombok.Value;
import lombok.experimental.Accessors;
import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.EdgeKey;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphBuilder;
import org.Aayush.topo.graph.GraphContracts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * What-if topology simulation: edge drops and weight overrides.
 *
 * <p>Modification contract:</p>
 * <ul>
 * <li>A drop removes every edge between its endpoint pair.</li>
 * <li>An override replaces the weight of the first remaining edge between its pair, in edge input
 * order; further parallel edges keep their weight. It never inserts an edge. An override that
 * matches nothing is a no-op and is reported back.</li>
 * <li>A drop always wins over an override on the same pair, independent of argument order.</li>
 * <li>Several overrides on one pair: the last one wins.</li>
 * <li>Undirected graphs match pairs regardless of orientation.</li>
 * </ul>
 * <p>The input graph is never modified; a new snapshot is built and validated through
 * {@link GraphBuilder}, so an invalid override weight fails with
 * {@link org.Aayush.topo.graph.GraphValidationException}.</p>
 */
@Log4j2
@UtilityClass
public final class Simulations {

    /**
     * Builds the modified graph snapshot.
     *
     * @throws org.Aayush.topo.graph.GraphQueryException when a drop/override names an unknown node.
     * @throws org.Aayush.topo.graph.GraphValidationException when an override weight is invalid.
     */
    public static <N extends Comparable<? super N>> Graph<N> deriveGraph(
            Graph<N> graph,
            Collection<EdgeOverride<N>> overrides,
            Collection<EdgeKey<N>> drops
    ) {
        return derive(graph, overrides, drops).graph();
    }

    /**
     * Runs the shortest-path query on the original and on the modified graph.
     *
     * @return both paths, the outcome and, when both exist, the latency change.
     * @throws org.Aayush.topo.graph.GraphQueryException when source/target or a modification names an unknown node.
     * @throws org.Aayush.topo.graph.GraphValidationException when an override weight is invalid.
     */
    public static <N extends Comparable<? super N>> SimulationResult<N> simulate(
            Graph<N> graph,
            N source,
            N target,
            Collection<EdgeOverride<N>> overrides,
            Collection<EdgeKey<N>> drops
    ) {
        PathResult<N> original = ShortestPaths.shortestPath(graph, source, target);
        Derivation<N> derivation = derive(graph, overrides, drops);
        PathResult<N> modified = ShortestPaths.shortestPath(derivation.graph(), source, target);

        SimulationOutcome outcome;
        OptionalDouble latencyChange = OptionalDouble.empty();
        if (!original.isReachable()) {
            outcome = SimulationOutcome.NO_ORIGINAL_PATH;
        } else if (!modified.isReachable()) {
            outcome = SimulationOutcome.PATH_REMOVED;
        } else {
            outcome = SimulationOutcome.COMPARED;
            latencyChange = OptionalDouble.of(modified.getTotalWeight() - original.getTotalWeight());
        }
        log.debug("Simulation {} -> {}: outcome={} original={} modified={}",
                source, target, outcome, original.getTotalWeight(), modified.getTotalWeight());

        return SimulationResult.<N>builder()
                .outcome(outcome)
                .original(original)
                .modified(modified)
                .latencyChange(latencyChange)
                .modifiedGraph(derivation.graph())
                .droppedEdgeCount(derivation.droppedEdgeCount())
                .overriddenEdgeCount(derivation.overriddenEdgeCount())
                .unmatchedOverrides(derivation.unmatchedOverrides())
                .build();
    }

    private static <N extends Comparable<? super N>> Derivation<N> derive(
            Graph<N> graph,
            Collection<EdgeOverride<N>> overrides,
            Collection<EdgeKey<N>> drops
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(drops, "drops");
        boolean directed = graph.isDirected();

        Set<EdgeKey<N>> dropKeys = new HashSet<>();
        for (EdgeKey<N> drop : drops) {
            requireKnownEndpoints(graph, drop, "drop");
            dropKeys.add(normalize(drop, directed));
        }
        Map<EdgeKey<N>, EdgeOverride<N>> overrideByKey = new LinkedHashMap<>();
        for (EdgeOverride<N> override : overrides) {
            requireKnownEndpoints(graph, override.key(), "override");
            EdgeKey<N> key = normalize(override.key(), directed);
            overrideByKey.remove(key);
            overrideByKey.put(key, override);
        }

        List<Edge<N>> kept = new ArrayList<>(graph.edgeCount());
        Set<EdgeKey<N>> matchedOverrides = new HashSet<>();
        int dropped = 0;
        int overridden = 0;
        for (Edge<N> edge : graph.edges()) {
            EdgeKey<N> key = normalize(edge.key(), directed);
            if (dropKeys.contains(key)) {
                dropped++;
                continue;
            }
            EdgeOverride<N> override = overrideByKey.get(key);
            if (override != null && matchedOverrides.add(key)) {
                kept.add(edge.withWeight(override.weight()));
                overridden++;
            } else {
                kept.add(edge);
            }
        }

        List<EdgeOverride<N>> unmatched = new ArrayList<>();
        for (Map.Entry<EdgeKey<N>, EdgeOverride<N>> entry : overrideByKey.entrySet()) {
            if (!matchedOverrides.contains(entry.getKey())) {
                unmatched.add(entry.getValue());
                if (dropKeys.contains(entry.getKey())) {
                    log.warn("Override {} ignored: edge {} is dropped", entry.getValue(), entry.getKey());
                } else {
                    log.warn("Override {} ignored: no edge {} in graph", entry.getValue(), entry.getKey());
                }
            }
        }

        Graph<N> derived = GraphBuilder.rebuild(graph, kept);
        return new Derivation<>(derived, dropped, overridden, unmatched);
    }

    private static <N extends Comparable<? super N>> void requireKnownEndpoints(
            Graph<N> graph,
            EdgeKey<N> key,
            String role
    ) {
        GraphContracts.requireNodeIndex(graph, key.source(), role + " source");
        GraphContracts.requireNodeIndex(graph, key.target(), role + " target");
    }

    private static <N extends Comparable<? super N>> EdgeKey<N> normalize(EdgeKey<N> key, boolean directed) {
        return directed ? key : key.canonical();
    }

    @Value
    @Accessors(fluent = true)
    private static class Derivation<N extends Comparable<? super N>> {
        Graph<N> graph;
        int droppedEdgeCount;
        int overriddenEdgeCount;
        List<EdgeOverride<N>> unmatchedOverrides;
    }
}
