package org.Aayush.topo.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Adapters for the two supported input shapes.
 * <ul>
 * <li>Latency graphs: named services, directed edges weighted by {@code latency_ms}.</li>
 * <li>Connectivity graphs: dense integer node ids {@code 0..max}, undirected edges weighted by
 * {@code weight}. Ids inside that range that no edge references become isolated nodes.</li>
 * </ul>
 * Both produce the same generic {@link Graph}.
 */
@UtilityClass
public final class GraphVariants {

    /**
     * Builds a directed latency graph; parallel edges are permitted.
     *
     * @throws GraphValidationException on invalid input.
     */
    public static Graph<String> latencyGraph(Collection<String> nodes, List<Edge<String>> edges) {
        return GraphBuilder.build(nodes, edges, GraphPolicy.pathAnalysis());
    }

    /**
     * Builds an undirected connectivity graph over node ids {@code 0..max}, where {@code max} is
     * the largest endpoint referenced by {@code edges}. An empty edge list gives an empty graph.
     *
     * @throws IllegalArgumentException if a node id is negative.
     * @throws GraphValidationException on invalid input (self-loops, bad weights, duplicate pairs).
     */
    public static Graph<Integer> connectivityGraph(List<Edge<Integer>> edges) {
        Objects.requireNonNull(edges, "edges");
        int maxId = -1;
        for (Edge<Integer> edge : edges) {
            maxId = Math.max(maxId, Math.max(requireNodeId(edge.source()), requireNodeId(edge.target())));
        }
        IntArrayList nodes = new IntArrayList(maxId + 1);
        for (int id = 0; id <= maxId; id++) {
            nodes.add(id);
        }
        return GraphBuilder.build(nodes, edges, GraphPolicy.connectivity());
    }

    private static int requireNodeId(Integer id) {
        if (id < 0) {
            throw new IllegalArgumentException("node id must be >= 0, got " + id);
        }
        return id;
    }
}
