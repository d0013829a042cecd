package org.Aayush.topo.graph;

import lombok.experimental.UtilityClass;
import org.Aayush.topo.core.id.IDMapper;

import java.util.Objects;

/**
 * Shared request checks applied by algorithms before any work starts.
 */
@UtilityClass
public final class GraphContracts {

    /**
     * Resolves a query node to its dense index.
     *
     * @param role name of the argument for diagnostics ("source", "target", ...).
     * @throws GraphQueryException with {@link GraphQueryException#REASON_UNKNOWN_NODE}.
     */
    public static <N extends Comparable<? super N>> int requireNodeIndex(Graph<N> graph, N node, String role) {
        Objects.requireNonNull(graph, "graph");
        if (node == null) {
            throw new GraphQueryException(GraphQueryException.REASON_UNKNOWN_NODE, role + " node is required");
        }
        try {
            return graph.indexOf(node);
        } catch (IDMapper.UnknownIDException ex) {
            throw new GraphQueryException(
                    GraphQueryException.REASON_UNKNOWN_NODE,
                    role + " node not found: " + node,
                    ex
            );
        }
    }

    /**
     * Rejects directed graphs for algorithms defined on undirected graphs only.
     *
     * @throws GraphQueryException with {@link GraphQueryException#REASON_UNDIRECTED_GRAPH_REQUIRED}.
     */
    public static void requireUndirected(Graph<?> graph, String operation) {
        Objects.requireNonNull(graph, "graph");
        if (graph.isDirected()) {
            throw new GraphQueryException(
                    GraphQueryException.REASON_UNDIRECTED_GRAPH_REQUIRED,
                    operation + " requires an undirected graph"
            );
        }
    }
}
