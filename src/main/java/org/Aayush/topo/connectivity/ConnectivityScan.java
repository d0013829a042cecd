package org.Aayush.topo.connectivity;

import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import lombok.experimental.UtilityClass;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.spanning.DisjointSet;

import java.util.Objects;

/**
 * Connected-component counting, optionally with edges or nodes removed.
 *
 * <p>Directed graphs are counted by weak connectivity (edge orientation ignored).</p>
 */
@UtilityClass
public final class ConnectivityScan {

    /**
     * Number of connected components of the whole graph.
     */
    public static int countComponents(Graph<?> graph) {
        return countComponents(graph, IntSets.EMPTY_SET, IntSets.EMPTY_SET);
    }

    /**
     * Number of connected components after removing some edges and nodes.
     *
     * <p>Removed nodes are not counted as components and take their incident edges with them.</p>
     *
     * @param excludedEdgeIds edge ids to ignore.
     * @param excludedNodeIndices dense node indices to ignore.
     */
    public static int countComponents(Graph<?> graph, IntSet excludedEdgeIds, IntSet excludedNodeIndices) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(excludedEdgeIds, "excludedEdgeIds");
        Objects.requireNonNull(excludedNodeIndices, "excludedNodeIndices");

        DisjointSet components = new DisjointSet(graph.nodeCount());
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            if (excludedEdgeIds.contains(edgeId)) {
                continue;
            }
            int u = graph.edgeSourceIndex(edgeId);
            int v = graph.edgeTargetIndex(edgeId);
            if (excludedNodeIndices.contains(u) || excludedNodeIndices.contains(v)) {
                continue;
            }
            components.union(u, v);
        }

        int removedNodes = 0;
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (excludedNodeIndices.contains(node)) {
                removedNodes++;
            }
        }
        return components.componentCount() - removedNodes;
    }

    public static boolean isConnected(Graph<?> graph) {
        return countComponents(graph) <= 1;
    }
}
