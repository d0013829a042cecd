package org.Aayush.topo.connectivity;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphContracts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Bridge and articulation-point detection (Tarjan low-link) in one depth-first pass.
 *
 * <p>The DFS runs on an explicit stack. Each frame is a node plus two per-node cursors: the next
 * arc to inspect and the tree edge it was entered through. Call depth therefore stays constant
 * even on path-shaped graphs with hundreds of thousands of nodes.</p>
 *
 * <p>Only the exact tree edge back to the parent is skipped. A parallel edge to the parent is a
 * back edge and lowers the child's low-link, so doubled connections are never bridges.</p>
 */
@Log4j2
@UtilityClass
public final class CriticalComponents {
    private static final int UNVISITED = -1;
    private static final int NO_EDGE = -1;

    /**
     * Finds all bridges and articulation points; disconnected graphs are handled per component.
     *
     * @param graph undirected graph.
     * @throws org.Aayush.topo.graph.GraphQueryException when the graph is directed.
     */
    public static <N extends Comparable<? super N>> CriticalResult<N> findCritical(Graph<N> graph) {
        GraphContracts.requireUndirected(graph, "critical component detection");

        int nodeCount = graph.nodeCount();
        int[] discovery = new int[nodeCount];
        Arrays.fill(discovery, UNVISITED);
        int[] low = new int[nodeCount];
        int[] parentEdge = new int[nodeCount];
        int[] nextArc = new int[nodeCount];
        int[] stack = new int[nodeCount];
        boolean[] articulation = new boolean[nodeCount];
        IntArrayList bridgeEdges = new IntArrayList();

        int time = 0;
        for (int root = 0; root < nodeCount; root++) {
            if (discovery[root] != UNVISITED) {
                continue;
            }
            int rootChildren = 0;
            int top = 0;
            discovery[root] = low[root] = time++;
            parentEdge[root] = NO_EDGE;
            nextArc[root] = graph.firstArc(root);
            stack[top++] = root;

            while (top > 0) {
                int node = stack[top - 1];
                if (nextArc[node] < graph.endArc(node)) {
                    int arc = nextArc[node]++;
                    int edgeId = graph.arcEdge(arc);
                    if (edgeId == parentEdge[node]) {
                        continue;
                    }
                    int neighbor = graph.arcNeighbor(arc);
                    if (discovery[neighbor] == UNVISITED) {
                        discovery[neighbor] = low[neighbor] = time++;
                        parentEdge[neighbor] = edgeId;
                        nextArc[neighbor] = graph.firstArc(neighbor);
                        stack[top++] = neighbor;
                        if (node == root) {
                            rootChildren++;
                        }
                    } else {
                        low[node] = Math.min(low[node], discovery[neighbor]);
                    }
                    continue;
                }

                // all arcs done: retire frame and propagate to parent
                top--;
                if (top == 0) {
                    break;
                }
                int parent = stack[top - 1];
                low[parent] = Math.min(low[parent], low[node]);
                if (low[node] > discovery[parent]) {
                    bridgeEdges.add(parentEdge[node]);
                }
                if (parent != root && low[node] >= discovery[parent]) {
                    articulation[parent] = true;
                }
            }
            if (rootChildren > 1) {
                articulation[root] = true;
            }
        }

        List<Edge<N>> bridges = new ArrayList<>(bridgeEdges.size());
        for (int i = 0; i < bridgeEdges.size(); i++) {
            bridges.add(graph.edge(bridgeEdges.getInt(i)));
        }
        bridges.sort(Comparator.comparing((Edge<N> e) -> e.canonicalSource())
                .thenComparing((Edge<N> e) -> e.canonicalTarget()));

        List<N> articulationPoints = new ArrayList<>();
        for (int n = 0; n < nodeCount; n++) {
            if (articulation[n]) {
                articulationPoints.add(graph.nodeAt(n));
            }
        }
        articulationPoints.sort(Comparator.naturalOrder());

        log.debug("Critical scan visited {} nodes: {} bridges, {} articulation points",
                time, bridges.size(), articulationPoints.size());
        return CriticalResult.<N>builder()
                .bridges(bridges)
                .articulationPoints(articulationPoints)
                .build();
    }
}
