package org.Aayush.topo.spanning;

import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphContracts;

/**
 * Kruskal minimum spanning tree / forest over undirected graphs.
 *
 * <p>Edges are ordered by weight, then by canonical {@code (min, max)} endpoint pair, then by
 * input order (stable sort), which makes the selected edge set reproducible when weights tie.</p>
 */
@Log4j2
@UtilityClass
public final class SpanningTrees {
    public static final String KRUSKAL = "kruskal";

    /**
     * Computes the minimum spanning tree, or forest when the graph is disconnected.
     *
     * @param graph undirected graph.
     * @return selected edges, total weight and the spanning flag.
     * @throws org.Aayush.topo.graph.GraphQueryException when the graph is directed.
     */
    public static <N extends Comparable<? super N>> MstResult<N> minimumSpanningTree(Graph<N> graph) {
        GraphContracts.requireUndirected(graph, "minimum spanning tree");

        int nodeCount = graph.nodeCount();
        int[] order = new int[graph.edgeCount()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.mergeSort(order, (a, b) -> compareEdges(graph, a, b));

        DisjointSet components = new DisjointSet(nodeCount);
        MstResult.MstResultBuilder<N> builder = MstResult.<N>builder()
                .algorithm(KRUSKAL)
                .nodeCount(nodeCount);
        int target = Math.max(0, nodeCount - 1);
        int accepted = 0;
        double totalWeight = 0.0d;
        for (int edgeId : order) {
            if (accepted == target) {
                break;
            }
            if (components.union(graph.edgeSourceIndex(edgeId), graph.edgeTargetIndex(edgeId))) {
                builder.edge(graph.edge(edgeId));
                totalWeight += graph.weight(edgeId);
                accepted++;
            }
        }

        boolean spanning = components.componentCount() <= 1;
        if (spanning) {
            log.debug("Kruskal accepted {} of {} edges, total weight {}", accepted, order.length, totalWeight);
        } else {
            log.warn("Graph is disconnected: built spanning forest with {} components, {} edges",
                    components.componentCount(), accepted);
        }
        return builder
                .totalWeight(totalWeight)
                .spanning(spanning)
                .componentCount(components.componentCount())
                .build();
    }

    private static <N extends Comparable<? super N>> int compareEdges(Graph<N> graph, int a, int b) {
        int byWeight = Double.compare(graph.weight(a), graph.weight(b));
        if (byWeight != 0) {
            return byWeight;
        }
        Edge<N> ea = graph.edge(a);
        Edge<N> eb = graph.edge(b);
        int bySource = ea.canonicalSource().compareTo(eb.canonicalSource());
        if (bySource != 0) {
            return bySource;
        }
        return ea.canonicalTarget().compareTo(eb.canonicalTarget());
    }
}
