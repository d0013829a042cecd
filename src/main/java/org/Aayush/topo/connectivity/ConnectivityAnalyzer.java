package org.Aayush.topo.connectivity;

import lombok.experimental.UtilityClass;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphContracts;
import org.Aayush.topo.spanning.MstResult;
import org.Aayush.topo.spanning.SpanningTrees;

/**
 * Runs spanning-tree and critical-component analysis over the same snapshot.
 */
@UtilityClass
public final class ConnectivityAnalyzer {

    /**
     * @throws org.Aayush.topo.graph.GraphQueryException when the graph is directed.
     */
    public static <N extends Comparable<? super N>> ConnectivityReport<N> analyze(Graph<N> graph) {
        GraphContracts.requireUndirected(graph, "connectivity analysis");
        MstResult<N> mst = SpanningTrees.minimumSpanningTree(graph);
        return ConnectivityReport.<N>builder()
                .mst(mst)
                .critical(CriticalComponents.findCritical(graph))
                .componentCount(mst.getComponentCount())
                .build();
    }
}
