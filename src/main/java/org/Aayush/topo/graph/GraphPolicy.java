package org.Aayush.topo.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Construction policy for one {@link Graph} snapshot.
 */
@Value
@Builder
public class GraphPolicy {
    /**
     * Edge orientation of the built graph.
     */
    @Builder.Default
    Directedness directedness = Directedness.DIRECTED;

    /**
     * Whether more than one edge may connect the same (ordered or unordered) endpoint pair.
     * When false, every repeat is reported as {@link ViolationKind#DUPLICATE_EDGE}.
     */
    @Builder.Default
    boolean allowParallelEdges = true;

    /**
     * Policy for service-latency graphs: directed, multi-edges permitted.
     */
    public static GraphPolicy pathAnalysis() {
        return GraphPolicy.builder()
                .directedness(Directedness.DIRECTED)
                .allowParallelEdges(true)
                .build();
    }

    /**
     * Policy for connectivity graphs: undirected, multi-edges rejected.
     */
    public static GraphPolicy connectivity() {
        return GraphPolicy.builder()
                .directedness(Directedness.UNDIRECTED)
                .allowParallelEdges(false)
                .build();
    }

    public boolean isDirected() {
        return directedness == Directedness.DIRECTED;
    }
}
