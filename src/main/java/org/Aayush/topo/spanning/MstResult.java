package org.Aayush.topo.spanning;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.topo.graph.Edge;

import java.util.List;

/**
 * Minimum spanning tree, or minimum spanning forest when the graph is disconnected.
 *
 * <p>{@code spanning=false} marks a forest: {@code edges} then holds
 * {@code nodeCount - componentCount} edges instead of {@code nodeCount - 1}.</p>
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class MstResult<N extends Comparable<? super N>> {
    /** Algorithm that produced the result. */
    String algorithm;
    /** Selected edges in acceptance order (ascending weight). */
    @Singular("edge")
    List<Edge<N>> edges;
    /** Sum of selected edge weights. */
    double totalWeight;
    /** Whether the selected edges connect every node (a tree, not a forest). */
    boolean spanning;
    /** Number of connected components covered by the forest. */
    int componentCount;
    /** Number of nodes in the input graph. */
    int nodeCount;

    public int getNumEdges() {
        return edges.size();
    }
}
