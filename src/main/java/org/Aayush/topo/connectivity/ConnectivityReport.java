package org.Aayush.topo.connectivity;

import lombok.Builder;
import lombok.Value;
import org.Aayush.topo.spanning.MstResult;

/**
 * Full connectivity analysis of one undirected graph.
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class ConnectivityReport<N extends Comparable<? super N>> {
    /** Minimum spanning tree or forest. */
    MstResult<N> mst;
    /** Bridges and articulation points. */
    CriticalResult<N> critical;
    /** Number of connected components. */
    int componentCount;
}
