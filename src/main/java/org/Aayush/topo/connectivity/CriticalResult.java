package org.Aayush.topo.connectivity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.topo.graph.Edge;

import java.util.List;

/**
 * Bridges and articulation points of an undirected graph.
 *
 * <p>Bridges are ordered by canonical {@code (min, max)} endpoint pair, articulation points
 * by natural node order.</p>
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class CriticalResult<N extends Comparable<? super N>> {
    /** Edges whose removal increases the number of connected components. */
    @Singular("bridge")
    List<Edge<N>> bridges;
    /** Nodes whose removal (with incident edges) increases the number of connected components. */
    @Singular("articulationPoint")
    List<N> articulationPoints;

    public int getNumBridges() {
        return bridges.size();
    }

    public int getNumArticulationPoints() {
        return articulationPoints.size();
    }
}
