package org.Aayush.topo.path;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.topo.graph.Graph;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Side-by-side shortest paths before and after a set of topology changes.
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class SimulationResult<N extends Comparable<? super N>> {
    /** How the simulation ended. */
    SimulationOutcome outcome;
    /** Shortest path on the unmodified graph. */
    PathResult<N> original;
    /** Shortest path on the derived graph. */
    PathResult<N> modified;
    /** {@code modified.total - original.total}; empty unless {@link SimulationOutcome#COMPARED}. */
    OptionalDouble latencyChange;
    /** Derived graph snapshot the modified path was computed on. */
    Graph<N> modifiedGraph;
    /** Number of edges removed by drops. */
    int droppedEdgeCount;
    /** Number of edges whose weight was replaced. */
    int overriddenEdgeCount;
    /** Overrides that matched no remaining edge and had no effect. */
    @Singular("unmatchedOverride")
    List<EdgeOverride<N>> unmatchedOverrides;

    public boolean isPathRemoved() {
        return outcome == SimulationOutcome.PATH_REMOVED;
    }
}
