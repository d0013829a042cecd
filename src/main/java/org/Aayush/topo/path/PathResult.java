package org.Aayush.topo.path;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.topo.graph.Edge;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one shortest-path query.
 *
 * <p>When {@code reachable=false}, {@code path} and {@code edges} are empty, {@code totalWeight}
 * is {@code +INF} and there is no bottleneck. A query with {@code source == target} is reachable
 * with a single-node path, weight {@code 0} and no bottleneck.</p>
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class PathResult<N extends Comparable<? super N>> {
    /** Query source node. */
    N source;
    /** Query target node. */
    N target;
    /** Whether the target can be reached from the source. */
    boolean reachable;
    /** Nodes from source to target, inclusive. */
    @Singular("pathNode")
    List<N> path;
    /** Traversed edges in path order, oriented in travel direction. */
    @Singular("pathEdge")
    List<Edge<N>> edges;
    /** Sum of traversed edge weights. */
    double totalWeight;
    /** Highest-weight edge on the path; first one wins ties. {@code null} when the path has no edges. */
    Edge<N> bottleneck;

    /**
     * Creates the canonical unreachable result.
     */
    public static <N extends Comparable<? super N>> PathResult<N> unreachable(N source, N target) {
        return PathResult.<N>builder()
                .source(source)
                .target(target)
                .reachable(false)
                .totalWeight(Double.POSITIVE_INFINITY)
                .build();
    }

    public Optional<Edge<N>> bottleneckEdge() {
        return Optional.ofNullable(bottleneck);
    }

    /**
     * Number of edges on the path.
     */
    public int hopCount() {
        return edges.size();
    }
}
