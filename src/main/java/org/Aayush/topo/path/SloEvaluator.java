package org.Aayush.topo.path;

import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphQueryException;

/**
 * Checks whether the cheapest path between two nodes fits a latency objective.
 */
@Log4j2
@UtilityClass
public final class SloEvaluator {

    /**
     * Evaluates {@code shortestPath(source, target).total <= maxLatency}.
     *
     * @param maxLatency inclusive threshold; must be a non-negative number (may be {@code +INF}).
     * @return verdict with measured total, threshold and the full path.
     * @throws GraphQueryException for unknown nodes or an invalid threshold.
     */
    public static <N extends Comparable<? super N>> SloResult<N> checkSlo(
            Graph<N> graph,
            N source,
            N target,
            double maxLatency
    ) {
        if (Double.isNaN(maxLatency) || maxLatency < 0.0d) {
            throw new GraphQueryException(
                    GraphQueryException.REASON_INVALID_THRESHOLD,
                    "maxLatency must be >= 0, got " + maxLatency
            );
        }
        PathResult<N> path = ShortestPaths.shortestPath(graph, source, target);
        SloVerdict verdict;
        if (!path.isReachable()) {
            verdict = SloVerdict.NO_PATH;
        } else if (path.getTotalWeight() <= maxLatency) {
            verdict = SloVerdict.MET;
        } else {
            verdict = SloVerdict.VIOLATED;
        }
        log.debug("SLO {} -> {}: total={} max={} verdict={}",
                source, target, path.getTotalWeight(), maxLatency, verdict);
        return SloResult.<N>builder()
                .verdict(verdict)
                .measuredTotal(path.getTotalWeight())
                .maxLatency(maxLatency)
                .path(path)
                .build();
    }
}
