package org.Aayush.topo.path;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one SLO check.
 *
 * @param <N> node identifier type.
 */
@Value
@Builder
public class SloResult<N extends Comparable<? super N>> {
    /** Verdict of the check. */
    SloVerdict verdict;
    /** Measured total path cost ({@code +INF} when there is no path). */
    double measuredTotal;
    /** Maximum acceptable total cost. */
    double maxLatency;
    /** Shortest path the verdict was computed from. */
    PathResult<N> path;

    public boolean isMet() {
        return verdict == SloVerdict.MET;
    }

    public boolean isPathFound() {
        return verdict != SloVerdict.NO_PATH;
    }
}
