package org.Aayush.topo.path;

/**
 * Result of comparing a path cost against a latency objective.
 */
public enum SloVerdict {
    /** Path cost is at or below the threshold. */
    MET,
    /** Path cost exceeds the threshold. */
    VIOLATED,
    /** No path exists, so the objective cannot be evaluated. */
    NO_PATH
}
