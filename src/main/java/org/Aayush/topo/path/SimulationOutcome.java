package org.Aayush.topo.path;

/**
 * How a what-if simulation ended.
 */
public enum SimulationOutcome {
    /** Both the original and the modified graph have a path; the latency change is defined. */
    COMPARED,
    /** The original path exists but the modifications disconnected source from target. */
    PATH_REMOVED,
    /** Source and target are already disconnected in the original graph. */
    NO_ORIGINAL_PATH
}
