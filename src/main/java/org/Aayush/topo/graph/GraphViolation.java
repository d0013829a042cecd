package org.Aayush.topo.graph;

import lombok.Value;

/**
 * One validation finding against graph input.
 */
@Value
public class GraphViolation {
    /** Kind of violation. */
    ViolationKind kind;
    /** Index of the offending edge in the input edge list, or {@code -1} for node-level findings. */
    int edgeIndex;
    /** Offending edge, or {@code null} for node-level findings. */
    Edge<?> edge;
    /** Human-readable diagnostic. */
    String message;

    static GraphViolation ofNode(ViolationKind kind, String message) {
        return new GraphViolation(kind, -1, null, message);
    }

    static GraphViolation ofEdge(ViolationKind kind, int edgeIndex, Edge<?> edge, String message) {
        return new GraphViolation(kind, edgeIndex, edge, message);
    }

    @Override
    public String toString() {
        return "[" + kind.reasonCode() + "] " + message;
    }
}
