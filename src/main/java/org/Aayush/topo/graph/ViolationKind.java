package org.Aayush.topo.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Structural problems detected by {@link GraphValidator}, with deterministic reason codes.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum ViolationKind {
    /** The same node identifier was listed twice. */
    DUPLICATE_NODE("GRAPH_DUPLICATE_NODE"),
    /** An edge endpoint is not part of the node set. */
    UNKNOWN_NODE("GRAPH_UNKNOWN_NODE"),
    /** An edge starts and ends at the same node. */
    SELF_LOOP("GRAPH_SELF_LOOP"),
    /** An edge weight is negative, NaN or infinite. */
    INVALID_WEIGHT("GRAPH_INVALID_WEIGHT"),
    /** A second edge connects an already connected pair while parallel edges are disallowed. */
    DUPLICATE_EDGE("GRAPH_DUPLICATE_EDGE");

    private final String reasonCode;
}
