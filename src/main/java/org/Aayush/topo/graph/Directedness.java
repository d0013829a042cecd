package org.Aayush.topo.graph;

/**
 * Edge orientation of a {@link Graph}.
 */
public enum Directedness {
    /** {@code (a->b)} and {@code (b->a)} are distinct edges. */
    DIRECTED,
    /** Each edge is an unordered pair traversable from both endpoints. */
    UNDIRECTED
}
