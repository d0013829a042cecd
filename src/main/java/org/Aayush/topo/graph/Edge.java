package org.Aayush.topo.graph;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * One weighted edge of a {@link Graph}.
 *
 * <p>In a directed graph the edge runs {@code source -> target}. In an undirected graph
 * the pair is unordered; {@link #canonicalSource()} and {@link #canonicalTarget()} give the
 * stable {@code (min, max)} orientation used for ordering and matching.</p>
 *
 * @param <N> node identifier type.
 */
@Value
@Accessors(fluent = true)
public class Edge<N extends Comparable<? super N>> {
    /** Source endpoint. */
    N source;
    /** Target endpoint. */
    N target;
    /** Non-negative finite weight (latency in milliseconds for latency graphs). */
    double weight;

    private Edge(N source, N target, double weight) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.weight = weight;
    }

    /**
     * Creates an edge; the weight is checked when a graph is built from it.
     *
     * @throws NullPointerException if either endpoint is null.
     */
    public static <N extends Comparable<? super N>> Edge<N> of(N source, N target, double weight) {
        return new Edge<>(source, target, weight);
    }

    public N canonicalSource() {
        return source.compareTo(target) <= 0 ? source : target;
    }

    public N canonicalTarget() {
        return source.compareTo(target) <= 0 ? target : source;
    }

    /**
     * Returns the endpoint pair of this edge.
     */
    public EdgeKey<N> key() {
        return EdgeKey.of(source, target);
    }

    /**
     * Returns a copy of this edge carrying a different weight.
     */
    public Edge<N> withWeight(double newWeight) {
        return new Edge<>(source, target, newWeight);
    }

    @Override
    public String toString() {
        return source + "->" + target + "(" + weight + ")";
    }
}
