package org.Aayush.topo.graph;

import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Endpoint pair identifying edges independent of weight.
 *
 * @param <N> node identifier type.
 */
@Value
@Accessors(fluent = true)
public class EdgeKey<N extends Comparable<? super N>> {
    N source;
    N target;

    private EdgeKey(N source, N target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static <N extends Comparable<? super N>> EdgeKey<N> of(N source, N target) {
        return new EdgeKey<>(source, target);
    }

    /**
     * Returns the pair in {@code (min, max)} order.
     */
    public EdgeKey<N> canonical() {
        return source.compareTo(target) <= 0 ? this : new EdgeKey<>(target, source);
    }

    @Override
    public String toString() {
        return source + ":" + target;
    }
}
