package org.Aayush.topo.path;

import lombok.Value;
import lombok.experimental.Accessors;
import org.Aayush.topo.graph.EdgeKey;

import java.util.Objects;

/**
 * Replacement weight for the first existing edge between one endpoint pair.
 *
 * @param <N> node identifier type.
 */
@Value
@Accessors(fluent = true)
public class EdgeOverride<N extends Comparable<? super N>> {
    /** Endpoint pair. */
    EdgeKey<N> key;
    /** New weight; validated when the derived graph is built. */
    double weight;

    private EdgeOverride(EdgeKey<N> key, double weight) {
        this.key = Objects.requireNonNull(key, "key");
        this.weight = weight;
    }

    public static <N extends Comparable<? super N>> EdgeOverride<N> of(N source, N target, double weight) {
        return new EdgeOverride<>(EdgeKey.of(source, target), weight);
    }

    @Override
    public String toString() {
        return key + ":" + weight;
    }
}
