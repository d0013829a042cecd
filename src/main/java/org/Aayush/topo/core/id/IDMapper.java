package org.Aayush.topo.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;
import java.util.List;

/**
 * Bidirectional mapping contract between external node identifiers and internal dense integer ids.
 *
 * @param <N> external node identifier type.
 */
public interface IDMapper<N> {

    /**
     * Converts an external identifier to an internal integer index.
     * @param externalId The client-facing identifier.
     * @return The internal integer index.
     * @throws UnknownIDException If the identifier is not mapped.
     * @throws IllegalArgumentException If the identifier is null.
     */
    int toInternal(N externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external identifier.
     * @param internalId The internal engine index.
     * @return The client-facing identifier.
     * @throws IndexOutOfBoundsException If the internal id is invalid.
     */
    N toExternal(int internalId);

    /**
     * Checks whether an external id has a mapped internal id.
     *
     * @param externalId external id to test.
     * @return true when the external id is present.
     */
    boolean containsExternal(N externalId);

    /**
     * Checks whether an internal id is within mapper bounds.
     *
     * @param internalId internal id to test.
     * @return true when the internal id is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Returns external identifiers in internal-id order.
     *
     * @return immutable list where element {@code i} maps to internal id {@code i}.
     */
    List<N> externalIds();

    /**
     * Exception thrown when an external ID cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param orderedIds distinct identifiers; the i-th element receives internal id {@code i}.
     * @param <N> identifier type.
     * @return An immutable IDMapper instance.
     */
    static <N> IDMapper<N> createImmutable(Collection<? extends N> orderedIds) {
        return new FastUtilIDMapper<>(orderedIds);
    }
}
