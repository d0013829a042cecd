package org.Aayush.topo.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Dense id translation layer backed by FastUtil.
 * <p>
 * Ids are assigned in iteration order of the source collection, so the mapping is
 * deterministic for a fixed input order. This class is immutable and thread-safe
 * for concurrent reads.
 * </p>
 *
 * @param <N> external identifier type.
 */
public class FastUtilIDMapper<N> implements IDMapper<N> {

    // fastutil map for N -> int (forward lookup), -1 means absent
    private final Object2IntOpenHashMap<N> forward;
    // Reverse lookup by dense index
    private final List<N> reverse;

    /**
     * Constructs the mapper from an ordered collection of distinct identifiers.
     *
     * @throws IllegalArgumentException if the collection is null, holds a null element,
     * or holds the same identifier twice.
     */
    public FastUtilIDMapper(Collection<? extends N> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("Identifiers cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        List<N> ids = new ArrayList<>(size);

        for (N id : orderedIds) {
            if (id == null) {
                throw new IllegalArgumentException("Null identifier at index " + ids.size());
            }
            int previous = forward.putIfAbsent(id, ids.size());
            if (previous != -1) {
                throw new IllegalArgumentException(
                        "Duplicate identifier " + id + " at index " + ids.size() + " (first seen at " + previous + ")"
                );
            }
            ids.add(id);
        }

        this.forward.trim();
        this.reverse = Collections.unmodifiableList(ids);
    }

    @Override
    public int toInternal(N externalId) throws UnknownIDException {
        if (externalId == null) {
            throw new IllegalArgumentException("External ID cannot be null");
        }
        int id = forward.getInt(externalId);
        if (id == -1) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public N toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse.get(internalId);
    }

    @Override
    public boolean containsExternal(N externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.size();
    }

    @Override
    public int size() {
        return reverse.size();
    }

    @Override
    public List<N> externalIds() {
        return reverse;
    }
}
