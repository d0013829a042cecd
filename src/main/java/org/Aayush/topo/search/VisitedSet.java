package org.Aayush.topo.search;

import java.util.BitSet;

/**
 * Compact set of visited dense indices (nodes or edges), about one bit per element.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe; each search owns its own instance.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param initialCapacity expected number of indices; avoids resizing when set to the element count.
     */
    public VisitedSet(int initialCapacity) {
        this.visited = new BitSet(Math.max(0, initialCapacity));
    }

    /**
     * Marks an index as visited.
     *
     * @return {@code true} if the index was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int index) {
        if (visited.get(index)) {
            return false;
        }
        visited.set(index);
        return true;
    }

    public boolean isVisited(int index) {
        return visited.get(index);
    }

    /**
     * Number of indices marked so far.
     */
    public int count() {
        return visited.cardinality();
    }

    public void clear() {
        visited.clear();
    }
}
