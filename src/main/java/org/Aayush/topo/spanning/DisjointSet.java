package org.Aayush.topo.spanning;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Union-Find over dense indices {@code 0..size-1}.
 * <p>
 * Uses path compression (iterative, no recursion depth limit) and union by size,
 * giving near-constant amortized cost per operation.
 * </p>
 * <p><strong>Thread Safety:</strong> not thread-safe; owned by a single algorithm call.</p>
 */
public final class DisjointSet {
    private final int[] parent;
    private final int[] setSize;

    /** Number of disjoint sets currently tracked. */
    @Getter
    @Accessors(fluent = true)
    private int componentCount;

    /**
     * Creates {@code size} singleton sets.
     */
    public DisjointSet(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative");
        }
        this.parent = new int[size];
        this.setSize = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            setSize[i] = 1;
        }
        this.componentCount = size;
    }

    /**
     * Returns the representative of the set containing {@code v}.
     *
     * @throws IndexOutOfBoundsException if {@code v} is not a valid element.
     */
    public int find(int v) {
        checkBounds(v);
        int root = v;
        while (parent[root] != root) {
            root = parent[root];
        }
        // compress
        while (parent[v] != root) {
            int next = parent[v];
            parent[v] = root;
            v = next;
        }
        return root;
    }

    /**
     * Merges the sets containing {@code a} and {@code b}.
     *
     * @return {@code true} if they were in different sets and have been merged.
     */
    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (setSize[ra] >= setSize[rb]) {
            parent[rb] = ra;
            setSize[ra] += setSize[rb];
        } else {
            parent[ra] = rb;
            setSize[rb] += setSize[ra];
        }
        componentCount--;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * Number of elements in the set containing {@code v}.
     */
    public int setSize(int v) {
        return setSize[find(v)];
    }

    public int size() {
        return parent.length;
    }

    private void checkBounds(int v) {
        if (v < 0 || v >= parent.length) {
            throw new IndexOutOfBoundsException(v + " not in bounds [0, " + parent.length + ")");
        }
    }
}
