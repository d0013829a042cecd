package org.Aayush.topo.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indexed min-priority queue for node-based Dijkstra searches.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Decrease-Key Support:</strong> each node occupies at most one heap slot; a better
 * distance updates it in place in O(log n) via position tracking.</li>
 * <li><strong>Deterministic ties:</strong> equal distances are ordered by insertion sequence, so the
 * node inserted (or improved) first is extracted first.</li>
 * <li><strong>One state per node:</strong> {@link SearchState} instances are allocated lazily per node
 * index and reused on update.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> not thread-safe. A queue belongs to exactly one search call.</p>
 */
public class SearchQueue {

    // Binary heap, 1-based indexing for parent/child math
    private final SearchState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[nodeIndex] = heap index, 0 means not present
    private final int[] positions;

    // states[nodeIndex], created on first insert
    private final SearchState[] states;

    private long nextSequence = 0;

    /**
     * Creates a queue for node indices {@code 0..nodeCount-1}.
     *
     * @param nodeCount number of addressable nodes; must be non-negative.
     * @throws IllegalArgumentException if nodeCount is negative.
     */
    public SearchQueue(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new SearchState[nodeCount + 1];
        this.positions = new int[nodeCount];
        this.states = new SearchState[nodeCount];
    }

    /**
     * Inserts a node or lowers its distance when it is already queued.
     * <p>
     * An already queued node is only updated when {@code distance} is strictly lower; the update
     * also assigns a fresh insertion sequence. Equal or higher distances are ignored.
     * </p>
     *
     * @param nodeIndex node index (must be &lt; nodeCount).
     * @param distance tentative distance.
     * @param predecessorEdge edge used to reach the node.
     * @return {@code true} when the node was inserted or improved.
     * @throws IllegalArgumentException if nodeIndex is out of bounds.
     */
    public boolean insert(int nodeIndex, double distance, int predecessorEdge) {
        if (nodeIndex < 0 || nodeIndex >= positions.length) {
            throw new IllegalArgumentException("nodeIndex " + nodeIndex + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[nodeIndex];
        if (existingIdx > 0) {
            SearchState existing = heap[existingIdx];
            if (distance < existing.distance) {
                existing.set(nodeIndex, distance, nextSequence++, predecessorEdge);
                swim(existingIdx);
                return true;
            }
            return false;
        }

        SearchState state = states[nodeIndex];
        if (state == null) {
            state = new SearchState();
            states[nodeIndex] = state;
        }
        state.set(nodeIndex, distance, nextSequence++, predecessorEdge);

        size++;
        heap[size] = state;
        positions[nodeIndex] = size;
        swim(size);
        return true;
    }

    /**
     * Extracts the state with minimum distance.
     * <p>
     * The returned instance stays owned by the queue and is overwritten if the same node is
     * inserted again; read its fields before doing so.
     * </p>
     *
     * @return The minimum {@link SearchState}.
     * @throws EmptyQueueException if queue is empty.
     */
    public SearchState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        SearchState min = heap[1];
        SearchState last = heap[size];
        heap[1] = last;
        heap[size] = null;
        size--;
        positions[min.nodeIndex] = 0;

        if (size > 0) {
            positions[last.nodeIndex] = 1;
            sink(1);
        }
        return min;
    }

    /**
     * Returns whether a node currently occupies a heap slot.
     */
    public boolean contains(int nodeIndex) {
        return nodeIndex >= 0 && nodeIndex < positions.length && positions[nodeIndex] > 0;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the queue and resets the insertion sequence.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i].nodeIndex] = 0;
            heap[i] = null;
        }
        size = 0;
        nextSequence = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        SearchState s1 = heap[i];
        SearchState s2 = heap[j];
        heap[i] = s2;
        heap[j] = s1;
        positions[s1.nodeIndex] = j;
        positions[s2.nodeIndex] = i;
    }
}
