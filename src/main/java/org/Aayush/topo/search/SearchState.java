package org.Aayush.topo.search;

/**
 * Mutable frontier entry of a node-based shortest-path search.
 * <p>
 * One instance exists per node index inside a {@link SearchQueue} and is reused when
 * the node's tentative distance decreases.
 * </p>
 */
public class SearchState implements Comparable<SearchState> {

    /** Dense index of the node this state belongs to. */
    public int nodeIndex;

    /** Tentative distance from the source. */
    public double distance;

    /** Insertion sequence; lower means inserted (or last improved) earlier. */
    public long sequence;

    /** Edge id used to reach this node, or {@code -1} for the source. */
    public int predecessorEdge;

    public SearchState() {
    }

    /**
     * Re-initializes the state with new values.
     */
    public void set(int nodeIndex, double distance, long sequence, int predecessorEdge) {
        this.nodeIndex = nodeIndex;
        this.distance = distance;
        this.sequence = sequence;
        this.predecessorEdge = predecessorEdge;
    }

    /**
     * Orders by distance, then by insertion sequence (first inserted wins ties).
     */
    @Override
    public int compareTo(SearchState other) {
        int distanceCompare = Double.compare(this.distance, other.distance);
        if (distanceCompare != 0) {
            return distanceCompare;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "node=" + nodeIndex +
                ", distance=" + distance +
                ", seq=" + sequence +
                ", pred=" + predecessorEdge +
                '}';
    }
}
