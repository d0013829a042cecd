package org.Aayush.topo.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.topo.core.id.IDMapper;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable weighted graph snapshot shared by every analysis.
 * <p>
 * Nodes are mapped once to dense indices {@code 0..nodeCount-1} (insertion order) and
 * edges keep their input order as edge ids {@code 0..edgeCount-1}. Adjacency is stored
 * in CSR form as a list of <em>arcs</em>:
 * </p>
 * <ul>
 * <li>directed graph: one arc per edge, listed under its source node.</li>
 * <li>undirected graph: two arcs per edge, one under each endpoint.</li>
 * </ul>
 * <p>
 * Within one node the arcs follow edge input order, which keeps every traversal
 * deterministic. Instances are built by {@link GraphBuilder} and never change afterwards;
 * derived graphs (simulation) are new instances.
 * </p>
 *
 * @param <N> node identifier type.
 */
public final class Graph<N extends Comparable<? super N>> {

    private final IDMapper<N> nodeIds;
    @Getter
    @Accessors(fluent = true)
    private final GraphPolicy policy;
    private final List<Edge<N>> edges;

    // Edge properties (SoA)
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final double[] weights;

    // CSR index: firstArc[node] -> start index in arc arrays
    private final int[] firstArc;
    private final int[] arcEdge;
    private final int[] arcNeighbor;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    Graph(IDMapper<N> nodeIds, GraphPolicy policy, List<Edge<N>> edges) {
        this.nodeIds = nodeIds;
        this.policy = policy;
        this.edges = List.copyOf(edges);
        this.nodeCount = nodeIds.size();
        this.edgeCount = this.edges.size();

        this.edgeSource = new int[edgeCount];
        this.edgeTarget = new int[edgeCount];
        this.weights = new double[edgeCount];

        boolean undirected = !policy.isDirected();
        int[] degree = new int[nodeCount];
        for (int e = 0; e < edgeCount; e++) {
            Edge<N> edge = this.edges.get(e);
            int u = nodeIds.toInternal(edge.source());
            int v = nodeIds.toInternal(edge.target());
            edgeSource[e] = u;
            edgeTarget[e] = v;
            weights[e] = edge.weight();
            degree[u]++;
            if (undirected) {
                degree[v]++;
            }
        }

        this.firstArc = new int[nodeCount + 1];
        for (int n = 0; n < nodeCount; n++) {
            firstArc[n + 1] = firstArc[n] + degree[n];
        }
        int arcCount = firstArc[nodeCount];
        this.arcEdge = new int[arcCount];
        this.arcNeighbor = new int[arcCount];

        int[] cursor = new int[nodeCount];
        System.arraycopy(firstArc, 0, cursor, 0, nodeCount);
        for (int e = 0; e < edgeCount; e++) {
            int u = edgeSource[e];
            int v = edgeTarget[e];
            int arc = cursor[u]++;
            arcEdge[arc] = e;
            arcNeighbor[arc] = v;
            if (undirected) {
                arc = cursor[v]++;
                arcEdge[arc] = e;
                arcNeighbor[arc] = u;
            }
        }
    }

    // ========================================================================
    // NODES
    // ========================================================================

    public Directedness directedness() {
        return policy.getDirectedness();
    }

    public boolean isDirected() {
        return policy.isDirected();
    }

    /**
     * Returns node identifiers in dense-index order.
     */
    public List<N> nodes() {
        return nodeIds.externalIds();
    }

    public boolean containsNode(N node) {
        return nodeIds.containsExternal(node);
    }

    /**
     * Resolves a node identifier to its dense index.
     *
     * @throws IDMapper.UnknownIDException if the node is not part of this graph.
     */
    public int indexOf(N node) {
        return nodeIds.toInternal(node);
    }

    public N nodeAt(int nodeIndex) {
        return nodeIds.toExternal(nodeIndex);
    }

    /**
     * Number of arcs incident to (undirected) or leaving (directed) a node.
     */
    public int degree(int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeIndex + " out of bounds");
        }
        return firstArc[nodeIndex + 1] - firstArc[nodeIndex];
    }

    // ========================================================================
    // EDGES (O(1))
    // ========================================================================

    /**
     * Returns all edges in input order.
     */
    public List<Edge<N>> edges() {
        return edges;
    }

    public Edge<N> edge(int edgeId) {
        return edges.get(edgeId);
    }

    /**
     * UNCHECKED - caller must ensure edgeId is valid.
     */
    public int edgeSourceIndex(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeSource[edgeId];
    }

    public int edgeTargetIndex(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    public double weight(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return weights[edgeId];
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    public int arcEdge(int arc) {
        return arcEdge[arc];
    }

    public int arcNeighbor(int arc) {
        return arcNeighbor[arc];
    }

    public int firstArc(int nodeIndex) {
        return firstArc[nodeIndex];
    }

    public int endArc(int nodeIndex) {
        return firstArc[nodeIndex + 1];
    }

    /**
     * Returns a reusable arc iterator.
     */
    public ArcIterator iterator() {
        return new ArcIterator(this);
    }

    /**
     * Reusable cursor over the arcs of one node.
     */
    public static final class ArcIterator {
        private final Graph<?> graph;
        private int current;
        private int end;

        ArcIterator(Graph<?> graph) {
            this.graph = graph;
        }

        /**
         * Resets iterator to traverse arcs of a specific node.
         */
        public ArcIterator resetForNode(int nodeIndex) {
            this.current = graph.firstArc[nodeIndex];
            this.end = graph.firstArc[nodeIndex + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        /**
         * Returns the next arc index.
         */
        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return current++;
        }
    }

    @Override
    public String toString() {
        return String.format("Graph[%s, nodes=%d, edges=%d, parallelEdges=%b]",
                directedness(), nodeCount, edgeCount, policy.isAllowParallelEdges());
    }
}
