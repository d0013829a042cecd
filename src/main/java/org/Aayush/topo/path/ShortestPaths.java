package org.Aayush.topo.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.graph.Edge;
import org.Aayush.topo.graph.Graph;
import org.Aayush.topo.graph.GraphContracts;
import org.Aayush.topo.search.SearchQueue;
import org.Aayush.topo.search.SearchState;
import org.Aayush.topo.search.VisitedSet;

import java.util.Arrays;

/**
 * Point-to-point Dijkstra search with bottleneck identification.
 *
 * <p>Priority is the tentative distance; equal distances are settled in insertion order.
 * Relaxation is strict, so among parallel edges the cheaper one is kept and among
 * equal-cost alternatives the first discovered survives. The search stops as soon as
 * the target is settled.</p>
 *
 * <p>All working state (distances, predecessor edges, frontier, settled set) is created
 * per call, so concurrent queries over the same graph are safe.</p>
 */
@Log4j2
@UtilityClass
public final class ShortestPaths {
    private static final int NO_EDGE = -1;

    /**
     * Computes the cheapest path from {@code source} to {@code target}.
     *
     * @param graph graph snapshot (directed or undirected).
     * @param source source node.
     * @param target target node.
     * @return path result; {@code reachable=false} when no path exists.
     * @throws org.Aayush.topo.graph.GraphQueryException when either node is not in the graph.
     */
    public static <N extends Comparable<? super N>> PathResult<N> shortestPath(Graph<N> graph, N source, N target) {
        int sourceIndex = GraphContracts.requireNodeIndex(graph, source, "source");
        int targetIndex = GraphContracts.requireNodeIndex(graph, target, "target");

        if (sourceIndex == targetIndex) {
            return PathResult.<N>builder()
                    .source(source)
                    .target(target)
                    .reachable(true)
                    .pathNode(source)
                    .totalWeight(0.0d)
                    .build();
        }

        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        int[] predecessorEdge = new int[nodeCount];
        Arrays.fill(predecessorEdge, NO_EDGE);
        VisitedSet settled = new VisitedSet(nodeCount);
        SearchQueue frontier = new SearchQueue(nodeCount);
        Graph.ArcIterator arcs = graph.iterator();

        distance[sourceIndex] = 0.0d;
        frontier.insert(sourceIndex, 0.0d, NO_EDGE);

        int settledCount = 0;
        boolean found = false;
        while (!frontier.isEmpty()) {
            SearchState state = frontier.extractMin();
            int node = state.nodeIndex;
            double nodeDistance = state.distance;
            settled.markVisited(node);
            settledCount++;
            if (node == targetIndex) {
                found = true;
                break;
            }

            arcs.resetForNode(node);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                int neighbor = graph.arcNeighbor(arc);
                if (settled.isVisited(neighbor)) {
                    continue;
                }
                int edgeId = graph.arcEdge(arc);
                double candidate = nodeDistance + graph.weight(edgeId);
                if (candidate < distance[neighbor]) {
                    distance[neighbor] = candidate;
                    predecessorEdge[neighbor] = edgeId;
                    frontier.insert(neighbor, candidate, edgeId);
                }
            }
        }

        log.debug("Dijkstra {} -> {}: settled {} of {} nodes, reachable={}",
                source, target, settledCount, nodeCount, found);
        if (!found) {
            return PathResult.unreachable(source, target);
        }
        return buildResult(graph, source, target, sourceIndex, targetIndex, distance[targetIndex], predecessorEdge);
    }

    /**
     * Rebuilds the node/edge sequence from predecessor edges and picks the bottleneck.
     */
    private static <N extends Comparable<? super N>> PathResult<N> buildResult(
            Graph<N> graph,
            N source,
            N target,
            int sourceIndex,
            int targetIndex,
            double totalWeight,
            int[] predecessorEdge
    ) {
        IntArrayList nodesBackward = new IntArrayList();
        IntArrayList edgesBackward = new IntArrayList();
        int current = targetIndex;
        nodesBackward.add(current);
        while (current != sourceIndex) {
            int edgeId = predecessorEdge[current];
            int previous = graph.edgeTargetIndex(edgeId) == current
                    ? graph.edgeSourceIndex(edgeId)
                    : graph.edgeTargetIndex(edgeId);
            edgesBackward.add(edgeId);
            nodesBackward.add(previous);
            current = previous;
        }
        int[] nodes = nodesBackward.toIntArray();
        int[] edges = edgesBackward.toIntArray();
        IntArrays.reverse(nodes);
        IntArrays.reverse(edges);

        PathResult.PathResultBuilder<N> builder = PathResult.<N>builder()
                .source(source)
                .target(target)
                .reachable(true)
                .totalWeight(totalWeight);
        for (int nodeIndex : nodes) {
            builder.pathNode(graph.nodeAt(nodeIndex));
        }

        Edge<N> bottleneck = null;
        for (int i = 0; i < edges.length; i++) {
            double weight = graph.weight(edges[i]);
            Edge<N> traversed = Edge.of(
                    graph.nodeAt(nodes[i]),
                    graph.nodeAt(nodes[i + 1]),
                    weight
            );
            builder.pathEdge(traversed);
            if (bottleneck == null || weight > bottleneck.weight()) {
                bottleneck = traversed;
            }
        }
        return builder.bottleneck(bottleneck).build();
    }
}
