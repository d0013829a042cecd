package org.Aayush.topo.graph;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural validation of graph input before construction.
 *
 * <p>Validation is exhaustive: every node and every edge is examined and all findings are
 * returned in detection order. Node-level findings come first. Each edge contributes at most
 * one finding, checked in this order:</p>
 * <ol>
 * <li>unknown endpoint,</li>
 * <li>self-loop,</li>
 * <li>negative or non-finite weight,</li>
 * <li>repeated endpoint pair (only when the policy disallows parallel edges).</li>
 * </ol>
 */
@UtilityClass
public final class GraphValidator {

    /**
     * Validates node and edge input against a construction policy.
     *
     * @param nodes node identifiers in insertion order.
     * @param edges edges in input order.
     * @param policy construction policy.
     * @return violations in detection order; empty when the input is valid.
     * @throws NullPointerException if an argument is null, or {@code nodes} or {@code edges}
     * contains a null element. Null input is a caller bug, not a data violation.
     */
    public static <N extends Comparable<? super N>> List<GraphViolation> validate(
            Collection<? extends N> nodes,
            List<Edge<N>> edges,
            GraphPolicy policy
    ) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        Objects.requireNonNull(policy, "policy");

        List<GraphViolation> violations = new ArrayList<>();
        Set<N> nodeSet = new HashSet<>(Math.max(16, nodes.size() * 2));
        for (N node : nodes) {
            Objects.requireNonNull(node, "nodes must not contain null");
            if (!nodeSet.add(node)) {
                violations.add(GraphViolation.ofNode(
                        ViolationKind.DUPLICATE_NODE,
                        "duplicate node " + node
                ));
            }
        }

        Map<EdgeKey<N>, Integer> firstEdgeByPair = new HashMap<>();
        for (int i = 0; i < edges.size(); i++) {
            Edge<N> edge = Objects.requireNonNull(edges.get(i), "edges must not contain null");
            GraphViolation violation = checkEdge(i, edge, nodeSet, policy, firstEdgeByPair);
            if (violation != null) {
                violations.add(violation);
            }
        }
        return violations;
    }

    private static <N extends Comparable<? super N>> GraphViolation checkEdge(
            int index,
            Edge<N> edge,
            Set<N> nodeSet,
            GraphPolicy policy,
            Map<EdgeKey<N>, Integer> firstEdgeByPair
    ) {
        if (!nodeSet.contains(edge.source())) {
            return GraphViolation.ofEdge(ViolationKind.UNKNOWN_NODE, index, edge,
                    "edge #" + index + " " + edge + " references unknown source node " + edge.source());
        }
        if (!nodeSet.contains(edge.target())) {
            return GraphViolation.ofEdge(ViolationKind.UNKNOWN_NODE, index, edge,
                    "edge #" + index + " " + edge + " references unknown target node " + edge.target());
        }
        if (edge.source().equals(edge.target())) {
            return GraphViolation.ofEdge(ViolationKind.SELF_LOOP, index, edge,
                    "edge #" + index + " is a self loop on node " + edge.source());
        }
        double weight = edge.weight();
        if (!Double.isFinite(weight) || weight < 0.0d) {
            return GraphViolation.ofEdge(ViolationKind.INVALID_WEIGHT, index, edge,
                    "edge #" + index + " " + edge.source() + "->" + edge.target()
                            + " has invalid weight " + weight + " (must be finite and >= 0)");
        }
        if (!policy.isAllowParallelEdges()) {
            EdgeKey<N> pair = policy.isDirected() ? edge.key() : edge.key().canonical();
            Integer first = firstEdgeByPair.putIfAbsent(pair, index);
            if (first != null) {
                return GraphViolation.ofEdge(ViolationKind.DUPLICATE_EDGE, index, edge,
                        "edge #" + index + " duplicates edge #" + first + " between " + pair);
            }
        }
        return null;
    }
}
