package org.Aayush.topo.graph;

import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.Aayush.topo.core.id.IDMapper;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Builds validated {@link Graph} snapshots.
 *
 * <p>Validation always runs first; a graph is only constructed from input with no
 * violations, so every algorithm can rely on known endpoints, no self-loops and
 * finite non-negative weights.</p>
 */
@Log4j2
@UtilityClass
public final class GraphBuilder {

    /**
     * Validates input and builds an immutable graph.
     *
     * @param nodes node identifiers; insertion order defines dense node indices.
     * @param edges edges; input order defines edge ids.
     * @param policy directedness and parallel-edge policy.
     * @return immutable graph snapshot.
     * @throws GraphValidationException when at least one violation is found.
     * @throws NullPointerException on null arguments or null node/edge elements.
     */
    public static <N extends Comparable<? super N>> Graph<N> build(
            Collection<? extends N> nodes,
            List<Edge<N>> edges,
            GraphPolicy policy
    ) {
        List<GraphViolation> violations = GraphValidator.validate(nodes, edges, policy);
        if (!violations.isEmpty()) {
            log.debug("Rejected graph input with {} violation(s), first: {}", violations.size(), violations.get(0));
            throw new GraphValidationException(violations);
        }
        Graph<N> graph = new Graph<>(IDMapper.createImmutable(nodes), policy, edges);
        log.debug("Built {}", graph);
        return graph;
    }

    /**
     * Builds a graph with the same node set and policy as {@code template} but a new edge list.
     *
     * @throws GraphValidationException when the replacement edges are invalid.
     */
    public static <N extends Comparable<? super N>> Graph<N> rebuild(Graph<N> template, List<Edge<N>> edges) {
        Objects.requireNonNull(template, "template");
        return build(template.nodes(), edges, template.policy());
    }
}
