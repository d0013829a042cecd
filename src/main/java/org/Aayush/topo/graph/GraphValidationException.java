package org.Aayush.topo.graph;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when graph input fails structural validation; no graph is built.
 *
 * <p>The reason code and message describe the first violation found. The complete
 * list is available through {@link #getViolations()}.</p>
 */
@Getter
public final class GraphValidationException extends RuntimeException {
    private final String reasonCode;
    private final List<GraphViolation> violations;

    /**
     * Creates a validation failure from a non-empty violation list.
     *
     * @param violations violations in detection order.
     */
    public GraphValidationException(List<GraphViolation> violations) {
        super(formatMessage(violations));
        this.violations = List.copyOf(violations);
        this.reasonCode = this.violations.get(0).getKind().reasonCode();
    }

    /**
     * Returns the kind of the first violation.
     */
    public ViolationKind firstKind() {
        return violations.get(0).getKind();
    }

    private static String formatMessage(List<GraphViolation> violations) {
        Objects.requireNonNull(violations, "violations");
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("violations must be non-empty");
        }
        GraphViolation first = violations.get(0);
        String message = first.toString();
        if (violations.size() > 1) {
            message += " (+" + (violations.size() - 1) + " more)";
        }
        return message;
    }
}
