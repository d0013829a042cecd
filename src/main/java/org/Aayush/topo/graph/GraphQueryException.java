package org.Aayush.topo.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Query-time contract failure with a deterministic reason code.
 *
 * <p>Raised for requests an algorithm cannot answer (unknown node, wrong directedness,
 * invalid threshold). An unreachable target is not a failure and never raises this.</p>
 */
@Getter
public final class GraphQueryException extends RuntimeException {
    public static final String REASON_UNKNOWN_NODE = "QUERY_UNKNOWN_NODE";
    public static final String REASON_UNDIRECTED_GRAPH_REQUIRED = "QUERY_UNDIRECTED_GRAPH_REQUIRED";
    public static final String REASON_INVALID_THRESHOLD = "QUERY_INVALID_THRESHOLD";

    private final String reasonCode;

    /**
     * Creates a reason-coded query failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GraphQueryException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded query failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public GraphQueryException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
