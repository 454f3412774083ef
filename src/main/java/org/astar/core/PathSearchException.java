package org.astar.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Path search contract failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, e.g. {@code [ASTAR_NEGATIVE_COST] ...}.
 * An unreachable goal is not a failure and never raises this exception.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PathSearchException extends RuntimeException {
    public static final String REASON_NULL_NODE = "ASTAR_NULL_NODE";
    public static final String REASON_EXPANDED_EXCEEDED = "ASTAR_BUDGET_EXPANDED_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "ASTAR_BUDGET_FRONTIER_EXCEEDED";
    public static final String REASON_NON_FINITE_COST = "ASTAR_NON_FINITE_COST";
    public static final String REASON_NEGATIVE_COST = "ASTAR_NEGATIVE_COST";
    public static final String REASON_NON_FINITE_ESTIMATE = "ASTAR_NON_FINITE_ESTIMATE";
    public static final String REASON_NEGATIVE_ESTIMATE = "ASTAR_NEGATIVE_ESTIMATE";
    public static final String REASON_NODE_FAILURE = "ASTAR_NODE_FAILURE";

    private final String reasonCode;

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PathSearchException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public PathSearchException(String reasonCode, String message, Throwable cause) {
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
