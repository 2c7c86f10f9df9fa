package org.qosroute.routing.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Graph construction contract failure with a deterministic reason code.
 */
@Getter
@Accessors(fluent = true)
public final class GraphContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded graph contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public GraphContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
