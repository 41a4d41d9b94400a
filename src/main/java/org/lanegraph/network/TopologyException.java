package org.lanegraph.network;

import lombok.Getter;

import java.util.Objects;

/**
 * Construction failure for a network topology or position map.
 *
 * <p>This is the only failure class that aborts initialization: a malformed network
 * invalidates every later query. The reason code is stable for callers that branch on it.</p>
 */
@Getter
public final class TopologyException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded construction failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message diagnostic naming the offending edge/connection.
     */
    public TopologyException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded construction failure with a cause.
     */
    public TopologyException(String reasonCode, String message, Throwable cause) {
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
