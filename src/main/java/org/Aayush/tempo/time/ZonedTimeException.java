package org.Aayush.tempo.time;

import lombok.Getter;

import java.util.Objects;

/**
 * Zoned-time contract exception with deterministic reason codes.
 */
@Getter
public class ZonedTimeException extends RuntimeException {
    public static final String REASON_CONFLICTING_ZONE_SPEC = "CONFLICTING_ZONE_SPEC";
    public static final String REASON_AMBIGUOUS_LOCAL_TIME = "AMBIGUOUS_LOCAL_TIME";
    public static final String REASON_UNSUPPORTED_OPERATION = "UNSUPPORTED_OPERATION";
    public static final String REASON_INVALID_SERIALIZED_FORM = "INVALID_SERIALIZED_FORM";
    public static final String REASON_UNKNOWN_TIME_ZONE = "UNKNOWN_TIME_ZONE";
    public static final String REASON_CONFIG_REQUIRED = "CONFIG_REQUIRED";

    private final String reasonCode;

    /**
     * Creates a reason-coded zoned-time failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ZonedTimeException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded zoned-time failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ZonedTimeException(String reasonCode, String message, Throwable cause) {
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
