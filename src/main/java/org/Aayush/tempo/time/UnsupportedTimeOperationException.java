package org.Aayush.tempo.time;

/**
 * Thrown when a delegated local-time operation is unknown or unsupported.
 *
 * <p>Messages render the zoned value, never the underlying local wall clock.</p>
 */
public final class UnsupportedTimeOperationException extends ZonedTimeException {

    public UnsupportedTimeOperationException(String message) {
        super(REASON_UNSUPPORTED_OPERATION, message);
    }

    public UnsupportedTimeOperationException(String message, Throwable cause) {
        super(REASON_UNSUPPORTED_OPERATION, message, cause);
    }
}
