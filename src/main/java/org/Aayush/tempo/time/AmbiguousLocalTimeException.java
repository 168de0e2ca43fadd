package org.Aayush.tempo.time;

/**
 * Thrown when a local time cannot be moved out of a zone gap within the retry bound.
 */
public final class AmbiguousLocalTimeException extends ZonedTimeException {

    public AmbiguousLocalTimeException(String message, Throwable cause) {
        super(REASON_AMBIGUOUS_LOCAL_TIME, message, cause);
    }
}
