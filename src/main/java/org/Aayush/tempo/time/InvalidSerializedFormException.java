package org.Aayush.tempo.time;

/**
 * Thrown when an encoded zoned time cannot be decoded.
 */
public final class InvalidSerializedFormException extends ZonedTimeException {

    public InvalidSerializedFormException(String message) {
        super(REASON_INVALID_SERIALIZED_FORM, message);
    }

    public InvalidSerializedFormException(String message, Throwable cause) {
        super(REASON_INVALID_SERIALIZED_FORM, message, cause);
    }
}
