package org.Aayush.tempo.zone;

import lombok.experimental.StandardException;

/**
 * Thrown when a zone name or offset cannot be resolved to a zone.
 */
@StandardException
public class UnknownTimeZoneException extends RuntimeException {
}
