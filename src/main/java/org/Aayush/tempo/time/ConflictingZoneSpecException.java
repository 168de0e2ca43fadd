package org.Aayush.tempo.time;

/**
 * Thrown when a change names both a zone and an explicit offset.
 */
public final class ConflictingZoneSpecException extends ZonedTimeException {

    public ConflictingZoneSpecException(String message) {
        super(REASON_CONFLICTING_ZONE_SPEC, message);
    }
}
