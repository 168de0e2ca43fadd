package org.Aayush.tempo.zone;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Offset rule observed by a zone over a contiguous range of instants.
 *
 * <p>Periods are compared by value, window included, so two periods are equal only when they
 * describe the same stretch of the zone's history. A period without bounds applies at every
 * instant; custom resolvers for zones without transitions may use those.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Period {

    /**
     * Total observed offset from UTC in seconds, DST included.
     */
    int utcOffsetSeconds;

    /**
     * Short zone name such as {@code EST}, {@code CEST} or {@code UTC}.
     */
    String abbreviation;

    /**
     * True while daylight saving time is in effect.
     */
    boolean dst;

    /**
     * Transition instant the period starts at, inclusive; {@code null} when unbounded.
     */
    Instant validFrom;

    /**
     * Transition instant the period ends at, exclusive; {@code null} when unbounded.
     */
    Instant validUntil;

    /**
     * Creates a period without bounds.
     */
    public static Period of(int utcOffsetSeconds, String abbreviation, boolean dst) {
        return new Period(utcOffsetSeconds, abbreviation, dst, null, null);
    }

    /**
     * Creates a period bounded by two transitions.
     *
     * @param utcOffsetSeconds total offset in seconds.
     * @param abbreviation short zone name.
     * @param dst daylight saving flag.
     * @param validFrom inclusive start, or {@code null}.
     * @param validUntil exclusive end, or {@code null}.
     * @return period.
     * @throws IllegalArgumentException when the window is empty.
     */
    public static Period of(int utcOffsetSeconds, String abbreviation, boolean dst, Instant validFrom, Instant validUntil) {
        if (validFrom != null && validUntil != null && !validFrom.isBefore(validUntil)) {
            throw new IllegalArgumentException("empty period window: " + validFrom + " .. " + validUntil);
        }
        return new Period(utcOffsetSeconds, abbreviation, dst, validFrom, validUntil);
    }

    /**
     * Returns whether the instant lies inside this period's window.
     */
    public boolean contains(Instant utc) {
        return (validFrom == null || !utc.isBefore(validFrom))
                && (validUntil == null || utc.isBefore(validUntil));
    }
}
