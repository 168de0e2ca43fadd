package org.Aayush.tempo.time;

import java.time.Instant;

/**
 * Capability shared by every value that acts like a time: it denotes one instant and is
 * observed at some UTC offset.
 *
 * <p>Generic code written against this interface accepts plain UTC times and zoned times
 * alike. Ordering is by instant only, so values in different zones denoting the same instant
 * compare equal.</p>
 */
public interface TimeLike extends Comparable<TimeLike> {

    /**
     * Returns the instant this value denotes.
     */
    Instant toInstant();

    /**
     * Returns the observed UTC offset in seconds.
     */
    int utcOffsetSeconds();

    @Override
    default int compareTo(TimeLike other) {
        return toInstant().compareTo(other.toInstant());
    }

    default boolean isBefore(TimeLike other) {
        return compareTo(other) < 0;
    }

    default boolean isAfter(TimeLike other) {
        return compareTo(other) > 0;
    }
}
