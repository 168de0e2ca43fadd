package org.Aayush.tempo.time;

import java.util.Objects;

/**
 * Inclusive range of zoned times, produced by range operations such as {@code all_day}.
 *
 * @param begin first instant of the range.
 * @param end last instant of the range.
 */
public record ZonedTimeRange(ZonedTime begin, ZonedTime end) {
    public ZonedTimeRange {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        if (end.compareTo(begin) < 0) {
            throw new IllegalArgumentException("end must not precede begin: " + begin + ".." + end);
        }
    }

    /**
     * Returns whether {@code time} lies within the range, both ends included.
     */
    public boolean contains(TimeLike time) {
        Objects.requireNonNull(time, "time");
        return !time.isBefore(begin) && !time.isAfter(end);
    }

    /**
     * Returns elapsed seconds between the ends.
     */
    public double seconds() {
        return end.minus(begin);
    }

    @Override
    public String toString() {
        return begin + ".." + end;
    }
}
