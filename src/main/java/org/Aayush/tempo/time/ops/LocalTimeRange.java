package org.Aayush.tempo.time.ops;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Inclusive range of local wall-clock times.
 */
public record LocalTimeRange(LocalDateTime begin, LocalDateTime end) {

    public LocalTimeRange {
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(begin)) {
            throw new IllegalArgumentException("range end " + end + " is before begin " + begin);
        }
    }
}
