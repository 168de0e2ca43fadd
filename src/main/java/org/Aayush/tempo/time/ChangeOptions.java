package org.Aayush.tempo.time;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tempo.core.time.TimeUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Sparse field overrides applied by {@link ZonedTime#change(ChangeOptions)}.
 *
 * <p>Time-of-day fields reset cascadingly: giving only {@code hour} zeroes minute, second
 * and subsecond; giving {@code minute} zeroes second and subsecond; giving {@code second}
 * zeroes the subsecond. Date fields never reset each other.</p>
 */
@Value
@Builder
public class ChangeOptions {
    private static final int MICROS_PER_SECOND = 1_000_000;
    private static final int NANOS_PER_MICRO = 1_000;

    Integer year;
    Integer month;
    Integer day;
    Integer hour;
    Integer minute;
    Integer second;

    /**
     * Subsecond in microseconds; exclusive with {@link #nanosecond}.
     */
    Integer microsecond;

    /**
     * Subsecond in nanoseconds; exclusive with {@link #microsecond}.
     */
    Integer nanosecond;

    /**
     * Target zone name; exclusive with {@link #offset} and {@link #offsetSeconds}.
     */
    String zone;

    /**
     * Target UTC offset text such as {@code -10:00}; wall-clock fields are kept.
     */
    String offset;

    /**
     * Target UTC offset in seconds; alternative spelling of {@link #offset}.
     */
    Integer offsetSeconds;

    /**
     * Returns whether a target zone name was given.
     */
    public boolean hasZone() {
        return zone != null;
    }

    /**
     * Returns whether an explicit offset was given in either spelling.
     */
    public boolean hasOffset() {
        return offset != null || offsetSeconds != null;
    }

    /**
     * Returns the explicit offset in seconds.
     *
     * @throws IllegalStateException when no offset was given.
     */
    public int resolveOffsetSeconds() {
        if (offset != null && offsetSeconds != null) {
            throw new IllegalArgumentException("pass either offset or offsetSeconds, not both: " + this);
        }
        if (offsetSeconds != null) {
            return offsetSeconds;
        }
        if (offset == null) {
            throw new IllegalStateException("no offset given");
        }
        return TimeUtils.parseOffset(offset);
    }

    /**
     * Applies the overrides to wall-clock fields.
     *
     * @param local current wall-clock fields.
     * @return changed wall-clock fields.
     * @throws IllegalArgumentException when both subsecond spellings are given or a field is out of range.
     */
    public LocalDateTime applyTo(LocalDateTime local) {
        int newYear = year != null ? year : local.getYear();
        int newMonth = month != null ? month : local.getMonthValue();
        int newDay = day != null ? day : local.getDayOfMonth();
        int newHour = hour != null ? hour : local.getHour();
        int newMinute = minute != null ? minute : (hour != null ? 0 : local.getMinute());
        int newSecond = second != null ? second : (hour != null || minute != null ? 0 : local.getSecond());

        int newNanos;
        if (nanosecond != null) {
            if (microsecond != null) {
                throw new IllegalArgumentException("pass either microsecond or nanosecond, not both: " + this);
            }
            newNanos = requireRange(nanosecond, (int) TimeUtils.NANOS_PER_SECOND, "nanosecond");
        } else if (microsecond != null) {
            newNanos = requireRange(microsecond, MICROS_PER_SECOND, "microsecond") * NANOS_PER_MICRO;
        } else {
            newNanos = hour != null || minute != null || second != null ? 0 : local.getNano();
        }

        LocalDate date = TimeUtils.civilDate(newYear, newMonth, newDay);
        return date.atTime(newHour, newMinute, newSecond, newNanos);
    }

    private static int requireRange(int value, int exclusiveMax, String fieldName) {
        if (value < 0 || value >= exclusiveMax) {
            throw new IllegalArgumentException(fieldName + " out of range: " + value);
        }
        return value;
    }
}
