package org.Aayush.tempo.core.time;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Shared deterministic helpers for combining instants, offsets and wall-clock fields.
 *
 * <p>Local wall-clock values are plain {@link LocalDateTime}s; they never carry DST rules of
 * their own, so all arithmetic on them is straight civil-calendar arithmetic.</p>
 */
public final class TimeUtils {

    public static final long SECONDS_PER_DAY = 86_400L;
    public static final long SECONDS_PER_HOUR = 3_600L;
    public static final long SECONDS_PER_MINUTE = 60L;
    public static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final int MAX_DAY_OF_MONTH = 31;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Shifts a UTC instant into the wall clock of a fixed offset.
     *
     * @param utc UTC instant.
     * @param offsetSeconds total offset in seconds.
     * @return local wall-clock fields at that offset.
     */
    public static LocalDateTime toLocal(Instant utc, int offsetSeconds) {
        Objects.requireNonNull(utc, "utc");
        return LocalDateTime.ofEpochSecond(utc.getEpochSecond(), utc.getNano(), ZoneOffset.ofTotalSeconds(offsetSeconds));
    }

    /**
     * Removes a fixed offset from wall-clock fields.
     *
     * @param local local wall-clock fields.
     * @param offsetSeconds total offset in seconds.
     * @return UTC instant.
     */
    public static Instant toUtc(LocalDateTime local, int offsetSeconds) {
        Objects.requireNonNull(local, "local");
        return local.toInstant(ZoneOffset.ofTotalSeconds(offsetSeconds));
    }

    /**
     * Reads wall-clock fields as if they were UTC, discarding whatever offset they were taken at.
     */
    public static Instant reinterpretAsUtc(LocalDateTime fields) {
        return toUtc(fields, 0);
    }

    /**
     * Formats an offset as {@code +HH:MM} / {@code +HHMM}.
     *
     * @param offsetSeconds total offset in seconds.
     * @param colon whether hours and minutes are separated by a colon.
     * @param alternateUtc text returned for a zero offset, or {@code null} to render {@code +00:00}.
     * @return rendered offset.
     */
    public static String formatOffset(int offsetSeconds, boolean colon, String alternateUtc) {
        if (offsetSeconds == 0 && alternateUtc != null) {
            return alternateUtc;
        }
        char sign = offsetSeconds < 0 ? '-' : '+';
        int absolute = Math.abs(offsetSeconds);
        int hours = (int) (absolute / SECONDS_PER_HOUR);
        int minutes = (int) ((absolute % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE);
        return String.format(colon ? "%c%02d:%02d" : "%c%02d%02d", sign, hours, minutes);
    }

    /**
     * Parses {@code +HH:MM}, {@code +HHMM}, {@code +HH} or {@code Z} into offset seconds.
     *
     * @param text offset text.
     * @return total offset in seconds.
     * @throws IllegalArgumentException when the text is not an offset.
     */
    public static int parseOffset(String text) {
        String normalized = Objects.requireNonNull(text, "text").trim();
        try {
            return ZoneOffset.of(normalized).getTotalSeconds();
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("invalid utc offset: " + normalized, ex);
        }
    }

    /**
     * Advances wall-clock fields by a span using the proleptic Gregorian calendar.
     *
     * <p>Years, then months, move the date clamping to the month end; weeks and days follow;
     * hours, minutes and seconds are then added to the resulting wall clock.</p>
     *
     * @param local wall-clock fields.
     * @param span quantity to add (may be negative).
     * @return advanced wall-clock fields.
     */
    public static LocalDateTime advance(LocalDateTime local, TimeSpan span) {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(span, "span");
        LocalDate date = local.toLocalDate();
        if (span.has(TimeSpan.Unit.YEARS)) {
            date = date.plusYears(span.amount(TimeSpan.Unit.YEARS));
        }
        if (span.has(TimeSpan.Unit.MONTHS)) {
            date = date.plusMonths(span.amount(TimeSpan.Unit.MONTHS));
        }
        if (span.has(TimeSpan.Unit.WEEKS)) {
            date = date.plusWeeks(span.amount(TimeSpan.Unit.WEEKS));
        }
        if (span.has(TimeSpan.Unit.DAYS)) {
            date = date.plusDays(span.amount(TimeSpan.Unit.DAYS));
        }
        LocalDateTime advanced = LocalDateTime.of(date, local.toLocalTime());
        long seconds = span.fixedSeconds();
        return seconds == 0L ? advanced : advanced.plusSeconds(seconds);
    }

    /**
     * Builds a civil date, rolling days past the month end into the following month.
     *
     * @param year proleptic year.
     * @param month month of year, 1-12.
     * @param day day of month, 1-31.
     * @return resolved date.
     * @throws IllegalArgumentException when day is outside 1-31.
     */
    public static LocalDate civilDate(int year, int month, int day) {
        if (day < 1 || day > MAX_DAY_OF_MONTH) {
            throw new IllegalArgumentException("day out of range: " + day);
        }
        return LocalDate.of(year, month, 1).plusDays(day - 1L);
    }

    /**
     * Returns elapsed seconds {@code from - to} including the fractional part.
     */
    public static double secondsBetween(Instant from, Instant to) {
        long seconds = Math.subtractExact(from.getEpochSecond(), to.getEpochSecond());
        int nanos = from.getNano() - to.getNano();
        return seconds + nanos / (double) NANOS_PER_SECOND;
    }

    /**
     * Returns epoch seconds with the fractional nanosecond part.
     */
    public static double toEpochSecondsDouble(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / (double) NANOS_PER_SECOND;
    }

    /**
     * Rounds the fraction of second half up to {@code fractionDigits} digits, carrying into
     * the seconds when it rounds up to a whole second.
     *
     * @param local wall-clock value.
     * @param fractionDigits digits to keep, 0 to 9.
     * @return rounded wall-clock value.
     */
    public static LocalDateTime roundFraction(LocalDateTime local, int fractionDigits) {
        Objects.requireNonNull(local, "local");
        if (fractionDigits < 0 || fractionDigits > 9) {
            throw new IllegalArgumentException("fractionDigits must be in [0, 9]: " + fractionDigits);
        }
        long unit = 1L;
        for (int i = fractionDigits; i < 9; i++) {
            unit *= 10L;
        }
        long rounded = (local.getNano() + unit / 2L) / unit * unit;
        return local.withNano(0).plusNanos(rounded);
    }

    /**
     * Returns day-of-week where Sunday = 0 and Saturday = 6.
     */
    public static int sundayBasedDayOfWeek(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }
}
