package org.Aayush.tempo.time;

import org.Aayush.tempo.core.time.TimeSpan;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.format.FormattableTime;
import org.Aayush.tempo.format.Strftime;
import org.Aayush.tempo.format.TimeFormats;
import org.Aayush.tempo.zone.TimeZoneRef;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Plain UTC time value.
 *
 * <p>Equality and ordering follow {@link TimeLike}: a UTC time equals any time-like value
 * denoting the same instant, zoned times included.</p>
 */
public final class UtcTime implements FormattableTime {
    private static final String DEFAULT_PATTERN = "%Y-%m-%d %H:%M:%S";

    private final Instant instant;

    private UtcTime(Instant instant) {
        this.instant = Objects.requireNonNull(instant, "instant");
    }

    public static UtcTime of(Instant instant) {
        return new UtcTime(instant);
    }

    public static UtcTime ofEpochSecond(long epochSeconds) {
        return new UtcTime(Instant.ofEpochSecond(epochSeconds));
    }

    /**
     * Creates a UTC time from wall-clock fields read as UTC.
     */
    public static UtcTime of(int year, int month, int day, int hour, int minute, int second) {
        return new UtcTime(TimeUtils.reinterpretAsUtc(LocalDateTime.of(year, month, day, hour, minute, second)));
    }

    /**
     * Coerces any time-like value to UTC.
     */
    public static UtcTime from(TimeLike time) {
        if (time instanceof UtcTime) {
            return (UtcTime) time;
        }
        return new UtcTime(Objects.requireNonNull(time, "time").toInstant());
    }

    @Override
    public Instant toInstant() {
        return instant;
    }

    @Override
    public int utcOffsetSeconds() {
        return 0;
    }

    /**
     * Returns the UTC wall clock.
     */
    public LocalDateTime toLocalDateTime() {
        return TimeUtils.toLocal(instant, 0);
    }

    public OffsetDateTime toOffsetDateTime() {
        return instant.atOffset(ZoneOffset.UTC);
    }

    public long toEpochSecond() {
        return instant.getEpochSecond();
    }

    @Override
    public int dayOfMonth() {
        return toLocalDateTime().getDayOfMonth();
    }

    /**
     * Adds a span; on a UTC clock calendar and clock arithmetic coincide.
     */
    public UtcTime plus(TimeSpan span) {
        return new UtcTime(TimeUtils.reinterpretAsUtc(TimeUtils.advance(toLocalDateTime(), span)));
    }

    public UtcTime plus(Duration duration) {
        return new UtcTime(instant.plus(duration));
    }

    public UtcTime plusSeconds(long seconds) {
        return new UtcTime(instant.plusSeconds(seconds));
    }

    public UtcTime minus(TimeSpan span) {
        return plus(span.negated());
    }

    /**
     * Returns elapsed seconds between this and another time-like value.
     */
    public double minus(TimeLike other) {
        return TimeUtils.secondsBetween(instant, other.toInstant());
    }

    /**
     * Returns the simultaneous time in {@code zone}.
     */
    public ZonedTime inTimeZone(TimeZoneRef zone) {
        return ZonedTime.fromUtc(instant, zone);
    }

    @Override
    public String strftime(String pattern) {
        return Strftime.format(pattern, toOffsetDateTime());
    }

    @Override
    public String formattedOffset(boolean colon, String alternateUtc) {
        return TimeUtils.formatOffset(0, colon, alternateUtc);
    }

    @Override
    public String iso8601(int fractionDigits) {
        String pattern = fractionDigits > 0 ? "%Y-%m-%dT%H:%M:%S.%" + fractionDigits + "N" : "%Y-%m-%dT%H:%M:%S";
        return strftime(pattern) + "Z";
    }

    /**
     * Renders with a named format, falling back to the default rendering for unknown names.
     */
    public String toString(String formatName) {
        String rendered = TimeFormats.defaultFormats().render(formatName, this);
        return rendered != null ? rendered : toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TimeLike)) {
            return false;
        }
        return instant.equals(((TimeLike) other).toInstant());
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    /**
     * Renders {@code YYYY-MM-DD HH:MM:SS UTC}.
     */
    @Override
    public String toString() {
        return strftime(DEFAULT_PATTERN) + " UTC";
    }
}
