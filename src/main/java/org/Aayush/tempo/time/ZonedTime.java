package org.Aayush.tempo.time;

import org.Aayush.tempo.core.time.DurationClassifier;
import org.Aayush.tempo.core.time.TimeSpan;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.format.FormattableTime;
import org.Aayush.tempo.format.Strftime;
import org.Aayush.tempo.format.TimeFormats;
import org.Aayush.tempo.time.ops.LocalTimeOperation;
import org.Aayush.tempo.time.ops.LocalTimeOperations;
import org.Aayush.tempo.time.ops.LocalTimeRange;
import org.Aayush.tempo.zone.Period;
import org.Aayush.tempo.zone.PeriodNotFoundException;
import org.Aayush.tempo.zone.TimeZoneRef;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.UnsupportedTemporalTypeException;
import java.util.List;
import java.util.Objects;

/**
 * Civil time paired with a named zone, usable wherever a plain UTC time is expected.
 *
 * <p>A value holds a UTC instant, a zone, and lazily the local wall clock and the zone period
 * observed at that instant. Whichever of instant and wall clock the value was not built from
 * is derived on first use and memoized; memoization is idempotent, so concurrent readers may
 * race on it without locking.</p>
 *
 * <p>Arithmetic picks its anchor per operation. Fixed-length quantities move the UTC instant,
 * so {@code plus(24 hours)} is exactly 86 400 elapsed seconds. Calendar-variable spans move the
 * wall clock, so {@code plus(1 day)} keeps the wall-clock time across a DST change.</p>
 *
 * <p>Local times inside a gap are moved forward one hour at a time, at most
 * {@value #MAX_GAP_RETRIES} times. Local times inside a fold take the first candidate period
 * unless the caller supplies one of the candidates.</p>
 */
public final class ZonedTime implements FormattableTime {
    public static final int MAX_GAP_RETRIES = 6;

    private static final Logger logger = LogManager.getLogger();
    private static final String DEFAULT_PATTERN = "%Y-%m-%d %H:%M:%S";
    private static final String INSPECT_PATTERN = "%a, %d %b %Y %H:%M:%S.%9N";
    private static final String UTC_SUFFIX = "UTC";

    private final TimeZoneRef zone;
    private volatile Instant utc;
    private volatile LocalDateTime local;
    private volatile Period period;
    private volatile boolean frozen;

    private ZonedTime(Instant utc, TimeZoneRef zone, LocalDateTime local, Period period) {
        this.zone = Objects.requireNonNull(zone, "zone");
        if (utc != null) {
            this.utc = utc;
            this.local = local;
            this.period = period;
        } else if (period != null && zone.periodsForLocal(Objects.requireNonNull(local, "local")).contains(period)) {
            this.local = local;
            this.period = period;
        } else {
            resolveLocal(Objects.requireNonNull(local, "local"));
        }
    }

    /**
     * Creates the zoned time of a UTC instant.
     *
     * @param utc UTC instant.
     * @param zone zone to observe the instant in.
     * @return zoned time.
     */
    public static ZonedTime fromUtc(Instant utc, TimeZoneRef zone) {
        return new ZonedTime(Objects.requireNonNull(utc, "utc"), zone, null, null);
    }

    /**
     * Creates the zoned time of UTC wall-clock fields.
     */
    public static ZonedTime fromUtc(LocalDateTime utcFields, TimeZoneRef zone) {
        return fromUtc(TimeUtils.reinterpretAsUtc(utcFields), zone);
    }

    /**
     * Creates the zoned time of wall-clock fields claimed to be UTC; the offset of
     * {@code utcFields} is discarded, not converted.
     */
    public static ZonedTime fromUtc(OffsetDateTime utcFields, TimeZoneRef zone) {
        return fromUtc(Objects.requireNonNull(utcFields, "utcFields").toLocalDateTime(), zone);
    }

    public static ZonedTime fromUtc(UtcTime utc, TimeZoneRef zone) {
        return fromUtc(utc.toInstant(), zone);
    }

    /**
     * Creates the zoned time of local wall-clock fields, resolving the period from the zone.
     *
     * @param local wall-clock fields.
     * @param zone zone the fields are read in.
     * @return zoned time.
     * @throws AmbiguousLocalTimeException when the fields stay in a gap after every retry.
     */
    public static ZonedTime fromLocal(LocalDateTime local, TimeZoneRef zone) {
        return new ZonedTime(null, zone, local, null);
    }

    /**
     * Creates the zoned time of local wall-clock fields with an already known period.
     *
     * <p>The period is kept only when it is one of the zone's candidates for {@code local};
     * otherwise, or when it is {@code null}, the period is resolved as by
     * {@link #fromLocal(LocalDateTime, TimeZoneRef)}.</p>
     */
    public static ZonedTime fromLocal(LocalDateTime local, TimeZoneRef zone, Period knownPeriod) {
        return new ZonedTime(null, zone, local, knownPeriod);
    }

    /**
     * Rebuilds a decoded zoned time. The UTC instant is authoritative; the decoded wall clock
     * is only compared against the one derived from it.
     *
     * @param utc decoded UTC instant.
     * @param zone decoded zone.
     * @param local decoded wall clock, may be {@code null}.
     * @return zoned time.
     */
    public static ZonedTime restore(Instant utc, TimeZoneRef zone, LocalDateTime local) {
        ZonedTime restored = fromUtc(utc, zone);
        if (local != null && !local.equals(restored.local())) {
            logger.debug("Discarding decoded local time {} for {} in {}; derived {}", local, utc, zone, restored.local());
        }
        return restored;
    }

    private void resolveLocal(LocalDateTime requested) {
        LocalDateTime candidate = requested;
        PeriodNotFoundException lastGap = null;
        for (int attempt = 0; attempt <= MAX_GAP_RETRIES; attempt++) {
            try {
                Period resolved = zone.periodForLocal(candidate);
                this.local = candidate;
                this.period = resolved;
                return;
            } catch (PeriodNotFoundException ex) {
                lastGap = ex;
                logger.debug("Local time {} falls in a gap of {}, moving forward one hour", candidate, zone);
                candidate = candidate.plusHours(1);
            }
        }
        throw new AmbiguousLocalTimeException(
                "local time " + requested + " stays in a gap of " + zone + " after " + MAX_GAP_RETRIES + " retries",
                lastGap
        );
    }

    /**
     * Returns the UTC instant.
     */
    public Instant utc() {
        Instant value = utc;
        if (value == null) {
            value = TimeUtils.toUtc(local, period().getUtcOffsetSeconds());
            utc = value;
        }
        return value;
    }

    /**
     * Returns the local wall clock in {@link #zone()}.
     */
    public LocalDateTime local() {
        LocalDateTime value = local;
        if (value == null) {
            value = TimeUtils.toLocal(utc, period().getUtcOffsetSeconds());
            local = value;
        }
        return value;
    }

    /**
     * Returns the zone period observed by this value.
     */
    public Period period() {
        Period value = period;
        if (value == null) {
            Instant instant = utc;
            value = instant != null ? zone.periodForUtc(instant) : zone.periodForLocal(local);
            period = value;
        }
        return value;
    }

    public TimeZoneRef zone() {
        return zone;
    }

    @Override
    public int utcOffsetSeconds() {
        return period().getUtcOffsetSeconds();
    }

    /**
     * Returns the zone abbreviation, for example {@code EST}.
     */
    public String abbreviation() {
        return period().getAbbreviation();
    }

    public boolean isDst() {
        return period().isDst();
    }

    /**
     * Returns whether the observed zone is UTC ({@code UTC} or {@code UCT} abbreviation).
     */
    public boolean isUtcZone() {
        String abbreviation = abbreviation();
        return "UTC".equals(abbreviation) || "UCT".equals(abbreviation);
    }

    @Override
    public Instant toInstant() {
        return utc();
    }

    public UtcTime toUtcTime() {
        return UtcTime.of(utc());
    }

    /**
     * Returns the wall clock at the observed offset.
     */
    public OffsetDateTime toOffsetDateTime() {
        return local().atOffset(ZoneOffset.ofTotalSeconds(utcOffsetSeconds()));
    }

    /**
     * Returns the instant as a JDK zoned date-time in the backing zone id.
     */
    public ZonedDateTime toZonedDateTime() {
        return utc().atZone(zone.zoneId());
    }

    public long toEpochSecond() {
        return utc().getEpochSecond();
    }

    public double toEpochSecondsDouble() {
        return TimeUtils.toEpochSecondsDouble(utc());
    }

    /**
     * Returns the instant as a plain offset time in the system default zone.
     */
    public OffsetDateTime localtime() {
        return utc().atZone(ZoneId.systemDefault()).toOffsetDateTime();
    }

    /**
     * Returns the instant as a plain offset time at a fixed offset.
     *
     * @param offsetSeconds offset from UTC in seconds.
     */
    public OffsetDateTime localtime(int offsetSeconds) {
        return utc().atOffset(ZoneOffset.ofTotalSeconds(offsetSeconds));
    }

    /**
     * Returns the instant as a plain offset time at a fixed offset such as {@code +09:00}.
     */
    public OffsetDateTime localtime(String offset) {
        return localtime(TimeUtils.parseOffset(Objects.requireNonNull(offset, "offset")));
    }

    /**
     * Returns the simultaneous time in another zone, or this value when the zone is the same.
     */
    public ZonedTime inTimeZone(TimeZoneRef newZone) {
        if (zone.equals(newZone)) {
            return this;
        }
        return fromUtc(utc(), newZone);
    }

    /**
     * Returns {@code [sec, min, hour, day, month, year, wday, yday, dst, abbreviation]}.
     */
    public List<Object> toArray() {
        LocalDateTime time = local();
        return List.of(
                time.getSecond(),
                time.getMinute(),
                time.getHour(),
                time.getDayOfMonth(),
                time.getMonthValue(),
                time.getYear(),
                TimeUtils.sundayBasedDayOfWeek(time.getDayOfWeek()),
                time.getDayOfYear(),
                isDst(),
                abbreviation()
        );
    }

    /**
     * Forces every memoized field and marks the value frozen.
     */
    public ZonedTime freeze() {
        period();
        utc();
        local();
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Adds a span. Calendar-variable spans move the wall clock, fixed-length spans the instant.
     *
     * @param span quantity to add (may be negative).
     * @return new zoned time in the same zone.
     */
    public ZonedTime plus(TimeSpan span) {
        Objects.requireNonNull(span, "span");
        if (DurationClassifier.isVariableLength(span)) {
            return wrapLocal(TimeUtils.advance(local(), span));
        }
        return fromUtc(utc().plusSeconds(span.fixedSeconds()), zone);
    }

    /**
     * Adds an exact elapsed duration to the instant.
     */
    public ZonedTime plus(Duration duration) {
        return fromUtc(utc().plus(duration), zone);
    }

    /**
     * Adds elapsed seconds to the instant.
     */
    public ZonedTime plus(long seconds) {
        return fromUtc(utc().plusSeconds(seconds), zone);
    }

    /**
     * Alias of {@link #plus(TimeSpan)}.
     */
    public ZonedTime since(TimeSpan span) {
        return plus(span);
    }

    /**
     * Advances by a span of years, months, weeks, days, hours, minutes and seconds.
     *
     * <p>When any of years, months, weeks or days is present (even as zero) the whole span is
     * applied to the wall clock; otherwise it is applied to the instant.</p>
     */
    public ZonedTime advance(TimeSpan span) {
        return plus(span);
    }

    public ZonedTime minus(TimeSpan span) {
        return plus(span.negated());
    }

    public ZonedTime minus(Duration duration) {
        return plus(duration.negated());
    }

    public ZonedTime minus(long seconds) {
        return plus(Math.negateExact(seconds));
    }

    /**
     * Returns elapsed seconds between this and another time-like value.
     */
    public double minus(TimeLike other) {
        return TimeUtils.secondsBetween(utc(), Objects.requireNonNull(other, "other").toInstant());
    }

    /**
     * Moves back by a span; same as {@code plus(span.negated())}.
     */
    public ZonedTime ago(TimeSpan span) {
        return plus(span.negated());
    }

    public ZonedTime ago(Duration duration) {
        return plus(duration.negated());
    }

    /**
     * Rounds the wall clock to {@code fractionDigits} fractional digits, half up, and reads the
     * result in this zone.
     *
     * @param fractionDigits digits to keep, 0 to 9.
     * @return rounded zoned time.
     */
    public ZonedTime round(int fractionDigits) {
        return wrapLocal(TimeUtils.roundFraction(local(), fractionDigits));
    }

    public ZonedTime round() {
        return round(0);
    }

    /**
     * Returns a value with some fields changed, looking a new zone or offset up in
     * {@link TimeZoneRegistry#defaultRegistry()}, whose abbreviations are English. Code holding a
     * {@link org.Aayush.tempo.zone.ZoneRuntimeBinder.Binding} uses its {@code change} so the
     * bound registry is used instead.
     *
     * @see #change(ChangeOptions, TimeZoneRegistry)
     */
    public ZonedTime change(ChangeOptions options) {
        return change(options, TimeZoneRegistry.defaultRegistry());
    }

    /**
     * Returns a value with some fields changed.
     *
     * <p>The overrides are applied to the wall clock. A new zone (or fixed offset) keeps the
     * changed wall clock and reads it in that zone. The current period is kept when it is still
     * a candidate for the new wall clock.</p>
     *
     * @param options field overrides.
     * @param registry registry used to look up a new zone or offset.
     * @return changed zoned time.
     * @throws ConflictingZoneSpecException when both zone and offset are given.
     */
    public ZonedTime change(ChangeOptions options, TimeZoneRegistry registry) {
        Objects.requireNonNull(options, "options");
        if (options.hasZone() && options.hasOffset()) {
            throw new ConflictingZoneSpecException("cannot change both offset and zone at the same time: " + options);
        }
        LocalDateTime changed = options.applyTo(local());

        TimeZoneRef newZone = zone;
        if (options.hasZone()) {
            newZone = Objects.requireNonNull(registry, "registry").findZone(options.getZone());
        } else if (options.hasOffset()) {
            newZone = Objects.requireNonNull(registry, "registry").findZone(options.resolveOffsetSeconds());
        }
        return wrapLocal(changed, newZone);
    }

    private ZonedTime wrapLocal(LocalDateTime newLocal) {
        return wrapLocal(newLocal, zone);
    }

    private ZonedTime wrapLocal(LocalDateTime newLocal, TimeZoneRef targetZone) {
        return new ZonedTime(null, targetZone, newLocal, period());
    }

    /**
     * Applies a built-in local-time operation.
     *
     * @see #send(String, LocalTimeOperations)
     */
    public Object send(String operationId) {
        return send(operationId, LocalTimeOperations.defaultRegistry());
    }

    /**
     * Applies a named operation to the local wall clock.
     *
     * <p>A {@link LocalDateTime} result is wrapped into this zone, keeping the current period
     * when it is still valid; a {@link LocalTimeRange} becomes a {@link ZonedTimeRange}; any
     * other result is returned unchanged.</p>
     *
     * @param operationId operation id.
     * @param operations registry to look the operation up in.
     * @return wrapped operation result.
     * @throws UnsupportedTimeOperationException when the operation is unknown or unsupported.
     */
    public Object send(String operationId, LocalTimeOperations operations) {
        LocalTimeOperation operation = Objects.requireNonNull(operations, "operations").operation(operationId);
        if (operation == null) {
            throw new UnsupportedTimeOperationException("undefined operation '" + operationId + "' for " + inspect());
        }
        Object result;
        try {
            result = operation.apply(local());
        } catch (UnsupportedOperationException | UnsupportedTemporalTypeException ex) {
            String message = String.valueOf(ex.getMessage()).replace(local().toString(), inspect());
            throw new UnsupportedTimeOperationException(message, ex);
        }
        return wrapResult(result);
    }

    private Object wrapResult(Object result) {
        if (result instanceof LocalDateTime) {
            return wrapLocal((LocalDateTime) result);
        }
        if (result instanceof LocalTimeRange) {
            LocalTimeRange range = (LocalTimeRange) result;
            return new ZonedTimeRange(wrapLocal(range.begin()), wrapLocal(range.end()));
        }
        return result;
    }

    public int year() {
        return local().getYear();
    }

    public int month() {
        return local().getMonthValue();
    }

    public int day() {
        return local().getDayOfMonth();
    }

    @Override
    public int dayOfMonth() {
        return day();
    }

    public int hour() {
        return local().getHour();
    }

    public int minute() {
        return local().getMinute();
    }

    public int second() {
        return local().getSecond();
    }

    public int nanosecond() {
        return local().getNano();
    }

    public DayOfWeek dayOfWeek() {
        return local().getDayOfWeek();
    }

    public int dayOfYear() {
        return local().getDayOfYear();
    }

    public ZonedTime beginningOfDay() {
        return (ZonedTime) send(LocalTimeOperations.BEGINNING_OF_DAY);
    }

    public ZonedTime endOfDay() {
        return (ZonedTime) send(LocalTimeOperations.END_OF_DAY);
    }

    public ZonedTime beginningOfWeek() {
        return (ZonedTime) send(LocalTimeOperations.BEGINNING_OF_WEEK);
    }

    public ZonedTime beginningOfMonth() {
        return (ZonedTime) send(LocalTimeOperations.BEGINNING_OF_MONTH);
    }

    public ZonedTime endOfMonth() {
        return (ZonedTime) send(LocalTimeOperations.END_OF_MONTH);
    }

    public ZonedTime beginningOfYear() {
        return (ZonedTime) send(LocalTimeOperations.BEGINNING_OF_YEAR);
    }

    public ZonedTime tomorrow() {
        return (ZonedTime) send(LocalTimeOperations.TOMORROW);
    }

    public ZonedTime yesterday() {
        return (ZonedTime) send(LocalTimeOperations.YESTERDAY);
    }

    public ZonedTimeRange allDay() {
        return (ZonedTimeRange) send(LocalTimeOperations.ALL_DAY);
    }

    /**
     * Renders a strftime pattern; {@code %Z} becomes the zone abbreviation.
     */
    @Override
    public String strftime(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return Strftime.format(substituteZoneName(pattern, abbreviation()), toOffsetDateTime());
    }

    private static String substituteZoneName(String pattern, String abbreviation) {
        String escaped = abbreviation.replace("%", "%%");
        StringBuilder out = new StringBuilder(pattern.length() + escaped.length());
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '%' && i + 1 < pattern.length()) {
                char next = pattern.charAt(i + 1);
                if (next == 'Z') {
                    out.append(escaped);
                } else {
                    out.append(c).append(next);
                }
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    @Override
    public String formattedOffset(boolean colon, String alternateUtc) {
        if (alternateUtc != null && isUtcZone()) {
            return alternateUtc;
        }
        return TimeUtils.formatOffset(utcOffsetSeconds(), colon, null);
    }

    @Override
    public String iso8601(int fractionDigits) {
        String pattern = fractionDigits > 0 ? "%Y-%m-%dT%H:%M:%S.%" + fractionDigits + "N" : "%Y-%m-%dT%H:%M:%S";
        return Strftime.format(pattern, toOffsetDateTime()) + formattedOffset(true, "Z");
    }

    public String xmlschema() {
        return iso8601(0);
    }

    /**
     * Renders RFC 1123 in GMT, as used by HTTP headers.
     */
    public String httpdate() {
        return toUtcTime().strftime("%a, %d %b %Y %H:%M:%S GMT");
    }

    public String rfc2822() {
        return strftime("%a, %d %b %Y %H:%M:%S %z");
    }

    /**
     * Renders date, time with nanoseconds, abbreviation and offset, for example
     * {@code Sat, 10 Feb 2007 15:30:45.000000000 EST -05:00}.
     */
    public String inspect() {
        return Strftime.format(INSPECT_PATTERN, toOffsetDateTime()) + " " + abbreviation() + " " + formattedOffset(true, null);
    }

    /**
     * Renders with a built-in named format.
     *
     * @see #toString(String, TimeFormats)
     */
    public String toString(String formatName) {
        return toString(formatName, TimeFormats.defaultFormats());
    }

    /**
     * Renders with a named format. {@code db} renders the UTC instant; unknown names render
     * the default format.
     */
    public String toString(String formatName, TimeFormats formats) {
        if (TimeFormats.DB.equals(formatName)) {
            return toUtcTime().toString(TimeFormats.DB);
        }
        String rendered = Objects.requireNonNull(formats, "formats").render(formatName, this);
        return rendered != null ? rendered : toString();
    }

    /**
     * Renders {@code YYYY-MM-DD HH:MM:SS +HH:MM}, or {@code YYYY-MM-DD HH:MM:SS UTC} at offset zero.
     */
    @Override
    public String toString() {
        return Strftime.format(DEFAULT_PATTERN, toOffsetDateTime()) + " "
                + TimeUtils.formatOffset(utcOffsetSeconds(), true, UTC_SUFFIX);
    }

    /**
     * Returns whether {@code other} is time-like and denotes exactly this instant.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TimeLike)) {
            return false;
        }
        return utc().equals(((TimeLike) other).toInstant());
    }

    @Override
    public int hashCode() {
        return utc().hashCode();
    }
}
