package org.Aayush.tempo.zone;

import org.Aayush.tempo.core.time.TimeUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link TimezoneResolver} backed by the JDK tz database ({@link ZoneRules}).
 *
 * <p>Abbreviations are the short zone names of the configured locale. Fixed-offset zones
 * report {@code UTC} at offset zero and {@code +HH:MM} otherwise. Each period is bounded by
 * the transitions around it, so equal periods denote the same window of the zone's history.</p>
 */
public final class ZoneRulesTimezoneResolver implements TimezoneResolver {
    private static final String UTC_ABBREVIATION = "UTC";

    private final ZoneId zoneId;
    private final ZoneRules rules;
    private final DateTimeFormatter abbreviationFormatter;
    private final PeriodCache periodCache;

    /**
     * Creates a resolver with English abbreviations.
     *
     * @param zoneId zone to resolve against.
     */
    public ZoneRulesTimezoneResolver(ZoneId zoneId) {
        this(zoneId, Locale.ENGLISH);
    }

    /**
     * Creates a resolver.
     *
     * @param zoneId zone to resolve against.
     * @param abbreviationLocale locale of short zone names.
     */
    public ZoneRulesTimezoneResolver(ZoneId zoneId, Locale abbreviationLocale) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.rules = zoneId.getRules();
        this.abbreviationFormatter = DateTimeFormatter.ofPattern("zzz",
                Objects.requireNonNull(abbreviationLocale, "abbreviationLocale"));
        this.periodCache = new PeriodCache(zoneId, this::buildPeriod);
    }

    @Override
    public Period periodForUtc(Instant utc) {
        return periodCache.period(utc);
    }

    @Override
    public List<Period> periodsForLocal(LocalDateTime local) {
        Objects.requireNonNull(local, "local");
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        List<Period> periods = new ArrayList<>(offsets.size());
        for (ZoneOffset offset : offsets) {
            periods.add(periodForUtc(local.toInstant(offset)));
        }
        return List.copyOf(periods);
    }

    /**
     * Returns the zone id this resolver reads rules from.
     */
    public ZoneId zoneId() {
        return zoneId;
    }

    /**
     * Returns the underlying period cache.
     */
    PeriodCache periodCache() {
        return periodCache;
    }

    private Period buildPeriod(Instant utc) {
        int offsetSeconds = rules.getOffset(utc).getTotalSeconds();
        boolean dst = rules.isDaylightSavings(utc);
        ZoneOffsetTransition next = rules.nextTransition(utc);
        return Period.of(
                offsetSeconds,
                abbreviation(utc, offsetSeconds),
                dst,
                windowStart(utc),
                next == null ? null : next.getInstant()
        );
    }

    // previousTransition is strictly before its argument; a transition at utc itself starts this window.
    private Instant windowStart(Instant utc) {
        long second = utc.getEpochSecond();
        Instant probe = second < Instant.MAX.getEpochSecond() ? Instant.ofEpochSecond(second + 1) : utc;
        ZoneOffsetTransition previous = rules.previousTransition(probe);
        return previous == null ? null : previous.getInstant();
    }

    private String abbreviation(Instant utc, int offsetSeconds) {
        if (zoneId instanceof ZoneOffset) {
            return TimeUtils.formatOffset(offsetSeconds, true, UTC_ABBREVIATION);
        }
        return abbreviationFormatter.format(ZonedDateTime.ofInstant(utc, zoneId));
    }
}
