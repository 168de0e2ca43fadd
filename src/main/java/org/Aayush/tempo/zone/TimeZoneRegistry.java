package org.Aayush.tempo.zone;

import org.Aayush.tempo.core.time.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Lookup of shared {@link TimeZoneRef} instances by zone name or UTC offset.
 *
 * <p>References are created once per name and reused, so every zoned time in a zone shares
 * the same resolver and period cache.</p>
 */
public final class TimeZoneRegistry {
    public static final String UTC = "UTC";

    private static final Logger logger = LogManager.getLogger();
    private static final Pattern OFFSET_PATTERN = Pattern.compile("[+-]\\d{1,2}(:?\\d{2}(:?\\d{2})?)?|Z");
    private static final TimeZoneRegistry DEFAULT = new TimeZoneRegistry();

    private final Locale abbreviationLocale;
    private final ConcurrentMap<String, TimeZoneRef> zonesByName = new ConcurrentHashMap<>();

    /**
     * Creates a registry with English abbreviations.
     */
    public TimeZoneRegistry() {
        this(Locale.ENGLISH);
    }

    /**
     * Creates a registry.
     *
     * @param abbreviationLocale locale of short zone names reported by periods.
     */
    public TimeZoneRegistry(Locale abbreviationLocale) {
        this.abbreviationLocale = Objects.requireNonNull(abbreviationLocale, "abbreviationLocale");
    }

    /**
     * Returns zone by name ({@code Europe/Paris}, {@code UTC}) or offset ({@code -05:00}),
     * or {@code null} when the argument is {@code null}.
     *
     * @param nameOrOffset zone name or offset text.
     * @return shared zone reference.
     * @throws UnknownTimeZoneException when the name is not a known zone.
     */
    public TimeZoneRef findZone(String nameOrOffset) {
        if (nameOrOffset == null) {
            return null;
        }
        String normalized = nameOrOffset.trim();
        if (normalized.isEmpty()) {
            throw new UnknownTimeZoneException("zone name must be non-blank");
        }
        if (OFFSET_PATTERN.matcher(normalized).matches()) {
            try {
                return findZone(TimeUtils.parseOffset(normalized));
            } catch (IllegalArgumentException ex) {
                throw new UnknownTimeZoneException("invalid zone offset: " + normalized, ex);
            }
        }
        TimeZoneRef cached = zonesByName.get(normalized);
        if (cached != null) {
            return cached;
        }
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(normalized);
        } catch (DateTimeException ex) {
            throw new UnknownTimeZoneException("unknown time zone: " + normalized, ex);
        }
        return zonesByName.computeIfAbsent(normalized, name -> createZone(name, zoneId));
    }

    /**
     * Returns the fixed-offset zone for a total offset in seconds; offset zero is {@code UTC}.
     *
     * @param offsetSeconds total offset in seconds.
     * @return shared zone reference.
     * @throws UnknownTimeZoneException when the offset is outside +/-18 hours.
     */
    public TimeZoneRef findZone(int offsetSeconds) {
        if (offsetSeconds == 0) {
            return findZone(UTC);
        }
        ZoneOffset offset;
        try {
            offset = ZoneOffset.ofTotalSeconds(offsetSeconds);
        } catch (DateTimeException ex) {
            throw new UnknownTimeZoneException("invalid zone offset seconds: " + offsetSeconds, ex);
        }
        return zonesByName.computeIfAbsent(offset.getId(), name -> createZone(name, offset));
    }

    /**
     * Returns the argument; zone references need no lookup.
     */
    public TimeZoneRef findZone(TimeZoneRef zone) {
        return zone;
    }

    /**
     * Returns the shared UTC zone.
     */
    public TimeZoneRef utc() {
        return findZone(UTC);
    }

    /**
     * Returns names of zones materialized so far.
     */
    public Set<String> cachedZoneNames() {
        return Set.copyOf(zonesByName.keySet());
    }

    /**
     * Returns the shared registry with English abbreviations.
     */
    public static TimeZoneRegistry defaultRegistry() {
        return DEFAULT;
    }

    private TimeZoneRef createZone(String name, ZoneId zoneId) {
        logger.debug("Creating time zone {} backed by {}", name, zoneId);
        return new TimeZoneRef(name, zoneId, new ZoneRulesTimezoneResolver(zoneId, abbreviationLocale));
    }
}
