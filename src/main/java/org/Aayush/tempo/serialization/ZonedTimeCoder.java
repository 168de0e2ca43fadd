package org.Aayush.tempo.serialization;

import lombok.experimental.UtilityClass;
import org.Aayush.tempo.time.InvalidSerializedFormException;
import org.Aayush.tempo.time.UtcTime;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.zone.TimeZoneRef;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.Aayush.tempo.zone.UnknownTimeZoneException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Object-tree form of a zoned time: an ordered map with keys {@code utc}, {@code zone} and
 * {@code time}.
 *
 * <p>The UTC instant is authoritative on decode. The {@code time} entry is optional and only
 * kept when it agrees with the instant.</p>
 */
@UtilityClass
public final class ZonedTimeCoder {
    public static final String UTC_KEY = "utc";
    public static final String ZONE_KEY = "zone";
    public static final String TIME_KEY = "time";

    /**
     * Encodes a zoned time.
     *
     * @param time value to encode.
     * @return unmodifiable ordered map of {@code utc} (Instant), {@code zone} (String) and
     * {@code time} (LocalDateTime).
     */
    public static Map<String, Object> encode(ZonedTime time) {
        Objects.requireNonNull(time, "time");
        LinkedHashMap<String, Object> encoded = new LinkedHashMap<>(4);
        encoded.put(UTC_KEY, time.utc());
        encoded.put(ZONE_KEY, time.zone().name());
        encoded.put(TIME_KEY, time.local());
        return Collections.unmodifiableMap(encoded);
    }

    /**
     * Decodes with the default zone registry.
     */
    public static ZonedTime decode(Map<String, ?> encoded) {
        return decode(encoded, TimeZoneRegistry.defaultRegistry());
    }

    /**
     * Decodes an encoded map.
     *
     * <p>{@code utc} may be an {@link Instant}, a {@link UtcTime} or ISO-8601 instant text;
     * {@code zone} a {@link TimeZoneRef} or zone name; {@code time} a {@link LocalDateTime}
     * or ISO-8601 local text.</p>
     *
     * @param encoded encoded map.
     * @param registry registry used to look the zone up.
     * @return decoded zoned time.
     * @throws InvalidSerializedFormException when an entry is missing, mistyped or unparsable.
     */
    public static ZonedTime decode(Map<String, ?> encoded, TimeZoneRegistry registry) {
        if (encoded == null) {
            throw new InvalidSerializedFormException("encoded zoned time cannot be null");
        }
        Objects.requireNonNull(registry, "registry");
        Instant utc = readInstant(encoded.get(UTC_KEY));
        TimeZoneRef zone = readZone(encoded.get(ZONE_KEY), registry);
        LocalDateTime local = readLocal(encoded.get(TIME_KEY));
        return ZonedTime.restore(utc, zone, local);
    }

    private static Instant readInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof UtcTime) {
            return ((UtcTime) value).toInstant();
        }
        if (value instanceof CharSequence) {
            try {
                return Instant.parse((CharSequence) value);
            } catch (DateTimeParseException ex) {
                throw new InvalidSerializedFormException("invalid " + UTC_KEY + " value: " + value, ex);
            }
        }
        throw new InvalidSerializedFormException(describe(UTC_KEY, value));
    }

    private static TimeZoneRef readZone(Object value, TimeZoneRegistry registry) {
        try {
            if (value instanceof TimeZoneRef) {
                return registry.findZone((TimeZoneRef) value);
            }
            if (value instanceof CharSequence) {
                return registry.findZone(value.toString());
            }
        } catch (UnknownTimeZoneException ex) {
            throw new InvalidSerializedFormException("invalid " + ZONE_KEY + " value: " + value, ex);
        }
        throw new InvalidSerializedFormException(describe(ZONE_KEY, value));
    }

    private static LocalDateTime readLocal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof CharSequence) {
            try {
                return LocalDateTime.parse((CharSequence) value);
            } catch (DateTimeParseException ex) {
                throw new InvalidSerializedFormException("invalid " + TIME_KEY + " value: " + value, ex);
            }
        }
        throw new InvalidSerializedFormException(describe(TIME_KEY, value));
    }

    private static String describe(String key, Object value) {
        if (value == null) {
            return "missing " + key + " entry";
        }
        return "unsupported " + key + " value type: " + value.getClass().getName();
    }
}
