package org.Aayush.tempo.zone;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.tempo.core.time.TimeUtils;
import org.Aayush.tempo.time.ZonedTime;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Named zone shared by every zoned time created in it.
 *
 * <p>Identity is the zone name: two references with the same name are equal even when they
 * were created by different registries.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TimeZoneRef {

    /**
     * Zone name, for example {@code America/New_York} or {@code +05:30}.
     */
    private final String name;

    /**
     * Zone id whose rules back the resolver.
     */
    private final ZoneId zoneId;

    /**
     * Period resolver for this zone.
     */
    private final TimezoneResolver resolver;

    /**
     * Creates a zone reference.
     *
     * @param name zone name.
     * @param zoneId backing zone id.
     * @param resolver period resolver.
     */
    public TimeZoneRef(String name, ZoneId zoneId, TimezoneResolver resolver) {
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("name must be non-blank");
        }
        this.name = normalized;
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Creates a reference named after the zone id, resolved through the JDK tz database.
     */
    public static TimeZoneRef of(ZoneId zoneId) {
        return new TimeZoneRef(zoneId.getId(), zoneId, new ZoneRulesTimezoneResolver(zoneId));
    }

    public Period periodForUtc(Instant utc) {
        return resolver.periodForUtc(utc);
    }

    public Period periodForLocal(LocalDateTime local) {
        return resolver.periodForLocal(local);
    }

    public List<Period> periodsForLocal(LocalDateTime local) {
        return resolver.periodsForLocal(local);
    }

    /**
     * Returns the wall clock of this zone at a UTC instant.
     */
    public LocalDateTime utcToLocal(Instant utc) {
        return TimeUtils.toLocal(utc, periodForUtc(utc).getUtcOffsetSeconds());
    }

    /**
     * Returns the zoned time at a UTC instant.
     */
    public ZonedTime at(Instant utc) {
        return ZonedTime.fromUtc(utc, this);
    }

    /**
     * Returns the zoned time at Unix epoch seconds.
     */
    public ZonedTime at(long epochSeconds) {
        return at(Instant.ofEpochSecond(epochSeconds));
    }

    /**
     * Returns the zoned time for wall-clock fields in this zone.
     */
    public ZonedTime local(int year, int month, int day, int hour, int minute, int second) {
        return local(year, month, day, hour, minute, second, 0);
    }

    /**
     * Returns the zoned time for wall-clock fields in this zone, nanoseconds included.
     */
    public ZonedTime local(int year, int month, int day, int hour, int minute, int second, int nanos) {
        return ZonedTime.fromLocal(LocalDateTime.of(year, month, day, hour, minute, second, nanos), this);
    }

    /**
     * Returns the current time of {@code clock} in this zone.
     */
    public ZonedTime now(Clock clock) {
        return at(Objects.requireNonNull(clock, "clock").instant());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TimeZoneRef)) {
            return false;
        }
        return name.equals(((TimeZoneRef) other).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
