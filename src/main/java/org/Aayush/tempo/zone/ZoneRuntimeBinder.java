package org.Aayush.tempo.zone;

import lombok.Builder;
import lombok.Value;
import org.Aayush.tempo.time.ChangeOptions;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.time.ZonedTimeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Startup-only zone runtime binder.
 *
 * <p>This component validates one runtime config, builds the zone registry and resolves the
 * default zone once. The resulting binding is passed explicitly to the code that needs a
 * default zone; nothing is stored globally.</p>
 */
public final class ZoneRuntimeBinder {
    private static final Logger logger = LogManager.getLogger();

    /**
     * Binds one runtime config into an immutable registry and default zone.
     *
     * @param runtimeConfig zone runtime configuration.
     * @return immutable zone runtime binding.
     * @throws ZonedTimeException with {@code CONFIG_REQUIRED} when the config or its default
     * zone is missing, or {@code UNKNOWN_TIME_ZONE} when the default zone cannot be resolved.
     */
    public Binding bind(ZoneRuntimeConfig runtimeConfig) {
        if (runtimeConfig == null) {
            throw new ZonedTimeException(
                    ZonedTimeException.REASON_CONFIG_REQUIRED,
                    "zoneRuntimeConfig must be provided at startup"
            );
        }
        String zoneId = runtimeConfig.getDefaultZoneId();
        if (zoneId == null || zoneId.isBlank()) {
            throw new ZonedTimeException(
                    ZonedTimeException.REASON_CONFIG_REQUIRED,
                    "defaultZoneId must be provided"
            );
        }
        Locale locale = runtimeConfig.getAbbreviationLocale() == null
                ? Locale.ENGLISH
                : runtimeConfig.getAbbreviationLocale();

        TimeZoneRegistry registry = new TimeZoneRegistry(locale);
        TimeZoneRef defaultZone;
        try {
            defaultZone = registry.findZone(zoneId.trim());
        } catch (UnknownTimeZoneException ex) {
            throw new ZonedTimeException(
                    ZonedTimeException.REASON_UNKNOWN_TIME_ZONE,
                    "default zone cannot be resolved: " + zoneId.trim(),
                    ex
            );
        }
        logger.info("Bound default time zone {} with {} abbreviations", defaultZone, locale);
        return Binding.builder()
                .registry(registry)
                .defaultZone(defaultZone)
                .build();
    }

    /**
     * Immutable runtime artifacts produced by {@link ZoneRuntimeBinder}.
     */
    @Value
    @Builder
    public static class Binding {
        /**
         * Registry of shared zone references.
         */
        TimeZoneRegistry registry;
        /**
         * Zone used where callers do not name one.
         */
        TimeZoneRef defaultZone;

        /**
         * Returns the current time of {@code clock} in the default zone.
         */
        public ZonedTime now(Clock clock) {
            return defaultZone.now(clock);
        }

        /**
         * Returns the zoned time of an instant in the default zone.
         */
        public ZonedTime at(Instant utc) {
            return defaultZone.at(utc);
        }

        /**
         * Reads wall-clock fields in the default zone.
         */
        public ZonedTime local(LocalDateTime local) {
            return ZonedTime.fromLocal(Objects.requireNonNull(local, "local"), defaultZone);
        }

        /**
         * Looks a zone up in the bound registry.
         */
        public TimeZoneRef zone(String nameOrOffset) {
            return registry.findZone(nameOrOffset);
        }

        /**
         * Changes fields of a zoned time, looking a new zone or offset up in the bound registry.
         */
        public ZonedTime change(ZonedTime time, ChangeOptions options) {
            return Objects.requireNonNull(time, "time").change(options, registry);
        }
    }
}
