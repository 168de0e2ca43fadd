package org.Aayush.tempo.zone;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Runtime configuration bound once at startup to pick the default zone of an application.
 */
@Value
@Builder
public class ZoneRuntimeConfig {

    /**
     * Default zone name or offset, for example {@code America/New_York} or {@code +05:30}.
     */
    String defaultZoneId;

    /**
     * Locale of zone abbreviations; English when omitted.
     */
    Locale abbreviationLocale;

    /**
     * Returns convenience runtime config defaulting to {@code UTC}.
     */
    public static ZoneRuntimeConfig utc() {
        return ZoneRuntimeConfig.builder()
                .defaultZoneId(TimeZoneRegistry.UTC)
                .build();
    }

    /**
     * Returns convenience runtime config defaulting to {@code zoneId}.
     *
     * @param zoneId default zone name or offset.
     */
    public static ZoneRuntimeConfig zone(String zoneId) {
        return ZoneRuntimeConfig.builder()
                .defaultZoneId(zoneId)
                .build();
    }
}
