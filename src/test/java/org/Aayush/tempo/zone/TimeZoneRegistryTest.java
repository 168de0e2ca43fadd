package org.Aayush.tempo.zone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TimeZoneRegistry Tests")
class TimeZoneRegistryTest {

    @Test
    @DisplayName("Named zones are created once and shared")
    void testNamedZoneShared() {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        TimeZoneRef first = registry.findZone("America/New_York");
        TimeZoneRef second = registry.findZone(" America/New_York ");

        assertSame(first, second);
        assertEquals("America/New_York", first.name());
        assertEquals(ZoneId.of("America/New_York"), first.zoneId());
        assertTrue(registry.cachedZoneNames().contains("America/New_York"));
    }

    @ParameterizedTest
    @CsvSource({
            "-05:00, -05:00",
            "+0530, +05:30",
            "+09, +09:00",
            "+00:00, UTC",
            "Z, UTC"
    })
    @DisplayName("Offset text maps to fixed-offset zones")
    void testOffsetText(String text, String expectedName) {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        assertEquals(expectedName, registry.findZone(text).name());
    }

    @Test
    @DisplayName("Offset seconds map to fixed-offset zones, zero to UTC")
    void testOffsetSeconds() {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        assertSame(registry.utc(), registry.findZone(0));
        assertEquals("UTC", registry.utc().name());
        assertEquals("-05:00", registry.findZone(-18_000).name());
        assertSame(registry.findZone(-18_000), registry.findZone("-05:00"));
    }

    @Test
    @DisplayName("Zone references pass through and null names resolve to null")
    void testPassThroughAndNull() {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        TimeZoneRef zone = registry.findZone("Europe/Paris");
        assertSame(zone, registry.findZone(zone));
        assertNull(registry.findZone((String) null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Mars/Olympus_Mons", "", "   ", "+19:00"})
    @DisplayName("Unknown names and invalid offsets are rejected")
    void testUnknownZonesRejected(String name) {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        assertThrows(UnknownTimeZoneException.class, () -> registry.findZone(name));
    }

    @Test
    @DisplayName("Offset seconds beyond 18 hours are rejected")
    void testOffsetSecondsOutOfRange() {
        TimeZoneRegistry registry = new TimeZoneRegistry();
        assertThrows(UnknownTimeZoneException.class, () -> registry.findZone(19 * 3_600));
    }

    @Test
    @DisplayName("Default registry is shared")
    void testDefaultRegistryShared() {
        assertSame(TimeZoneRegistry.defaultRegistry(), TimeZoneRegistry.defaultRegistry());
        assertSame(
                TimeZoneRegistry.defaultRegistry().findZone("Asia/Tokyo"),
                TimeZoneRegistry.defaultRegistry().findZone("Asia/Tokyo")
        );
    }
}
