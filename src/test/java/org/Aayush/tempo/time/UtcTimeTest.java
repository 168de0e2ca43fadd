package org.Aayush.tempo.time;

import org.Aayush.tempo.core.time.TimeSpan;
import org.Aayush.tempo.zone.TimeZoneRef;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("UtcTime Tests")
class UtcTimeTest {
    private static final UtcTime TIME = UtcTime.of(2007, 2, 10, 20, 30, 45);

    @Test
    @DisplayName("Fields are read as UTC")
    void testFieldsReadAsUtc() {
        assertEquals(Instant.parse("2007-02-10T20:30:45Z"), TIME.toInstant());
        assertEquals(1_171_139_445L, TIME.toEpochSecond());
        assertEquals(0, TIME.utcOffsetSeconds());
        assertEquals(LocalDateTime.of(2007, 2, 10, 20, 30, 45), TIME.toLocalDateTime());
        assertEquals(TIME, UtcTime.ofEpochSecond(1_171_139_445L));
    }

    @Test
    @DisplayName("Default rendering ends with UTC")
    void testToString() {
        assertEquals("2007-02-10 20:30:45 UTC", TIME.toString());
        assertEquals("2007-02-10 20:30:45", TIME.toString("db"));
        assertEquals("2007-02-10 20:30:45 UTC", TIME.toString("stardate"));
        assertEquals("2007-02-10T20:30:45.000Z", TIME.iso8601(3));
        assertEquals("Z", TIME.formattedOffset(true, "Z"));
    }

    @Test
    @DisplayName("Calendar and clock arithmetic coincide in UTC")
    void testArithmetic() {
        assertEquals(UtcTime.of(2007, 3, 10, 20, 30, 45), TIME.plus(TimeSpan.months(1)));
        assertEquals(UtcTime.of(2007, 2, 11, 20, 30, 45), TIME.plus(TimeSpan.hours(24)));
        assertEquals(TIME.plus(TimeSpan.days(1)), TIME.plus(Duration.ofDays(1)));
        assertEquals(UtcTime.of(2007, 2, 10, 20, 29, 45), TIME.plusSeconds(-60));
        assertEquals(UtcTime.of(2007, 1, 10, 20, 30, 45), TIME.minus(TimeSpan.months(1)));
        assertEquals(3_600.0d, TIME.plusSeconds(3_600).minus(TIME), 1e-9);
    }

    @Test
    @DisplayName("Equality is symmetric with zoned times")
    void testEqualitySymmetricWithZonedTime() {
        TimeZoneRef newYork = TimeZoneRegistry.defaultRegistry().findZone("America/New_York");
        ZonedTime zoned = TIME.inTimeZone(newYork);

        assertEquals(TIME, zoned);
        assertEquals(zoned, TIME);
        assertEquals(TIME.hashCode(), zoned.hashCode());
        assertEquals(0, TIME.compareTo(zoned));
        assertNotEquals(TIME, TIME.plusSeconds(1));
        assertTrue(TIME.isBefore(TIME.plusSeconds(1)));
    }

    @Test
    @DisplayName("Coercion keeps the instant")
    void testFrom() {
        assertSame(TIME, UtcTime.from(TIME));
        ZonedTime zoned = TIME.inTimeZone(TimeZoneRegistry.defaultRegistry().findZone("Asia/Kolkata"));
        assertEquals(TIME.toInstant(), UtcTime.from(zoned).toInstant());
    }
}
