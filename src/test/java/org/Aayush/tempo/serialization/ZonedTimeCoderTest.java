package org.Aayush.tempo.serialization;

import org.Aayush.tempo.time.InvalidSerializedFormException;
import org.Aayush.tempo.time.UtcTime;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.time.ZonedTimeException;
import org.Aayush.tempo.zone.TimeZoneRef;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ZonedTimeCoder Tests")
class ZonedTimeCoderTest {
    private final TimeZoneRegistry registry = new TimeZoneRegistry();
    private final TimeZoneRef newYork = registry.findZone("America/New_York");
    private final ZonedTime time = ZonedTime.fromUtc(Instant.parse("2007-02-10T20:30:45.5Z"), newYork);

    @Test
    @DisplayName("Encoded map is ordered utc, zone, time")
    void testEncodeShape() {
        Map<String, Object> encoded = ZonedTimeCoder.encode(time);
        assertEquals(List.of("utc", "zone", "time"), List.copyOf(encoded.keySet()));
        assertEquals(Instant.parse("2007-02-10T20:30:45.5Z"), encoded.get("utc"));
        assertEquals("America/New_York", encoded.get("zone"));
        assertEquals(LocalDateTime.of(2007, 2, 10, 15, 30, 45, 500_000_000), encoded.get("time"));
    }

    @Test
    @DisplayName("Decoding an encoded map restores an equal value in the same zone")
    void testDecodeEncoded() {
        ZonedTime decoded = ZonedTimeCoder.decode(ZonedTimeCoder.encode(time), registry);
        assertEquals(time, decoded);
        assertSame(newYork, decoded.zone());
        assertEquals(time.local(), decoded.local());
        assertEquals(time.abbreviation(), decoded.abbreviation());
    }

    @Test
    @DisplayName("Fold instants keep their period through decoding")
    void testFoldSurvives() {
        ZonedTime secondPass = ZonedTime.fromUtc(Instant.parse("2014-11-02T06:30:00Z"), newYork);
        ZonedTime decoded = ZonedTimeCoder.decode(ZonedTimeCoder.encode(secondPass), registry);
        assertEquals(secondPass.utc(), decoded.utc());
        assertEquals("EST", decoded.abbreviation());
    }

    @Test
    @DisplayName("Text, UtcTime and zone reference entries are accepted")
    void testDecodeAlternateTypes() {
        Map<String, Object> text = Map.of(
                "utc", "2007-02-10T20:30:45.500Z",
                "zone", "America/New_York",
                "time", "2007-02-10T15:30:45.5"
        );
        Map<String, Object> objects = Map.of(
                "utc", UtcTime.of(Instant.parse("2007-02-10T20:30:45.5Z")),
                "zone", newYork
        );
        assertEquals(time, ZonedTimeCoder.decode(text, registry));
        assertEquals(time, ZonedTimeCoder.decode(objects, registry));
    }

    @Test
    @DisplayName("Instant wins over a disagreeing wall clock")
    void testInstantIsAuthoritative() {
        Map<String, Object> encoded = new HashMap<>(ZonedTimeCoder.encode(time));
        encoded.put("time", LocalDateTime.of(2000, 1, 1, 0, 0));
        ZonedTime decoded = ZonedTimeCoder.decode(encoded, registry);
        assertEquals(LocalDateTime.of(2007, 2, 10, 15, 30, 45, 500_000_000), decoded.local());
    }

    @Test
    @DisplayName("Malformed input is rejected with deterministic reason code")
    void testMalformedInput() {
        assertInvalid(null);
        assertInvalid(Map.of("zone", "America/New_York"));
        assertInvalid(Map.of("utc", "yesterday", "zone", "America/New_York"));
        assertInvalid(Map.of("utc", 1_171_139_445L, "zone", "America/New_York"));
        assertInvalid(Map.of("utc", "2007-02-10T20:30:45Z"));
        assertInvalid(Map.of("utc", "2007-02-10T20:30:45Z", "zone", "Mars/Olympus_Mons"));
        assertInvalid(Map.of("utc", "2007-02-10T20:30:45Z", "zone", "UTC", "time", "noon"));
        assertInvalid(Map.of("utc", "2007-02-10T20:30:45Z", "zone", "UTC", "time", 12));
    }

    private void assertInvalid(Map<String, ?> encoded) {
        InvalidSerializedFormException ex = assertThrows(InvalidSerializedFormException.class,
                () -> ZonedTimeCoder.decode(encoded, registry));
        assertEquals(ZonedTimeException.REASON_INVALID_SERIALIZED_FORM, ex.getReasonCode());
    }
}
