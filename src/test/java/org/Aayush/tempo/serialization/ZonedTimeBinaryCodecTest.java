package org.Aayush.tempo.serialization;

import org.Aayush.tempo.time.InvalidSerializedFormException;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ZonedTimeBinaryCodec Tests")
class ZonedTimeBinaryCodecTest {
    private final TimeZoneRegistry registry = new TimeZoneRegistry();
    private final ZonedTimeBinaryCodec codec = new ZonedTimeBinaryCodec(registry);
    private final ZonedTime time = ZonedTime.fromUtc(
            Instant.parse("2007-02-10T20:30:45.123456789Z"), registry.findZone("America/New_York"));

    @Test
    @DisplayName("Layout starts with identifier, version and the UTC instant")
    void testLayout() {
        ByteBuffer encoded = codec.encode(time);
        int zoneBytes = "America/New_York".getBytes(StandardCharsets.UTF_8).length;

        assertEquals(5 + 12 + 2 + zoneBytes + 12, encoded.remaining());
        assertEquals(ZonedTimeBinaryCodec.FILE_IDENTIFIER, encoded.getInt(0));
        assertEquals(ZonedTimeBinaryCodec.FORMAT_VERSION, encoded.get(4));
        assertEquals(1_171_139_445L, encoded.getLong(5));
        assertEquals(123_456_789, encoded.getInt(13));
        assertEquals(zoneBytes, encoded.getShort(17));
    }

    @Test
    @DisplayName("Decoding restores an equal value in the same zone")
    void testDecode() {
        ZonedTime decoded = codec.decode(codec.encodeToBytes(time));
        assertEquals(time, decoded);
        assertEquals(time.zone(), decoded.zone());
        assertEquals(time.local(), decoded.local());
    }

    @Test
    @DisplayName("Decoding leaves the caller's buffer position untouched")
    void testDecodeKeepsPosition() {
        ByteBuffer encoded = codec.encode(time);
        codec.decode(encoded);
        assertEquals(0, encoded.position());
    }

    @Test
    @DisplayName("Fixed-offset zones round through their offset name")
    void testFixedOffsetZone() {
        ZonedTime india = time.inTimeZone(registry.findZone("+05:30"));
        ZonedTime decoded = codec.decode(codec.encode(india));
        assertEquals("+05:30", decoded.zone().name());
        assertEquals(india.local(), decoded.local());
    }

    @Test
    @DisplayName("Wrong identifier, wrong version, truncation and trailing bytes are rejected")
    void testMalformedInput() {
        byte[] valid = codec.encodeToBytes(time);

        byte[] badIdentifier = valid.clone();
        badIdentifier[0] = 'X';
        byte[] badVersion = valid.clone();
        badVersion[4] = 9;
        byte[] truncated = Arrays.copyOf(valid, valid.length - 3);
        byte[] trailing = Arrays.copyOf(valid, valid.length + 1);

        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(badIdentifier));
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(badVersion));
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(truncated));
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(trailing));
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(new byte[2]));
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode((byte[]) null));
    }

    @Test
    @DisplayName("Unknown zone names are rejected")
    void testUnknownZone() {
        ZonedTime epoch = ZonedTime.fromUtc(Instant.EPOCH, registry.findZone("UTC"));
        ByteBuffer encoded = codec.encode(epoch);
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        bytes[19] = 'X';
        assertThrows(InvalidSerializedFormException.class, () -> codec.decode(bytes));
    }
}
