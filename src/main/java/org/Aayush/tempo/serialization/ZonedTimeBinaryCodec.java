package org.Aayush.tempo.serialization;

import org.Aayush.tempo.time.InvalidSerializedFormException;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.zone.TimeZoneRef;
import org.Aayush.tempo.zone.TimeZoneRegistry;
import org.Aayush.tempo.zone.UnknownTimeZoneException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Compact binary form of a zoned time.
 *
 * <p>Layout (big-endian):</p>
 * <ol>
 * <li>file identifier {@code TMPZ} (4 bytes) and format version (1 byte);</li>
 * <li>UTC epoch seconds (8 bytes) and nanos (4 bytes);</li>
 * <li>zone name length (2 bytes, unsigned) and UTF-8 bytes;</li>
 * <li>local wall clock as epoch seconds read at UTC (8 bytes) and nanos (4 bytes).</li>
 * </ol>
 *
 * <p>Decoding re-derives the value from the UTC instant in the zone looked up by name.</p>
 */
public final class ZonedTimeBinaryCodec {
    public static final int FILE_IDENTIFIER = 0x544D505A;
    public static final byte FORMAT_VERSION = 1;

    private static final int HEADER_SIZE = 5;
    private static final int INSTANT_SIZE = 12;
    private static final int MAX_ZONE_NAME_BYTES = 0xFFFF;

    private final TimeZoneRegistry registry;

    /**
     * Creates a codec over the default zone registry.
     */
    public ZonedTimeBinaryCodec() {
        this(TimeZoneRegistry.defaultRegistry());
    }

    /**
     * Creates a codec.
     *
     * @param registry registry used to look zones up on decode.
     */
    public ZonedTimeBinaryCodec(TimeZoneRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Encodes a zoned time.
     *
     * @param time value to encode.
     * @return buffer positioned at zero, limited to the encoded bytes.
     */
    public ByteBuffer encode(ZonedTime time) {
        Objects.requireNonNull(time, "time");
        byte[] zoneName = time.zone().name().getBytes(StandardCharsets.UTF_8);
        if (zoneName.length > MAX_ZONE_NAME_BYTES) {
            throw new IllegalArgumentException("zone name too long: " + zoneName.length + " bytes");
        }
        Instant utc = time.utc();
        LocalDateTime local = time.local();

        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + INSTANT_SIZE + 2 + zoneName.length + INSTANT_SIZE)
                .order(ByteOrder.BIG_ENDIAN);
        out.putInt(FILE_IDENTIFIER);
        out.put(FORMAT_VERSION);
        out.putLong(utc.getEpochSecond());
        out.putInt(utc.getNano());
        out.putShort((short) zoneName.length);
        out.put(zoneName);
        out.putLong(local.toEpochSecond(ZoneOffset.UTC));
        out.putInt(local.getNano());
        out.flip();
        return out;
    }

    /**
     * Encodes a zoned time into a new byte array.
     */
    public byte[] encodeToBytes(ZonedTime time) {
        ByteBuffer encoded = encode(time);
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }

    /**
     * Decodes a zoned time from the remaining bytes of {@code buffer}. The buffer's position
     * is not changed.
     *
     * @param buffer encoded bytes.
     * @return decoded zoned time.
     * @throws InvalidSerializedFormException when the bytes are not a supported encoding.
     */
    public ZonedTime decode(ByteBuffer buffer) {
        if (buffer == null) {
            throw new InvalidSerializedFormException("buffer cannot be null");
        }
        ByteBuffer bb = buffer.slice().order(ByteOrder.BIG_ENDIAN);
        if (bb.remaining() < HEADER_SIZE) {
            throw new InvalidSerializedFormException("buffer too small for header: " + bb.remaining() + " bytes");
        }
        int identifier = bb.getInt();
        if (identifier != FILE_IDENTIFIER) {
            throw new InvalidSerializedFormException(String.format(
                    "invalid file identifier. Expected 0x%08X, got 0x%08X", FILE_IDENTIFIER, identifier));
        }
        byte version = bb.get();
        if (version != FORMAT_VERSION) {
            throw new InvalidSerializedFormException(
                    "unsupported format version " + version + " (expected " + FORMAT_VERSION + ")");
        }
        try {
            Instant utc = Instant.ofEpochSecond(bb.getLong(), bb.getInt());
            byte[] zoneName = new byte[Short.toUnsignedInt(bb.getShort())];
            bb.get(zoneName);
            LocalDateTime local = LocalDateTime.ofEpochSecond(bb.getLong(), bb.getInt(), ZoneOffset.UTC);
            if (bb.hasRemaining()) {
                throw new InvalidSerializedFormException(bb.remaining() + " trailing bytes after encoded zoned time");
            }
            TimeZoneRef zone = registry.findZone(new String(zoneName, StandardCharsets.UTF_8));
            return ZonedTime.restore(utc, zone, local);
        } catch (BufferUnderflowException ex) {
            throw new InvalidSerializedFormException("truncated zoned time encoding", ex);
        } catch (DateTimeException | UnknownTimeZoneException ex) {
            throw new InvalidSerializedFormException("invalid zoned time encoding: " + ex.getMessage(), ex);
        }
    }

    /**
     * Decodes a zoned time from a byte array.
     */
    public ZonedTime decode(byte[] bytes) {
        if (bytes == null) {
            throw new InvalidSerializedFormException("bytes cannot be null");
        }
        return decode(ByteBuffer.wrap(bytes));
    }
}
