package org.Aayush.tempo.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.Aayush.tempo.time.ZonedTime;
import org.Aayush.tempo.zone.TimeZoneRegistry;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson module writing zoned times as {@code {"utc": ..., "zone": ..., "time": ...}}.
 *
 * <p>{@code utc} is an ISO-8601 instant, {@code zone} the zone name and {@code time} the ISO-8601
 * local wall clock. Reading accepts the same shape; {@code time} may be absent.</p>
 */
public class ZonedTimeJacksonModule extends SimpleModule {

    public ZonedTimeJacksonModule() {
        this(TimeZoneRegistry.defaultRegistry());
    }

    /**
     * Creates the module.
     *
     * @param registry registry used to look zones up when reading.
     */
    public ZonedTimeJacksonModule(TimeZoneRegistry registry) {
        super("ZonedTimeModule", Version.unknownVersion());
        Objects.requireNonNull(registry, "registry");
        addSerializer(ZonedTime.class, new ZonedTimeSerializer());
        addDeserializer(ZonedTime.class, new ZonedTimeDeserializer(registry));
    }

    private static class ZonedTimeSerializer extends StdSerializer<ZonedTime> {
        ZonedTimeSerializer() {
            super(ZonedTime.class);
        }

        @Override
        public void serialize(ZonedTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(ZonedTimeCoder.UTC_KEY, value.utc().toString());
            gen.writeStringField(ZonedTimeCoder.ZONE_KEY, value.zone().name());
            gen.writeStringField(ZonedTimeCoder.TIME_KEY, value.local().toString());
            gen.writeEndObject();
        }
    }

    private static class ZonedTimeDeserializer extends StdDeserializer<ZonedTime> {
        private final transient TimeZoneRegistry registry;

        ZonedTimeDeserializer(TimeZoneRegistry registry) {
            super(ZonedTime.class);
            this.registry = registry;
        }

        @Override
        public ZonedTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_OBJECT) {
                return (ZonedTime) ctxt.handleUnexpectedToken(ZonedTime.class, p);
            }
            JsonNode node = p.readValueAsTree();
            Map<String, Object> encoded = new LinkedHashMap<>(4);
            copyText(node, ZonedTimeCoder.UTC_KEY, encoded);
            copyText(node, ZonedTimeCoder.ZONE_KEY, encoded);
            copyText(node, ZonedTimeCoder.TIME_KEY, encoded);
            return ZonedTimeCoder.decode(encoded, registry);
        }

        private static void copyText(JsonNode node, String key, Map<String, Object> encoded) {
            JsonNode field = node.get(key);
            if (field != null && field.isTextual()) {
                encoded.put(key, field.textValue());
            }
        }
    }
}
