package diffstore.jackson;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import diffstore.codec.CodecException;
import diffstore.codec.Decoder;
import diffstore.codec.ValueCodec;

import java.lang.reflect.Type;
import java.util.Locale;
import java.util.Objects;

/**
 * Jackson implementation of {@link ValueCodec}.
 *
 * <p>The default mapper writes JSON, reads fields directly (so plain objects without
 * getters round-trip the same way they are fingerprinted), writes {@code java.time}
 * values as ISO text and ignores unknown properties on read. Pass any other
 * {@link ObjectMapper}, for instance one over a Smile or CBOR factory, to change the
 * payload format.
 *
 * <p>Registered in {@code META-INF/services/diffstore.codec.ValueCodec}, so it becomes
 * {@link ValueCodec#getDefault()} when this module is on the class path.
 */
public final class JacksonValueCodec implements ValueCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default JSON mapper.
     */
    public JacksonValueCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     *
     * @param mapper the ObjectMapper to use
     */
    public JacksonValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds the mapper used by {@link #JacksonValueCodec()}.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String name() {
        return "jackson-" + mapper.getFactory().getFormatName().toLowerCase(Locale.ROOT);
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            String type = value == null ? "null" : value.getClass().getName();
            throw new CodecException("Failed to encode value of type " + type, e);
        }
    }

    @Override
    public Decoder decoder(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new JacksonDecoder(payload);
    }

    private final class JacksonDecoder implements Decoder {
        private final byte[] payload;

        private JacksonDecoder(byte[] payload) {
            this.payload = payload;
        }

        @Override
        public <T> T decode(Class<T> type) {
            Objects.requireNonNull(type, "type");
            try {
                return mapper.readValue(payload, type);
            } catch (Exception e) {
                throw new CodecException("Failed to decode payload to " + type.getName(), e);
            }
        }

        @Override
        public <T> T decode(Type type) {
            Objects.requireNonNull(type, "type");
            JavaType javaType = mapper.getTypeFactory().constructType(type);
            try {
                return mapper.readValue(payload, javaType);
            } catch (Exception e) {
                throw new CodecException("Failed to decode payload to " + javaType, e);
            }
        }

        @Override
        public byte[] bytes() {
            return payload.clone();
        }
    }
}
