package diffstore.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;
import diffstore.codec.CodecException;
import diffstore.codec.Decoder;
import diffstore.codec.ValueCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonValueCodecTest {

    record Order(String id, LocalDate placed, Instant updated, List<String> lines) {}

    static final class Plain {
        private String name;
        private int count;

        Plain() {
        }

        Plain(String name, int count) {
            this.name = name;
            this.count = count;
        }
    }

    private final JacksonValueCodec codec = new JacksonValueCodec();

    @Test
    void recordRoundTripsWithJavaTime() {
        Order order = new Order("o-1", LocalDate.of(2024, 5, 1),
                Instant.parse("2024-05-01T10:15:30Z"), List.of("a", "b"));

        byte[] payload = codec.encode(order);

        String json = new String(payload, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"placed\":\"2024-05-01\""), json);
        assertTrue(json.contains("\"updated\":\"2024-05-01T10:15:30Z\""), json);
        assertEquals(order, codec.decoder(payload).decode(Order.class));
    }

    @Test
    void fieldsAreReadWithoutAccessors() {
        byte[] payload = codec.encode(new Plain("widget", 3));

        Plain decoded = codec.decoder(payload).decode(Plain.class);

        assertEquals("widget", decoded.name);
        assertEquals(3, decoded.count);
    }

    @Test
    void decodesGenericType() {
        byte[] payload = codec.encode(Map.of("a", List.of(1, 2), "b", List.of()));

        Map<String, List<Integer>> decoded = codec.decoder(payload)
                .decode(new TypeReference<Map<String, List<Integer>>>() { }.getType());

        assertEquals(List.of(1, 2), decoded.get("a"));
        assertEquals(List.of(), decoded.get("b"));
    }

    @Test
    void unknownPropertiesAreIgnored() {
        byte[] payload = "{\"name\":\"x\",\"count\":1,\"extra\":true}".getBytes(StandardCharsets.UTF_8);

        Plain decoded = codec.decoder(payload).decode(Plain.class);

        assertEquals("x", decoded.name);
    }

    @Test
    void bytesReturnsCopyOfPayload() {
        byte[] payload = codec.encode("text");
        Decoder decoder = codec.decoder(payload);

        byte[] copy = decoder.bytes();
        copy[0] = 0;

        assertArrayEquals(payload, decoder.bytes());
    }

    @Test
    void malformedPayloadThrowsCodecException() {
        Decoder decoder = codec.decoder("{not json".getBytes(StandardCharsets.UTF_8));

        CodecException ex = assertThrows(CodecException.class, () -> decoder.decode(Plain.class));
        assertTrue(ex.getMessage().contains(Plain.class.getName()));
        assertNotNull(ex.getCause());
    }

    @Test
    void unencodableValueThrowsCodecException() {
        Object selfReferencing = new Object() {
            @SuppressWarnings("unused")
            private final Object self = this;
        };

        assertThrows(CodecException.class, () -> codec.encode(selfReferencing));
    }

    @Test
    void nameReflectsFormat() {
        assertEquals("jackson-json", codec.name());
        assertEquals("jackson-json", new JacksonValueCodec(JsonMapper.builder().build()).name());
    }

    @Test
    void registeredAsDefaultCodec() {
        assertInstanceOf(JacksonValueCodec.class, ValueCodec.getDefault());
    }

    @Test
    void nullMapperThrows() {
        assertThrows(NullPointerException.class, () -> new JacksonValueCodec(null));
        assertThrows(NullPointerException.class, () -> codec.decoder(null));
    }
}
