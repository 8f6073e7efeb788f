package fr.lapetina.bulkwriter.infrastructure.encoding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.bulkwriter.domain.exception.WriteEncodingException;
import fr.lapetina.bulkwriter.domain.model.DocumentRef;
import fr.lapetina.bulkwriter.domain.model.Precondition;
import fr.lapetina.bulkwriter.domain.model.WriteOperation;
import fr.lapetina.bulkwriter.domain.model.WritePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonWriteEncoderTest {

    private static final DocumentRef DOC = DocumentRef.of("users", "alice");

    private JsonWriteEncoder encoder;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        encoder = new JsonWriteEncoder();
        mapper = new ObjectMapper();
    }

    public record Profile(String name, Integer age, Instant joinedAt) {
    }

    public static class Exploding {
        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    @DisplayName("should encode a create with a NOT_EXISTS precondition")
    void shouldEncodeCreate() throws Exception {
        WritePayload payload = encoder.encode(WriteOperation.CREATE, DOC,
                new Profile("Alice", 30, Instant.parse("2024-01-01T00:00:00Z")));

        assertThat(payload.operation()).isEqualTo(WriteOperation.CREATE);
        assertThat(payload.precondition()).isEqualTo(Precondition.NOT_EXISTS);
        JsonNode body = mapper.readTree(payload.body());
        assertThat(body.get("name").asText()).isEqualTo("Alice");
        assertThat(body.get("joinedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("should omit null fields of a set")
    void shouldOmitNullFields() throws Exception {
        WritePayload payload = encoder.encode(WriteOperation.SET, DOC, new Profile("Alice", null, null));

        assertThat(payload.precondition()).isEqualTo(Precondition.NONE);
        JsonNode body = mapper.readTree(payload.body());
        assertThat(body.has("age")).isFalse();
        assertThat(body.has("joinedAt")).isFalse();
    }

    @Test
    @DisplayName("should derive a sorted update mask from the field map")
    void shouldBuildUpdateMask() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", "active");
        fields.put("age", 31);

        WritePayload payload = encoder.encode(WriteOperation.UPDATE, DOC, fields);

        assertThat(payload.updateMask()).isEqualTo(List.of("age", "status"));
        assertThat(payload.precondition()).isEqualTo(Precondition.EXISTS);
    }

    @Test
    @DisplayName("should encode a delete with an empty body")
    void shouldEncodeDelete() {
        WritePayload payload = encoder.encode(WriteOperation.DELETE, DOC, null);

        assertThat(payload.bodySize()).isZero();
        assertThat(payload.updateMask()).isEmpty();
    }

    @Test
    @DisplayName("should reject data that is not a JSON object")
    void shouldRejectScalarData() {
        assertThatThrownBy(() -> encoder.encode(WriteOperation.SET, DOC, "just a string"))
                .isInstanceOf(WriteEncodingException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> encoder.encode(WriteOperation.SET, DOC, List.of(1, 2)))
                .isInstanceOf(WriteEncodingException.class);
    }

    @Test
    @DisplayName("should reject missing or misplaced data")
    void shouldRejectMissingData() {
        assertThatThrownBy(() -> encoder.encode(WriteOperation.CREATE, DOC, null))
                .isInstanceOf(WriteEncodingException.class);
        assertThatThrownBy(() -> encoder.encode(WriteOperation.UPDATE, DOC, Map.of()))
                .isInstanceOf(WriteEncodingException.class);
        assertThatThrownBy(() -> encoder.encode(WriteOperation.DELETE, DOC, Map.of("a", 1)))
                .isInstanceOf(WriteEncodingException.class);
        assertThatThrownBy(() -> encoder.encode(WriteOperation.SET, null, Map.of("a", 1)))
                .isInstanceOf(WriteEncodingException.class);
    }

    @Test
    @DisplayName("should wrap serialization failures")
    void shouldWrapSerializationFailure() {
        assertThatThrownBy(() -> encoder.encode(WriteOperation.SET, DOC, new Exploding()))
                .isInstanceOf(WriteEncodingException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
