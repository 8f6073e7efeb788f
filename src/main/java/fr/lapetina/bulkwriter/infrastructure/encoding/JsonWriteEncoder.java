package fr.lapetina.bulkwriter.infrastructure.encoding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.bulkwriter.domain.exception.WriteEncodingException;
import fr.lapetina.bulkwriter.domain.model.DocumentRef;
import fr.lapetina.bulkwriter.domain.model.Precondition;
import fr.lapetina.bulkwriter.domain.model.WriteOperation;
import fr.lapetina.bulkwriter.domain.model.WritePayload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Encodes document data as a JSON object using Jackson.
 *
 * <ul>
 *   <li>CREATE: data must serialize to a JSON object; precondition NOT_EXISTS</li>
 *   <li>SET: data must serialize to a JSON object; no precondition</li>
 *   <li>UPDATE: data must be a non-empty map; its keys (sorted) are the update mask;
 *       precondition EXISTS</li>
 *   <li>DELETE: data must be null; empty body</li>
 * </ul>
 */
public final class JsonWriteEncoder implements WriteEncoder {

    private final ObjectMapper objectMapper;

    public JsonWriteEncoder() {
        this(defaultObjectMapper());
    }

    public JsonWriteEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    @Override
    public WritePayload encode(WriteOperation operation, DocumentRef document, Object data) {
        if (operation == null) {
            throw new WriteEncodingException("Operation is required");
        }
        if (document == null) {
            throw new WriteEncodingException("Document reference is required");
        }

        switch (operation) {
            case CREATE:
                return new WritePayload(operation, document, Precondition.NOT_EXISTS, null,
                        encodeObject(document, data));
            case SET:
                return new WritePayload(operation, document, Precondition.NONE, null,
                        encodeObject(document, data));
            case UPDATE:
                return encodeUpdate(document, data);
            case DELETE:
                if (data != null) {
                    throw new WriteEncodingException("Delete of " + document + " must not carry data");
                }
                return new WritePayload(operation, document, Precondition.NONE, null, null);
            default:
                throw new WriteEncodingException("Unsupported operation: " + operation);
        }
    }

    private WritePayload encodeUpdate(DocumentRef document, Object data) {
        if (!(data instanceof Map<?, ?> fields) || fields.isEmpty()) {
            throw new WriteEncodingException("Update of " + document + " needs a non-empty field map");
        }
        List<String> mask = new ArrayList<>(fields.size());
        for (Object key : fields.keySet()) {
            if (!(key instanceof String field) || field.isBlank()) {
                throw new WriteEncodingException("Update of " + document + " has an invalid field name: " + key);
            }
            mask.add(field);
        }
        Collections.sort(mask);
        return new WritePayload(WriteOperation.UPDATE, document, Precondition.EXISTS, mask,
                encodeObject(document, data));
    }

    private byte[] encodeObject(DocumentRef document, Object data) {
        if (data == null) {
            throw new WriteEncodingException("Data for " + document + " is required");
        }
        try {
            JsonNode tree = objectMapper.valueToTree(data);
            if (!tree.isObject()) {
                throw new WriteEncodingException(
                        "Data for " + document + " must encode to a JSON object, got " + tree.getNodeType());
            }
            return objectMapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WriteEncodingException("Cannot encode data for " + document + ": " + e.getMessage(), e);
        }
    }
}
