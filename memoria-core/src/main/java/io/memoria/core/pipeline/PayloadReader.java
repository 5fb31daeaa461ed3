package io.memoria.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memoria.core.model.MalformedInputException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts external JSON payloads into request types at the boundary. Anything that cannot be
 * bound, including values rejected by a record's constructor, becomes a
 * {@link MalformedInputException}.
 */
public final class PayloadReader {
    private final ObjectMapper mapper;

    public PayloadReader() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
    }

    public <T> T read(JsonNode payload, Class<T> type) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedInputException("Expected a JSON object for " + type.getSimpleName());
        }
        try {
            return mapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw malformed(type, e);
        }
    }

    public <T> T read(String payload, Class<T> type) {
        return read(tree(payload), type);
    }

    public <T> T read(Path file, Class<T> type) throws IOException {
        return read(Files.readString(file), type);
    }

    public JsonNode tree(String payload) {
        if (payload == null || payload.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private static MalformedInputException malformed(Class<?> type, Exception cause) {
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof MalformedInputException malformed) {
            return malformed;
        }
        String detail = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return new MalformedInputException("Invalid " + type.getSimpleName() + ": " + detail, cause);
    }
}
