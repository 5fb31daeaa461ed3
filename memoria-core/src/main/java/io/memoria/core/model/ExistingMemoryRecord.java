package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExistingMemoryRecord(
    String id,
    String content,
    String type,
    Map<String, Object> slots,
    RecordStatus status,
    @JsonAlias({"created_at"}) Instant createdAt,
    @JsonAlias({"updated_at"}) Instant updatedAt
) {

    public ExistingMemoryRecord {
        Objects.requireNonNull(id, "id must not be null");
        content = content == null ? "" : content;
        type = type == null ? "" : type;
        slots = slots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slots));
        status = status == null ? RecordStatus.ACTIVE : status;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static ExistingMemoryRecord active(String id, String content, String type, Instant createdAt) {
        return new ExistingMemoryRecord(id, content, type, Map.of(), RecordStatus.ACTIVE, createdAt, createdAt);
    }

    public boolean active() {
        return status == RecordStatus.ACTIVE;
    }
}
