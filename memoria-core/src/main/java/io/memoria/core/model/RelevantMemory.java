package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * A retrieved memory scored against the current message, as handed over by the retrieval step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelevantMemory(
    String id,
    String content,
    String type,
    String context,
    double relevance,
    String tier,
    @JsonAlias({"created_at"}) Instant createdAt
) {
    public static final String IDENTITY_TYPE = "name";
    public static final String IDENTITY_CONTEXT = "identity";

    public RelevantMemory {
        content = content == null ? "" : content;
        type = type == null ? "" : type;
        context = context == null ? "" : context;
        tier = tier == null || tier.isBlank() ? "working" : tier;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean identity() {
        return IDENTITY_TYPE.equals(type) || IDENTITY_CONTEXT.equals(context);
    }
}
