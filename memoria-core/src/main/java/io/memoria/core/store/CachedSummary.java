package io.memoria.core.store;

import java.time.Instant;
import java.util.Objects;

public record CachedSummary(String summary, int messageCount, Instant generatedAt) {

    public CachedSummary {
        summary = summary == null ? "" : summary;
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }
}
