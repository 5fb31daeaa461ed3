package io.memoria.core.context;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum LayerKind {
    IMMEDIATE("immediate"),
    SESSION_SUMMARY("sessionSummary"),
    PROFILE("profile"),
    CALENDAR("calendar"),
    PAST_CONVERSATIONS("pastConversations");

    private final String key;

    LayerKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static Optional<LayerKind> fromKey(String key) {
        for (LayerKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
