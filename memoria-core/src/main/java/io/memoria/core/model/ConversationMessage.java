package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationMessage(MessageRole role, String content, Instant timestamp) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, null);
    }
}
