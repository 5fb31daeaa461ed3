package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageRole {
    @JsonProperty("user")
    USER,
    @JsonProperty("assistant")
    ASSISTANT
}
