package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CardStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("complete")
    COMPLETE
}
