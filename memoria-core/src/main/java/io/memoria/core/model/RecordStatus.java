package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecordStatus {
    @JsonProperty("active")
    ACTIVE,
    @JsonProperty("inactive")
    INACTIVE
}
