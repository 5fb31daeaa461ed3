package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TurnAction {
    @JsonProperty("ask")
    ASK,
    @JsonProperty("proceed")
    PROCEED,
    @JsonProperty("savePartial")
    SAVE_PARTIAL,
    @JsonProperty("reject")
    REJECT
}
