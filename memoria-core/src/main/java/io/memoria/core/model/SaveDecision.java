package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Verdict of the upstream save step. It is only ever read here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SaveDecision(
    boolean saved,
    int savedCount,
    String reason,
    Kind decision,
    List<MemoryCard> pendingCards
) {

    public SaveDecision {
        reason = reason == null ? "" : reason;
        pendingCards = pendingCards == null ? List.of() : List.copyOf(pendingCards);
    }

    public static SaveDecision hold(List<MemoryCard> pendingCards) {
        return new SaveDecision(false, 0, "Waiting for clarification", Kind.HOLD, pendingCards);
    }

    public boolean holding() {
        return decision == Kind.HOLD;
    }

    public enum Kind {
        @JsonProperty("save")
        SAVE,
        @JsonProperty("skip")
        SKIP,
        @JsonProperty("update")
        UPDATE,
        @JsonProperty("ask_user")
        ASK_USER,
        @JsonProperty("keep_both")
        KEEP_BOTH,
        @JsonProperty("reactivate")
        REACTIVATE,
        @JsonProperty("hold")
        HOLD
    }
}
