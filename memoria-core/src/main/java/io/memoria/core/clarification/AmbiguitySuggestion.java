package io.memoria.core.clarification;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Objects;

public record AmbiguitySuggestion(
    String slotId,
    String issue,
    String question,
    String reason,
    Priority priority,
    String resolvedValue
) {

    public AmbiguitySuggestion {
        Objects.requireNonNull(slotId, "slotId must not be null");
        Objects.requireNonNull(question, "question must not be null");
        issue = issue == null || issue.isBlank() ? "ambiguous" : issue;
        reason = reason == null ? "" : reason;
        priority = priority == null ? Priority.MEDIUM : priority;
    }

    public boolean resolvable() {
        return resolvedValue != null && !resolvedValue.isBlank();
    }

    public enum Priority {
        @JsonProperty("high")
        HIGH,
        @JsonProperty("medium")
        MEDIUM,
        @JsonProperty("low")
        LOW;

        /**
         * Absent priorities read as medium; unrecognised ones as low so they are never asked.
         */
        public static Priority fromLabel(String label) {
            if (label == null || label.isBlank()) {
                return MEDIUM;
            }
            return switch (label.trim().toLowerCase(Locale.ROOT)) {
                case "high" -> HIGH;
                case "medium" -> MEDIUM;
                default -> LOW;
            };
        }

        public boolean worthAsking() {
            return this == HIGH || this == MEDIUM;
        }
    }
}
