package io.memoria.core.disclosure;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the upstream intent signal. Accepts a plain string or an object carrying a string
 * {@code primary}; anything else counts as no intent. Intent is never inferred here.
 */
public final class IntentNormalizer {

    private IntentNormalizer() {
    }

    public static Optional<String> normalize(JsonNode intent) {
        if (intent == null || intent.isNull() || intent.isMissingNode()) {
            return Optional.empty();
        }
        if (intent.isTextual()) {
            return nonBlank(intent.asText());
        }
        if (intent.isObject() && intent.path("primary").isTextual()) {
            return nonBlank(intent.path("primary").asText());
        }
        return Optional.empty();
    }

    public static Optional<String> normalize(String intent) {
        return intent == null ? Optional.empty() : nonBlank(intent);
    }

    private static Optional<String> nonBlank(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
    }
}
