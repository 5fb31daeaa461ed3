package io.memoria.core.clarification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slot values to apply without asking, and the suggestions to turn into questions.
 */
public record ArbitrationOutcome(Map<String, String> autoApply, List<AmbiguitySuggestion> ask) {

    public ArbitrationOutcome {
        autoApply = autoApply == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(autoApply));
        ask = ask == null ? List.of() : List.copyOf(ask);
    }
}
