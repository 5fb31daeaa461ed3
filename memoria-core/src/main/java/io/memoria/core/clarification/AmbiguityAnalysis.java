package io.memoria.core.clarification;

import java.util.List;
import java.util.Map;

public record AmbiguityAnalysis(List<AmbiguitySuggestion> suggestions, Map<String, String> resolvedSlots, String analysis) {

    public AmbiguityAnalysis {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        resolvedSlots = resolvedSlots == null ? Map.of() : Map.copyOf(resolvedSlots);
        analysis = analysis == null ? "" : analysis;
    }

    public static AmbiguityAnalysis empty(String analysis) {
        return new AmbiguityAnalysis(List.of(), Map.of(), analysis);
    }
}
