package io.memoria.core.clarification;

import io.memoria.core.config.model.LlmSettings;
import io.memoria.core.model.ExtractedMemoryCandidate;
import java.time.LocalDate;

/**
 * Suggests clarifications for one extracted memory. Suggestions are advisory; the
 * {@link SuggestionArbiter} decides what is asked. Failures yield an empty analysis.
 */
public interface AmbiguityAnalyzer {
    AmbiguityAnalysis suggest(ExtractedMemoryCandidate item, String originalMessage, LocalDate today, LlmSettings settings);
}
