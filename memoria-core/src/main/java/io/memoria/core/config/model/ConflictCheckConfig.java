package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConflictCheckConfig(
    boolean enabled,
    Similarity similarity,
    LlmSettings llm,
    List<String> categories,
    Behavior behavior,
    Strategy strategy,
    String promptTemplate
) {
    public static final List<String> DEFAULT_CATEGORIES = List.of("location", "job", "relationship", "name", "preference");

    public static final String DEFAULT_PROMPT = """
        You are analyzing whether two pieces of information about a user conflict.

        EXISTING MEMORY: {{existing}}
        NEW INFORMATION: {{new}}

        Determine the relationship between these. Respond with exactly one of:
        - CONFLICT: They directly contradict each other
        - UPDATE: The new info is a temporal update to old info
        - ADDITION: They can both be true simultaneously
        - DUPLICATE: They express the same information

        Respond in JSON format:
        {
          "type": "CONFLICT|UPDATE|ADDITION|DUPLICATE",
          "confidence": 0.0-1.0,
          "reason": "Brief explanation"
        }""";

    public ConflictCheckConfig {
        similarity = similarity == null ? Similarity.defaults() : similarity;
        llm = llm == null ? LlmSettings.gemini(0.2, 200) : llm;
        categories = categories == null ? DEFAULT_CATEGORIES : List.copyOf(categories);
        behavior = behavior == null ? Behavior.defaults() : behavior;
        strategy = strategy == null ? Strategy.FIRST_MATCH : strategy;
        promptTemplate = promptTemplate == null || promptTemplate.isBlank() ? DEFAULT_PROMPT : promptTemplate;
    }

    public static ConflictCheckConfig defaults() {
        return new ConflictCheckConfig(
            true,
            Similarity.defaults(),
            LlmSettings.gemini(0.2, 200),
            DEFAULT_CATEGORIES,
            Behavior.defaults(),
            Strategy.FIRST_MATCH,
            DEFAULT_PROMPT
        );
    }

    public ConflictCheckConfig withBehavior(Behavior updated) {
        return new ConflictCheckConfig(enabled, similarity, llm, categories, updated, strategy, promptTemplate);
    }

    public ConflictCheckConfig withStrategy(Strategy updated) {
        return new ConflictCheckConfig(enabled, similarity, llm, categories, behavior, updated, promptTemplate);
    }

    public ConflictCheckConfig withEnabled(boolean updated) {
        return new ConflictCheckConfig(updated, similarity, llm, categories, behavior, strategy, promptTemplate);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Similarity(double threshold, String algorithm, int maxCandidates) {

        public Similarity {
            if (threshold < 0 || threshold > 1) {
                throw new IllegalArgumentException("similarity threshold must be within [0, 1]");
            }
            if (maxCandidates < 1) {
                throw new IllegalArgumentException("maxCandidates must be positive");
            }
            algorithm = algorithm == null || algorithm.isBlank() ? "keyword" : algorithm;
        }

        public static Similarity defaults() {
            return new Similarity(0.75, "keyword", 10);
        }

        public double candidateThreshold() {
            return threshold * 0.5;
        }
    }

    /**
     * {@code askForAllConflicts} is accepted for document compatibility but has no effect: every pending conflict
     * becomes a card.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Behavior(
        boolean autoResolveUpdates,
        boolean skipDuplicates,
        boolean askForAllConflicts,
        boolean logAllChecks
    ) {

        public static Behavior defaults() {
            return new Behavior(false, true, true, true);
        }
    }

    /**
     * How a candidate's ranked matches are turned into a single verdict.
     */
    public enum Strategy {
        @JsonProperty("first_match")
        FIRST_MATCH,
        @JsonProperty("most_severe")
        MOST_SEVERE
    }
}
