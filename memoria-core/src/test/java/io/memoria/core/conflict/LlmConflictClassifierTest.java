package io.memoria.core.conflict;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ConflictRelation;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.provider.CompletionResponse;
import io.memoria.core.provider.ProviderRegistry;
import io.memoria.core.provider.ScriptedProvider;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LlmConflictClassifierTest {

    private final ExistingMemoryRecord existing = ExistingMemoryRecord.active("mem-1", "Lives in Berlin", "fact", Instant.EPOCH);
    private final ExtractedMemoryCandidate candidate = new ExtractedMemoryCandidate(
        "tmp-1", "Lives in Munich", "fact", 0.9, Map.of(), null, "I live in Munich now"
    );

    @Test
    void shouldParseFencedJsonVerdict() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", """
            ```json
            {"type": "update", "confidence": 0.72, "reason": "User moved"}
            ```""");
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry().register(gemini));

        Classification classification = classifier.classify(existing, candidate, ConflictCheckConfig.defaults());

        assertThat(classification.relation()).isEqualTo(ConflictRelation.UPDATE);
        assertThat(classification.confidence()).isEqualTo(0.72);
        assertThat(classification.reason()).isEqualTo("User moved");
        assertThat(gemini.prompts()).singleElement().satisfies(prompt -> {
            assertThat(prompt).contains("EXISTING MEMORY: Lives in Berlin");
            assertThat(prompt).contains("NEW INFORMATION: Lives in Munich");
        });
    }

    @Test
    void shouldDefaultConfidenceAndReasonWhenAbsent() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "{\"type\": \"CONFLICT\"}");
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry().register(gemini));

        Classification classification = classifier.classify(existing, candidate, ConflictCheckConfig.defaults());

        assertThat(classification.relation()).isEqualTo(ConflictRelation.CONFLICT);
        assertThat(classification.confidence()).isEqualTo(0.8);
        assertThat(classification.reason()).isEqualTo("LLM determined");
    }

    @Test
    void shouldMapUnknownLabelToNone() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "{\"type\": \"MAYBE\", \"confidence\": 0.4}");
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry().register(gemini));

        assertThat(classifier.classify(existing, candidate, ConflictCheckConfig.defaults()).relation())
            .isEqualTo(ConflictRelation.NONE);
    }

    @Test
    void shouldFailOpenOnUnparseableReply() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "they look different to me");
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry().register(gemini));

        Classification classification = classifier.classify(existing, candidate, ConflictCheckConfig.defaults());

        assertThat(classification.relation()).isEqualTo(ConflictRelation.NONE);
        assertThat(classification.confidence()).isEqualTo(0.5);
    }

    @Test
    void shouldFailOpenOnProviderError() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", CompletionResponse.ERROR_PREFIX + " HTTP 500");
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry().register(gemini));

        Classification classification = classifier.classify(existing, candidate, ConflictCheckConfig.defaults());

        assertThat(classification.relation()).isEqualTo(ConflictRelation.NONE);
        assertThat(classification.confidence()).isZero();
        assertThat(classification.reason()).startsWith("LLM error:");
    }

    @Test
    void shouldFailOpenWhenProviderIsNotRegistered() {
        LlmConflictClassifier classifier = new LlmConflictClassifier(new ProviderRegistry());

        Classification classification = classifier.classify(existing, candidate, ConflictCheckConfig.defaults());

        assertThat(classification.relation()).isEqualTo(ConflictRelation.NONE);
    }
}
