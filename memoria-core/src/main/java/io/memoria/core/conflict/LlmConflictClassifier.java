package io.memoria.core.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ConflictRelation;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.provider.CompletionParams;
import io.memoria.core.provider.CompletionProvider;
import io.memoria.core.provider.CompletionResponse;
import io.memoria.core.provider.JsonSpan;
import io.memoria.core.provider.ProviderRegistry;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmConflictClassifier implements ConflictClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(LlmConflictClassifier.class);

    private final ProviderRegistry providers;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmConflictClassifier(ProviderRegistry providers) {
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
    }

    @Override
    public Classification classify(ExistingMemoryRecord existing, ExtractedMemoryCandidate candidate, ConflictCheckConfig config) {
        CompletionProvider provider = providers.resolve(config.llm().provider());
        String prompt = config.promptTemplate()
            .replace("{{existing}}", existing.content())
            .replace("{{new}}", candidate.content());

        CompletionResponse response = provider.complete(prompt, CompletionParams.from(config.llm()));
        if (response.isCredentialMissing()) {
            LOG.warn("Conflict classification skipped: {}", response.errorDetail());
            return Classification.none(0, "API key not available");
        }
        if (response.isError()) {
            LOG.warn("Conflict classification failed: {}", response.errorDetail());
            return Classification.none(0, "LLM error: " + response.errorDetail());
        }

        Optional<String> json = JsonSpan.firstObject(response.text());
        if (json.isEmpty()) {
            LOG.warn("Could not parse conflict classification response");
            return Classification.none(0.5, "Could not parse response");
        }
        try {
            JsonNode parsed = mapper.readTree(json.get());
            ConflictRelation relation = ConflictRelation.fromLabel(parsed.path("type").asText(null));
            double confidence = parsed.path("confidence").isNumber() ? parsed.path("confidence").asDouble() : 0.8;
            String reason = parsed.path("reason").isTextual() ? parsed.path("reason").asText() : "LLM determined";
            return new Classification(relation, confidence, reason);
        } catch (IOException e) {
            LOG.warn("Malformed conflict classification JSON: {}", e.getMessage());
            return Classification.none(0, "LLM error: " + e.getMessage());
        }
    }
}
