package io.memoria.core.clarification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoria.core.config.model.LlmSettings;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.SlotValue;
import io.memoria.core.provider.CompletionParams;
import io.memoria.core.provider.CompletionResponse;
import io.memoria.core.provider.JsonSpan;
import io.memoria.core.provider.ProviderRegistry;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmAmbiguityAnalyzer implements AmbiguityAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(LlmAmbiguityAnalyzer.class);

    private final ProviderRegistry providers;
    private final ObjectMapper mapper = new ObjectMapper();

    public LlmAmbiguityAnalyzer(ProviderRegistry providers) {
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
    }

    @Override
    public AmbiguityAnalysis suggest(ExtractedMemoryCandidate item, String originalMessage, LocalDate today, LlmSettings settings) {
        String prompt = buildPrompt(item, originalMessage, today);
        CompletionResponse response = providers.resolve(settings.provider()).complete(prompt, CompletionParams.from(settings));
        if (response.isCredentialMissing()) {
            LOG.warn("Ambiguity analysis skipped: {}", response.errorDetail());
            return AmbiguityAnalysis.empty("API key not available");
        }
        if (response.isError()) {
            LOG.warn("Ambiguity analysis failed: {}", response.errorDetail());
            return AmbiguityAnalysis.empty("Error: " + response.errorDetail());
        }

        Optional<String> json = JsonSpan.firstObject(response.text());
        if (json.isEmpty()) {
            LOG.warn("Could not parse JSON from ambiguity analysis response");
            return AmbiguityAnalysis.empty("Failed to parse LLM response");
        }
        try {
            return parse(mapper.readTree(json.get()));
        } catch (IOException e) {
            LOG.warn("Malformed ambiguity analysis JSON: {}", e.getMessage());
            return AmbiguityAnalysis.empty("Error: " + e.getMessage());
        }
    }

    private AmbiguityAnalysis parse(JsonNode root) {
        List<AmbiguitySuggestion> suggestions = new ArrayList<>();
        for (JsonNode node : root.path("suggestions")) {
            if (!node.path("slotId").isTextual() || !node.path("question").isTextual()) {
                continue;
            }
            suggestions.add(new AmbiguitySuggestion(
                node.path("slotId").asText(),
                node.path("issue").asText(null),
                node.path("question").asText(),
                node.path("reason").asText(""),
                AmbiguitySuggestion.Priority.fromLabel(node.path("priority").asText(null)),
                node.path("resolvedValue").isValueNode() && !node.path("resolvedValue").isNull()
                    ? node.path("resolvedValue").asText()
                    : null
            ));
        }

        Map<String, String> resolvedSlots = new LinkedHashMap<>();
        root.path("resolvedSlots").fields().forEachRemaining(entry -> {
            if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                resolvedSlots.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return new AmbiguityAnalysis(suggestions, resolvedSlots, root.path("analysis").asText(""));
    }

    static String buildPrompt(ExtractedMemoryCandidate item, String originalMessage, LocalDate today) {
        String slotSummary = item.slots().entrySet().stream()
            .map(entry -> "  - " + entry.getKey() + ": " + slotText(entry.getValue()) + " (filled: " + entry.getValue().filled() + ")")
            .collect(Collectors.joining("\n"));
        List<String> requiredIds = item.typeConfig().requiredSlotIds();
        String required = requiredIds.isEmpty() ? "none defined" : String.join(", ", requiredIds);

        return """
            You are an AI assistant analyzing a memory extraction for ambiguity and missing information.

            TODAY'S DATE: %s

            ORIGINAL USER MESSAGE:
            "%s"

            EXTRACTED MEMORY:
            - Type: %s
            - Content: %s
            - Slots:
            %s

            REQUIRED SLOTS for %s: %s

            YOUR TASK:
            1. Check if any filled slots have AMBIGUOUS or VAGUE values
            2. For DATE slots: resolve relative dates (e.g., "next tuesday" → actual date based on today)
            3. For TIME slots: check if time is needed but missing
            4. Identify any critical missing information

            RESPOND IN THIS EXACT JSON FORMAT:
            {
              "suggestions": [
                {
                  "slotId": "when_date",
                  "issue": "ambiguous",
                  "question": "Which Tuesday do you mean - December 24th or December 31st?",
                  "reason": "The date 'tuesday' is ambiguous without specifying which week",
                  "priority": "high",
                  "resolvedValue": "2025-12-24"
                }
              ],
              "resolvedSlots": {
                "when_date": "2025-12-24"
              },
              "analysis": "Brief explanation of what was found"
            }

            RULES:
            - Only include suggestions for actual issues, not hypotheticals
            - priority: "high" for required slots, "medium" for optional but useful, "low" for nice-to-have
            - resolvedValue: Only include if you can confidently resolve (e.g., "next tuesday" from today)
            - If no issues found, return empty suggestions array
            - Be concise in questions - they will be shown to the user

            JSON RESPONSE:""".formatted(
            today,
            originalMessage == null ? "" : originalMessage,
            item.type(),
            item.content(),
            slotSummary,
            item.type(),
            required
        );
    }

    private static String slotText(SlotValue slot) {
        return slot.value() == null ? "null" : slot.value();
    }
}
