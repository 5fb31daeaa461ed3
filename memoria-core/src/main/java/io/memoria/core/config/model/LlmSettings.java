package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmSettings(
    String provider,
    String model,
    double temperature,
    @JsonAlias({"max_tokens"}) int maxTokens
) {

    public LlmSettings {
        provider = provider == null || provider.isBlank() ? "gemini" : provider;
        model = model == null || model.isBlank() ? "gemini-2.0-flash-exp" : model;
        if (temperature < 0 || temperature > 2) {
            throw new IllegalArgumentException("temperature must be within [0, 2]");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static LlmSettings gemini(double temperature, int maxTokens) {
        return new LlmSettings("gemini", "gemini-2.0-flash-exp", temperature, maxTokens);
    }
}
