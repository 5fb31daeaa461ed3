package io.memoria.core.provider;

import io.memoria.core.config.model.LlmSettings;
import java.util.Objects;

public record CompletionParams(String model, double temperature, int maxTokens) {

    public CompletionParams {
        Objects.requireNonNull(model, "model must not be null");
    }

    public static CompletionParams from(LlmSettings settings) {
        return new CompletionParams(settings.model(), settings.temperature(), settings.maxTokens());
    }
}
