package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(ProviderConfig gemini, ProviderConfig openai) {

    public ProvidersConfig {
        gemini = gemini == null ? ProviderConfig.defaults() : gemini;
        openai = openai == null ? ProviderConfig.defaults() : openai;
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults(), ProviderConfig.defaults());
    }
}
