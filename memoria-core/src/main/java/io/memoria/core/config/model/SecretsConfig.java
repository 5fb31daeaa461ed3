package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where credentials such as {@code gemini-api-key} are fetched from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretsConfig(Backend backend, String region, String prefix) {

    public SecretsConfig {
        backend = backend == null ? Backend.ENV : backend;
        region = region == null ? "" : region;
        prefix = prefix == null ? "" : prefix;
    }

    public static SecretsConfig defaults() {
        return new SecretsConfig(Backend.ENV, "", "");
    }

    public enum Backend {
        @JsonProperty("env")
        ENV,
        @JsonProperty("aws")
        AWS
    }
}
