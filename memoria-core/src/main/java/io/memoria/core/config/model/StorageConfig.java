package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"message_log"}) MessageLogBackend messageLog) {

    public StorageConfig {
        messageLog = messageLog == null ? MessageLogBackend.SQLITE : messageLog;
    }

    public static StorageConfig defaults() {
        return new StorageConfig(MessageLogBackend.SQLITE);
    }

    public enum MessageLogBackend {
        @JsonProperty("sqlite")
        SQLITE,
        @JsonProperty("file")
        FILE
    }
}
