package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SaveResult(boolean saved, String content, String reason) {

    public SaveResult {
        content = content == null ? "" : content;
        reason = reason == null ? "" : reason;
    }
}
