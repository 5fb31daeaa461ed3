package io.memoria.core.provider;

import java.util.Map;

public record CompletionResponse(String text, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";
    public static final String CREDENTIAL_MISSING = "credential_missing";

    public CompletionResponse {
        text = text == null ? "" : text;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static CompletionResponse error(String message) {
        return new CompletionResponse(ERROR_PREFIX + " " + message, Map.of());
    }

    public static CompletionResponse error(String message, Map<String, Object> usage) {
        return new CompletionResponse(ERROR_PREFIX + " " + message, usage);
    }

    public static CompletionResponse credentialMissing(String message) {
        return new CompletionResponse(ERROR_PREFIX + " " + message, Map.of(CREDENTIAL_MISSING, true));
    }

    public boolean isError() {
        return text.startsWith(ERROR_PREFIX);
    }

    public boolean isCredentialMissing() {
        return Boolean.TRUE.equals(usage.get(CREDENTIAL_MISSING));
    }

    /**
     * Error text without the {@link #ERROR_PREFIX}.
     */
    public String errorDetail() {
        return isError() ? text.substring(ERROR_PREFIX.length()).trim() : "";
    }
}
