package io.memoria.core.provider;

import java.util.Map;

/**
 * Provider placeholder used when a provider is not configured.
 * Returns a deterministic error so callers fall back to their safe default.
 */
public final class DisabledProvider implements CompletionProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletionResponse complete(String prompt, CompletionParams params) {
        return CompletionResponse.error(
            "provider " + name + " is not configured (" + reason + ")",
            Map.of("provider", name, "disabled", true)
        );
    }
}
