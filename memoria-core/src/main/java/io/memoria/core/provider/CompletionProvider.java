package io.memoria.core.provider;

/**
 * Single-shot text completion. Implementations never throw; failures come back as
 * {@link CompletionResponse#isError() error responses}.
 */
public interface CompletionProvider {
    String name();

    CompletionResponse complete(String prompt, CompletionParams params);
}
