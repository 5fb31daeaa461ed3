package io.memoria.core.secret;

import java.util.Optional;

/**
 * Fetch-by-name access to credentials such as {@code gemini-api-key}.
 */
public interface CredentialProvider {
    String GEMINI_API_KEY = "gemini-api-key";
    String OPENAI_API_KEY = "openai-api-key";

    Optional<String> fetch(String name);

    default void invalidate(String name) {
    }
}
