package io.memoria.core.secret;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads credentials from environment variables. {@code gemini-api-key} is looked up as {@code GEMINI_API_KEY}.
 */
public final class EnvCredentialProvider implements CredentialProvider {
    private final Map<String, String> env;

    public EnvCredentialProvider(Map<String, String> env) {
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static EnvCredentialProvider fromSystem() {
        return new EnvCredentialProvider(System.getenv());
    }

    @Override
    public Optional<String> fetch(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String value = env.get(variableName(name));
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    static String variableName(String name) {
        return name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }
}
