package io.memoria.core.provider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ProviderRegistry {
    private final Map<String, CompletionProvider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry register(CompletionProvider provider) {
        providers.put(normalize(provider.name()), provider);
        return this;
    }

    public Optional<CompletionProvider> find(String name) {
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    /**
     * Returns the named provider, or a {@link DisabledProvider} when none is registered under that name.
     */
    public CompletionProvider resolve(String name) {
        return find(name).orElseGet(() -> new DisabledProvider(name, "no provider registered"));
    }

    private String normalize(String name) {
        return name == null ? "" : name.toLowerCase().replace('-', '_');
    }
}
