package io.memoria.core.secret;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches successful lookups of a delegate until {@link #invalidate(String)} is called.
 * Misses are not cached, so a credential that appears later is picked up on the next fetch.
 */
public final class CachingCredentialProvider implements CredentialProvider {
    private final CredentialProvider delegate;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public CachingCredentialProvider(CredentialProvider delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public Optional<String> fetch(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String cached = cache.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> fetched = delegate.fetch(name);
        fetched.ifPresent(value -> cache.put(name, value));
        return fetched;
    }

    @Override
    public void invalidate(String name) {
        if (name != null) {
            cache.remove(name);
        }
        delegate.invalidate(name);
    }
}
