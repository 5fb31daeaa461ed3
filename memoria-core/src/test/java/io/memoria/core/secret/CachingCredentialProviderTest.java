package io.memoria.core.secret;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CachingCredentialProviderTest {

    @Test
    void shouldCacheHitsUntilInvalidated() {
        CountingProvider delegate = new CountingProvider();
        delegate.values.put(CredentialProvider.GEMINI_API_KEY, "key-1");
        CachingCredentialProvider provider = new CachingCredentialProvider(delegate);

        assertThat(provider.fetch(CredentialProvider.GEMINI_API_KEY)).contains("key-1");
        delegate.values.put(CredentialProvider.GEMINI_API_KEY, "key-2");
        assertThat(provider.fetch(CredentialProvider.GEMINI_API_KEY)).contains("key-1");
        assertThat(delegate.fetches).hasSize(1);

        provider.invalidate(CredentialProvider.GEMINI_API_KEY);

        assertThat(provider.fetch(CredentialProvider.GEMINI_API_KEY)).contains("key-2");
        assertThat(delegate.invalidated).containsExactly(CredentialProvider.GEMINI_API_KEY);
    }

    @Test
    void shouldNotCacheMisses() {
        CountingProvider delegate = new CountingProvider();
        CachingCredentialProvider provider = new CachingCredentialProvider(delegate);

        assertThat(provider.fetch(CredentialProvider.OPENAI_API_KEY)).isEmpty();
        delegate.values.put(CredentialProvider.OPENAI_API_KEY, "sk-late");

        assertThat(provider.fetch(CredentialProvider.OPENAI_API_KEY)).contains("sk-late");
        assertThat(delegate.fetches).hasSize(2);
    }

    @Test
    void shouldIgnoreBlankNames() {
        CountingProvider delegate = new CountingProvider();

        assertThat(new CachingCredentialProvider(delegate).fetch(" ")).isEmpty();
        assertThat(delegate.fetches).isEmpty();
    }

    private static final class CountingProvider implements CredentialProvider {
        private final Map<String, String> values = new HashMap<>();
        private final List<String> fetches = new ArrayList<>();
        private final List<String> invalidated = new ArrayList<>();

        @Override
        public Optional<String> fetch(String name) {
            fetches.add(name);
            return Optional.ofNullable(values.get(name));
        }

        @Override
        public void invalidate(String name) {
            invalidated.add(name);
        }
    }
}
