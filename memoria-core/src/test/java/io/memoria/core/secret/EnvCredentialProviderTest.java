package io.memoria.core.secret;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvCredentialProviderTest {

    @Test
    void shouldMapCredentialNamesToVariables() {
        assertThat(EnvCredentialProvider.variableName("gemini-api-key")).isEqualTo("GEMINI_API_KEY");
        assertThat(EnvCredentialProvider.variableName("memoria.openai-key")).isEqualTo("MEMORIA_OPENAI_KEY");
    }

    @Test
    void shouldReadTrimmedValuesAndSkipBlanks() {
        EnvCredentialProvider provider = new EnvCredentialProvider(Map.of(
            "GEMINI_API_KEY", "  abc123 \n",
            "OPENAI_API_KEY", "   "
        ));

        assertThat(provider.fetch(CredentialProvider.GEMINI_API_KEY)).contains("abc123");
        assertThat(provider.fetch(CredentialProvider.OPENAI_API_KEY)).isEmpty();
        assertThat(provider.fetch("anthropic-api-key")).isEmpty();
        assertThat(provider.fetch(null)).isEmpty();
    }
}
