package io.memoria.core.secret;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;

class AwsSecretsManagerCredentialProviderTest {

    @Test
    void shouldPrefixSecretIdsAndTrimValues() {
        List<String> requested = new ArrayList<>();
        AwsSecretsManagerCredentialProvider provider = new AwsSecretsManagerCredentialProvider(
            secretId -> {
                requested.add(secretId);
                return " gm-key \n";
            },
            "memoria/",
            null
        );

        assertThat(provider.fetch(CredentialProvider.GEMINI_API_KEY)).contains("gm-key");
        assertThat(requested).containsExactly("memoria/gemini-api-key");
    }

    @Test
    void shouldReturnEmptyWhenSecretIsBlankOrUnreachable() {
        AwsSecretsManagerCredentialProvider blank = new AwsSecretsManagerCredentialProvider(secretId -> "  ", "", null);
        AwsSecretsManagerCredentialProvider failing = new AwsSecretsManagerCredentialProvider(
            secretId -> {
                throw SdkClientException.create("Unable to load credentials");
            },
            "",
            null
        );

        assertThat(blank.fetch(CredentialProvider.GEMINI_API_KEY)).isEmpty();
        assertThat(failing.fetch(CredentialProvider.GEMINI_API_KEY)).isEmpty();
    }

    @Test
    void shouldCloseUnderlyingClient() throws Exception {
        AtomicBoolean closed = new AtomicBoolean();
        AwsSecretsManagerCredentialProvider provider = new AwsSecretsManagerCredentialProvider(
            secretId -> "value",
            "",
            () -> closed.set(true)
        );

        provider.close();

        assertThat(closed).isTrue();
    }
}
