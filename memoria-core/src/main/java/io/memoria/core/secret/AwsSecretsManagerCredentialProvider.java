package io.memoria.core.secret;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

public final class AwsSecretsManagerCredentialProvider implements CredentialProvider, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AwsSecretsManagerCredentialProvider.class);

    private final SecretFetcher fetcher;
    private final String prefix;
    private final AutoCloseable resource;

    public AwsSecretsManagerCredentialProvider(String region, String prefix) {
        this(buildClient(region), prefix);
    }

    private AwsSecretsManagerCredentialProvider(SecretsManagerClient client, String prefix) {
        this(
            secretId -> client.getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build()).secretString(),
            prefix,
            client
        );
    }

    AwsSecretsManagerCredentialProvider(SecretFetcher fetcher, String prefix, AutoCloseable resource) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.prefix = prefix == null ? "" : prefix;
        this.resource = resource;
    }

    @Override
    public Optional<String> fetch(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String secretId = prefix + name;
        try {
            String value = fetcher.fetch(secretId);
            if (value == null || value.isBlank()) {
                LOG.warn("Secret {} has no string value", secretId);
                return Optional.empty();
            }
            return Optional.of(value.trim());
        } catch (SdkException e) {
            LOG.warn("Failed to fetch secret {}: {}", secretId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() throws Exception {
        if (resource != null) {
            resource.close();
        }
    }

    private static SecretsManagerClient buildClient(String region) {
        String effectiveRegion = firstNonBlank(region, System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (effectiveRegion == null) {
            throw new IllegalArgumentException("missing AWS region for Secrets Manager");
        }
        SecretsManagerClientBuilder builder = SecretsManagerClient.builder()
            .region(Region.of(effectiveRegion))
            .credentialsProvider(DefaultCredentialsProvider.create());
        return builder.build();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    @FunctionalInterface
    interface SecretFetcher {
        String fetch(String secretId);
    }
}
