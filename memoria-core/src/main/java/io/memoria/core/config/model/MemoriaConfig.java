package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoriaConfig(
    String workspace,
    ProvidersConfig providers,
    SecretsConfig secrets,
    ServerConfig server,
    StorageConfig storage
) {

    public MemoriaConfig {
        workspace = workspace == null || workspace.isBlank() ? "~/.memoria/workspace" : workspace;
        providers = providers == null ? ProvidersConfig.defaults() : providers;
        secrets = secrets == null ? SecretsConfig.defaults() : secrets;
        server = server == null ? ServerConfig.defaults() : server;
        storage = storage == null ? StorageConfig.defaults() : storage;
    }

    public static MemoriaConfig defaults() {
        return new MemoriaConfig(
            "~/.memoria/workspace",
            ProvidersConfig.defaults(),
            SecretsConfig.defaults(),
            ServerConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
