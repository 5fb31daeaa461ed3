package io.memoria.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(String host, int port) {

    public ServerConfig {
        host = host == null || host.isBlank() ? "127.0.0.1" : host;
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within [0, 65535]");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig("127.0.0.1", 8787);
    }
}
