package io.memoria.cli;

import io.memoria.core.config.ConfigService;
import io.memoria.core.pipeline.MemoryPipeline;
import java.nio.file.Path;

public record CliContext(
    MemoryPipeline pipeline,
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner
) {
    public CliContext(MemoryPipeline pipeline, ConfigService configService, Path configPath) {
        this(pipeline, configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }
}
