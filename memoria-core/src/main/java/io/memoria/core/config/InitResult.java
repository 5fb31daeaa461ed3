package io.memoria.core.config;

import java.nio.file.Path;
import java.util.List;

public record InitResult(
    Path configPath,
    Path workspacePath,
    boolean createdConfig,
    boolean overwrittenConfig,
    List<Path> writtenStageFiles
) {

    public InitResult {
        writtenStageFiles = writtenStageFiles == null ? List.of() : List.copyOf(writtenStageFiles);
    }
}
