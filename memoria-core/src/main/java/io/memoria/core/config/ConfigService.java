package io.memoria.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memoria.core.config.model.MemoriaConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MemoriaConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MemoriaConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MemoriaConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = JsonTrees.deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, MemoriaConfig.class);
    }

    public void save(Path configPath, MemoriaConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the root config (unless present and not overwritten), creates the workspace
     * and seeds missing stage documents with their defaults.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MemoriaConfig config;
        if (created || overwrite) {
            config = MemoriaConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
        Files.createDirectories(ConfigPaths.usersDir(workspace));
        StageConfigService stages = new StageConfigService(ConfigPaths.stagesDir(workspace));
        List<Path> written = new ArrayList<>(stages.writeDefaults(overwrite));
        return new InitResult(configPath, workspace, created, overwritten, written);
    }

    public String toPrettyJson(Object config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }
}
