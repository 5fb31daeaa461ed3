package io.memoria.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memoria.core.config.model.ClarificationConfig;
import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.config.model.ContextInjectionConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the per-stage configuration documents. Each document is merged over the stage's
 * typed defaults; a missing or unreadable document yields the defaults.
 */
public final class StageConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(StageConfigService.class);

    public static final String CONFLICT_CHECK_FILE = "conflict_check.json";
    public static final String CLARIFICATION_FILE = "curiosity_module.json";
    public static final String CONTEXT_INJECTION_FILE = "context_injection.json";

    private final Path stagesDir;
    private final ObjectMapper mapper;

    public StageConfigService(Path stagesDir) {
        this.stagesDir = Objects.requireNonNull(stagesDir, "stagesDir must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
    }

    public ConflictCheckConfig conflictCheck() {
        return resolve(CONFLICT_CHECK_FILE, ConflictCheckConfig.defaults(), ConflictCheckConfig.class);
    }

    public ClarificationConfig clarification() {
        return resolve(CLARIFICATION_FILE, ClarificationConfig.defaults(), ClarificationConfig.class);
    }

    public ContextInjectionConfig contextInjection() {
        return resolve(CONTEXT_INJECTION_FILE, ContextInjectionConfig.defaults(), ContextInjectionConfig.class);
    }

    /**
     * Writes the default document of every stage whose file is absent, or all of them when
     * {@code overwrite} is set. Returns the files written.
     */
    public List<Path> writeDefaults(boolean overwrite) throws IOException {
        Files.createDirectories(stagesDir);
        List<Path> written = new ArrayList<>();
        writeIfNeeded(CONFLICT_CHECK_FILE, ConflictCheckConfig.defaults(), overwrite, written);
        writeIfNeeded(CLARIFICATION_FILE, ClarificationConfig.defaults(), overwrite, written);
        writeIfNeeded(CONTEXT_INJECTION_FILE, ContextInjectionConfig.defaults(), overwrite, written);
        return written;
    }

    public Path stagesDir() {
        return stagesDir;
    }

    private <T> T resolve(String fileName, T defaults, Class<T> type) {
        Path file = stagesDir.resolve(fileName);
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            JsonNode defaultsNode = mapper.valueToTree(defaults);
            JsonNode documentNode = mapper.readTree(Files.readString(file));
            JsonNode merged = JsonTrees.deepMerge(defaultsNode, documentNode);
            return mapper.treeToValue(merged, type);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to load stage config {}, using defaults: {}", file, e.getMessage());
            return defaults;
        }
    }

    private void writeIfNeeded(String fileName, Object defaults, boolean overwrite, List<Path> written) throws IOException {
        Path file = stagesDir.resolve(fileName);
        if (Files.exists(file) && !overwrite) {
            return;
        }
        Path tmp = file.resolveSibling(fileName + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(defaults) + System.lineSeparator());
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        written.add(file);
    }
}
