package io.memoria.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.config.model.ClarificationConfig;
import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.config.model.ContextInjectionConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StageConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWhenDocumentsAreMissing() {
        StageConfigService stages = new StageConfigService(tempDir);

        assertThat(stages.conflictCheck()).isEqualTo(ConflictCheckConfig.defaults());
        assertThat(stages.clarification()).isEqualTo(ClarificationConfig.defaults());
        assertThat(stages.contextInjection()).isEqualTo(ContextInjectionConfig.defaults());
    }

    @Test
    void shouldMergePartialDocumentOverDefaults() throws Exception {
        Files.writeString(tempDir.resolve(StageConfigService.CONFLICT_CHECK_FILE), """
            {
              "similarity": { "threshold": 0.5 },
              "behavior": { "autoResolveUpdates": true },
              "strategy": "most_severe"
            }
            """);
        Files.writeString(tempDir.resolve(StageConfigService.CONTEXT_INJECTION_FILE), """
            {
              "injection": { "maxMemories": 3 },
              "layers": { "calendar": { "enabled": false } },
              "summaryLLM": { "model": "gemini-1.5-flash" }
            }
            """);

        StageConfigService stages = new StageConfigService(tempDir);
        ConflictCheckConfig conflict = stages.conflictCheck();
        ContextInjectionConfig injection = stages.contextInjection();

        assertThat(conflict.similarity().threshold()).isEqualTo(0.5);
        assertThat(conflict.similarity().maxCandidates()).isEqualTo(10);
        assertThat(conflict.behavior().autoResolveUpdates()).isTrue();
        assertThat(conflict.behavior().skipDuplicates()).isTrue();
        assertThat(conflict.strategy()).isEqualTo(ConflictCheckConfig.Strategy.MOST_SEVERE);
        assertThat(injection.injection().maxMemories()).isEqualTo(3);
        assertThat(injection.injection().minRelevance()).isEqualTo(0.30);
        assertThat(injection.layers().calendar().enabled()).isFalse();
        assertThat(injection.layers().calendar().lookaheadHours()).isEqualTo(48);
        assertThat(injection.summaryLlm().model()).isEqualTo("gemini-1.5-flash");
        assertThat(injection.summaryLlm().maxTokens()).isEqualTo(200);
    }

    @Test
    void shouldFallBackToDefaultsForUnreadableOrInvalidDocuments() throws Exception {
        Files.writeString(tempDir.resolve(StageConfigService.CONFLICT_CHECK_FILE), "{ not json");
        Files.writeString(tempDir.resolve(StageConfigService.CONTEXT_INJECTION_FILE), """
            { "injection": { "minRelevance": 4.0 } }
            """);

        StageConfigService stages = new StageConfigService(tempDir);

        assertThat(stages.conflictCheck()).isEqualTo(ConflictCheckConfig.defaults());
        assertThat(stages.contextInjection()).isEqualTo(ContextInjectionConfig.defaults());
    }

    @Test
    void shouldReadUnknownModeAsLocal() throws Exception {
        Files.writeString(tempDir.resolve(StageConfigService.CLARIFICATION_FILE), """
            { "mode": "telepathic", "limits": { "maxQuestionsPerTurn": 2 } }
            """);

        ClarificationConfig config = new StageConfigService(tempDir).clarification();

        assertThat(config.mode()).isEqualTo(ClarificationConfig.Mode.LOCAL);
        assertThat(config.limits().maxQuestionsPerTurn()).isEqualTo(2);
        assertThat(config.typeSettings().get("event").level()).isEqualTo(ClarificationConfig.Level.ALWAYS);
    }

    @Test
    void shouldWriteOnlyMissingDocumentsUnlessOverwriting() throws Exception {
        Path stagesDir = tempDir.resolve("stages");
        Files.createDirectories(stagesDir);
        Files.writeString(stagesDir.resolve(StageConfigService.CLARIFICATION_FILE), "{ \"mode\": \"hybrid\" }");
        StageConfigService stages = new StageConfigService(stagesDir);

        assertThat(stages.writeDefaults(false)).containsExactly(
            stagesDir.resolve(StageConfigService.CONFLICT_CHECK_FILE),
            stagesDir.resolve(StageConfigService.CONTEXT_INJECTION_FILE)
        );
        assertThat(stages.clarification().mode()).isEqualTo(ClarificationConfig.Mode.HYBRID);
        assertThat(stages.contextInjection()).isEqualTo(ContextInjectionConfig.defaults());

        assertThat(stages.writeDefaults(true)).hasSize(3);
        assertThat(stages.clarification().mode()).isEqualTo(ClarificationConfig.Mode.LOCAL);
    }
}
