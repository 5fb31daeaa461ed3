package io.memoria.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.config.ConfigService;
import io.memoria.core.pipeline.MemoryPipeline;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSeedStageDocumentsAndReportStatus() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Path workspace = tempDir.resolve("workspace");
        Files.writeString(configPath, "{ \"workspace\": \"" + workspace.toString().replace("\\", "\\\\") + "\" }");
        CliContext context = new CliContext(null, new ConfigService(), configPath);

        StageCommandIntegrationTest.Execution init = StageCommandIntegrationTest.execute(new InitCommand(context));

        assertThat(init.exitCode()).isZero();
        assertThat(init.stdout())
            .contains("Refreshed config with new defaults: " + configPath)
            .contains("Wrote stage config: " + workspace.resolve("stages/curiosity_module.json"))
            .contains("Workspace ready: " + workspace);
        assertThat(Files.isDirectory(workspace.resolve("users"))).isTrue();

        StageCommandIntegrationTest.Execution status = StageCommandIntegrationTest.execute(new StatusCommand(context));

        assertThat(status.exitCode()).isZero();
        assertThat(status.stdout())
            .contains("Config exists: true")
            .contains("Stage conflict_check.json: present")
            .contains("Secrets backend: env")
            .contains("Message log: sqlite")
            .contains("Server: 127.0.0.1:8787");
    }

    @Test
    void shouldPassOverridesToServerRunner() {
        AtomicReference<String> bound = new AtomicReference<>();
        CliContext context = new CliContext((MemoryPipeline) null, new ConfigService(), tempDir.resolve("config.json"), (host, port) -> {
            bound.set(host + ":" + port);
            return 0;
        });

        StageCommandIntegrationTest.Execution serve = StageCommandIntegrationTest.execute(
            new ServeCommand(context), "--host", "0.0.0.0", "--port", "9001"
        );

        assertThat(serve.exitCode()).isZero();
        assertThat(bound.get()).isEqualTo("0.0.0.0:9001");
    }

    @Test
    void shouldReportMissingServerRunner() {
        CliContext context = new CliContext(null, new ConfigService(), tempDir.resolve("config.json"));

        StageCommandIntegrationTest.Execution serve = StageCommandIntegrationTest.execute(new ServeCommand(context));

        assertThat(serve.exitCode()).isEqualTo(1);
        assertThat(serve.stderr()).contains("server runner is not configured");
    }
}
