package io.memoria.cli;

import io.memoria.core.config.ConfigPaths;
import io.memoria.core.config.StageConfigService;
import io.memoria.core.config.model.MemoriaConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and workspace status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoriaConfig config = context.configService().load(context.configPath());
            Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
            Path stages = ConfigPaths.stagesDir(workspace);
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + workspace);
            for (String file : List.of(
                StageConfigService.CONFLICT_CHECK_FILE,
                StageConfigService.CLARIFICATION_FILE,
                StageConfigService.CONTEXT_INJECTION_FILE
            )) {
                System.out.println("Stage " + file + ": " + (Files.exists(stages.resolve(file)) ? "present" : "defaults"));
            }
            System.out.println("Secrets backend: " + config.secrets().backend().name().toLowerCase());
            System.out.println("Gemini configured: " + config.providers().gemini().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Message log: " + config.storage().messageLog().name().toLowerCase());
            System.out.println("Server: " + config.server().host() + ":" + config.server().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
