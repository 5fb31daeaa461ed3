package io.memoria.app;

import io.memoria.cli.CliContext;
import io.memoria.cli.ClarifyCommand;
import io.memoria.cli.ConflictsCommand;
import io.memoria.cli.ContextCommand;
import io.memoria.cli.InitCommand;
import io.memoria.cli.MemoriaCliCommand;
import io.memoria.cli.ServeCommand;
import io.memoria.cli.StatusCommand;
import io.memoria.cli.TurnCommand;
import io.memoria.core.api.PipelineServer;
import io.memoria.core.clarification.ClarificationService;
import io.memoria.core.clarification.LlmAmbiguityAnalyzer;
import io.memoria.core.config.ConfigPaths;
import io.memoria.core.config.ConfigService;
import io.memoria.core.config.StageConfigService;
import io.memoria.core.config.model.MemoriaConfig;
import io.memoria.core.config.model.ProviderConfig;
import io.memoria.core.config.model.StorageConfig;
import io.memoria.core.conflict.ConflictCheckService;
import io.memoria.core.conflict.LlmConflictClassifier;
import io.memoria.core.context.CalendarLayerBuilder;
import io.memoria.core.context.CharRatioTokenEstimator;
import io.memoria.core.context.ContextAssembler;
import io.memoria.core.context.ImmediateLayerBuilder;
import io.memoria.core.context.PastConversationsLayerBuilder;
import io.memoria.core.context.ProfileLayerBuilder;
import io.memoria.core.context.SessionSummaryLayerBuilder;
import io.memoria.core.context.TokenEstimator;
import io.memoria.core.disclosure.ContextInjectionService;
import io.memoria.core.pipeline.MemoryPipeline;
import io.memoria.core.provider.CompletionProvider;
import io.memoria.core.provider.DisabledProvider;
import io.memoria.core.provider.GeminiProvider;
import io.memoria.core.provider.OpenAiCompatProvider;
import io.memoria.core.provider.ProviderRegistry;
import io.memoria.core.secret.AwsSecretsManagerCredentialProvider;
import io.memoria.core.secret.CachingCredentialProvider;
import io.memoria.core.secret.CredentialProvider;
import io.memoria.core.secret.EnvCredentialProvider;
import io.memoria.core.store.FileDaySummaryFeed;
import io.memoria.core.store.FileEventStore;
import io.memoria.core.store.FileMemoryRecordStore;
import io.memoria.core.store.FileMessageLog;
import io.memoria.core.store.InMemorySessionSummaryCache;
import io.memoria.core.store.MessageLog;
import io.memoria.core.store.SqliteMessageLog;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MemoriaApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MemoriaApplication.class);

    private MemoriaApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        MemoriaConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemDefaultZone();

        CredentialProvider credentials = new CachingCredentialProvider(buildCredentialProvider(config));
        ProviderRegistry providers = new ProviderRegistry()
            .register(new GeminiProvider(credentials, config.providers().gemini().apiBase()))
            .register(buildOpenAiProvider(config.providers().openai()));

        Path workspace = ConfigPaths.resolveWorkspace(config.workspace());
        Path usersDir = ConfigPaths.usersDir(workspace);
        MessageLog messageLog = buildMessageLog(config.storage(), workspace, usersDir);
        TokenEstimator estimator = new CharRatioTokenEstimator();

        ExecutorService layerExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "memoria-layer");
            thread.setDaemon(true);
            return thread;
        });
        ContextAssembler assembler = new ContextAssembler(
            List.of(
                new ImmediateLayerBuilder(messageLog, estimator),
                new SessionSummaryLayerBuilder(messageLog, new InMemorySessionSummaryCache(clock), providers, estimator, clock),
                new ProfileLayerBuilder(estimator),
                new CalendarLayerBuilder(new FileEventStore(usersDir), estimator, clock),
                new PastConversationsLayerBuilder(new FileDaySummaryFeed(usersDir), estimator)
            ),
            layerExecutor
        );

        MemoryPipeline pipeline = new MemoryPipeline(
            new ConflictCheckService(new LlmConflictClassifier(providers), new FileMemoryRecordStore(usersDir)),
            new ClarificationService(new LlmAmbiguityAnalyzer(providers), clock),
            new ContextInjectionService(assembler, estimator),
            new StageConfigService(ConfigPaths.stagesDir(workspace))
        );

        CliContext context = new CliContext(
            pipeline,
            configService,
            configPath,
            (host, port) -> runServer(config, host, port, pipeline)
        );

        CommandLine commandLine = new CommandLine(new MemoriaCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("conflicts", new ConflictsCommand(context));
        commandLine.addSubcommand("clarify", new ClarifyCommand(context));
        commandLine.addSubcommand("context", new ContextCommand(context));
        commandLine.addSubcommand("turn", new TurnCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        layerExecutor.shutdownNow();
        System.exit(exitCode);
    }

    private static MemoriaConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config from {}, using defaults: {}", configPath, e.getMessage());
            return MemoriaConfig.defaults();
        }
    }

    /**
     * A Gemini key in the config file wins over the secret backend.
     */
    private static CredentialProvider buildCredentialProvider(MemoriaConfig config) {
        CredentialProvider backend = switch (config.secrets().backend()) {
            case AWS -> new AwsSecretsManagerCredentialProvider(config.secrets().region(), config.secrets().prefix());
            case ENV -> EnvCredentialProvider.fromSystem();
        };
        ProviderConfig gemini = config.providers().gemini();
        if (!gemini.configured()) {
            return backend;
        }
        return new CredentialProvider() {
            @Override
            public Optional<String> fetch(String name) {
                if (CredentialProvider.GEMINI_API_KEY.equals(name)) {
                    return Optional.of(gemini.apiKey());
                }
                return backend.fetch(name);
            }

            @Override
            public void invalidate(String name) {
                backend.invalidate(name);
            }
        };
    }

    private static CompletionProvider buildOpenAiProvider(ProviderConfig providerConfig) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? "https://api.openai.com/v1"
                : providerConfig.apiBase();
            return new OpenAiCompatProvider("openai", providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return new DisabledProvider("openai", "missing API key");
    }

    private static MessageLog buildMessageLog(StorageConfig storage, Path workspace, Path usersDir) {
        if (storage.messageLog() == StorageConfig.MessageLogBackend.SQLITE) {
            Path sqlitePath = workspace.resolve("messages.db");
            try {
                return new SqliteMessageLog(sqlitePath);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to initialize SQLite message log at " + sqlitePath, e);
            }
        }
        return new FileMessageLog(usersDir);
    }

    private static int runServer(MemoriaConfig config, String hostOverride, Integer portOverride, MemoryPipeline pipeline) throws Exception {
        String host = hostOverride != null ? hostOverride : config.server().host();
        int port = portOverride != null ? portOverride : config.server().port();

        CountDownLatch shutdown = new CountDownLatch(1);
        try (PipelineServer server = new PipelineServer(host, port, pipeline)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Pipeline server started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: GET /healthz, POST /pipeline/conflicts, /pipeline/clarify, /pipeline/context, /pipeline/turn");
            shutdown.await();
        }
        return 0;
    }
}
