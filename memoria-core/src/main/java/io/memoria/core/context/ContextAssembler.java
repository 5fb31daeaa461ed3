package io.memoria.core.context;

import io.memoria.core.config.model.ContextInjectionConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds every layer concurrently and joins them in the configured section order. A layer
 * whose builder fails contributes nothing.
 */
public final class ContextAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(ContextAssembler.class);

    private final List<LayerBuilder> builders;
    private final ExecutorService executor;

    public ContextAssembler(List<LayerBuilder> builders, ExecutorService executor) {
        this.builders = List.copyOf(Objects.requireNonNull(builders, "builders must not be null"));
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public AssembledContext assemble(UserContext context, ContextInjectionConfig config) {
        Map<LayerKind, CompletableFuture<ContextLayer>> futures = new EnumMap<>(LayerKind.class);
        for (LayerBuilder builder : builders) {
            futures.put(builder.kind(), CompletableFuture.supplyAsync(() -> buildQuietly(builder, context, config), executor));
        }

        Map<LayerKind, ContextLayer> built = new EnumMap<>(LayerKind.class);
        for (LayerKind kind : LayerKind.values()) {
            CompletableFuture<ContextLayer> future = futures.get(kind);
            built.put(kind, future == null ? ContextLayer.empty(kind) : future.join());
        }

        List<String> sections = new ArrayList<>();
        List<String> included = new ArrayList<>();
        Map<String, Integer> tokensPerLayer = new LinkedHashMap<>();
        List<String> trimmed = new ArrayList<>();
        ContextInjectionConfig.PromptStructure structure = config.promptStructure();
        for (String section : structure.sectionOrder()) {
            Optional<LayerKind> kind = LayerKind.fromKey(section);
            if (kind.isEmpty() || included.contains(section)) {
                continue;
            }
            ContextLayer layer = built.get(kind.get());
            if (layer.isEmpty()) {
                continue;
            }
            sections.add(structure.headerFor(section) + "\n" + layer.content());
            included.add(section);
            tokensPerLayer.put(section, layer.tokenCount());
            if (layer.trimmed()) {
                trimmed.add(section);
            }
        }

        int totalTokens = tokensPerLayer.values().stream().mapToInt(Integer::intValue).sum();
        if (config.debug().logAssembly()) {
            LOG.info("Assembled context: {} tokens, layers {}", totalTokens, included);
        }
        if (config.debug().logTrimming() && !trimmed.isEmpty()) {
            LOG.info("Trimmed layers: {}", trimmed);
        }
        return new AssembledContext(
            List.copyOf(built.values()),
            String.join("\n\n", sections),
            totalTokens,
            new AssemblyDebug(included, tokensPerLayer, trimmed)
        );
    }

    private ContextLayer buildQuietly(LayerBuilder builder, UserContext context, ContextInjectionConfig config) {
        try {
            return builder.build(context, config);
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Layer {} unavailable: {}", builder.kind().key(), e.getMessage());
            return ContextLayer.empty(builder.kind());
        } catch (RuntimeException e) {
            LOG.warn("Layer {} failed: {}", builder.kind().key(), e.toString());
            return ContextLayer.empty(builder.kind());
        }
    }
}
