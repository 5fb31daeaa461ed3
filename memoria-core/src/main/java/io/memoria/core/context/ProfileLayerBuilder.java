package io.memoria.core.context;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.RelevantMemory;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived facts about the user, most relevant first. Over budget, the least relevant memory goes first.
 */
public final class ProfileLayerBuilder implements LayerBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ProfileLayerBuilder.class);

    private final TokenEstimator estimator;

    public ProfileLayerBuilder(TokenEstimator estimator) {
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
    }

    @Override
    public LayerKind kind() {
        return LayerKind.PROFILE;
    }

    @Override
    public ContextLayer build(UserContext context, ContextInjectionConfig config) {
        ContextInjectionConfig.Profile settings = config.layers().profile();
        if (!settings.enabled()) {
            return ContextLayer.empty(kind());
        }

        double minRelevance = config.injection().minRelevance();
        Set<String> included = lowerCased(settings.includeTypes());
        Set<String> excluded = lowerCased(settings.excludeTypes());
        List<RelevantMemory> memories = context.memories().stream()
            .filter(memory -> {
                String type = memory.type().toLowerCase(Locale.ROOT);
                return included.contains(type) && !excluded.contains(type);
            })
            .filter(memory -> memory.relevance() >= minRelevance)
            .sorted(Comparator.comparingDouble(RelevantMemory::relevance).reversed())
            .limit(settings.maxMemories())
            .toList();
        if (memories.isEmpty()) {
            return ContextLayer.empty(kind());
        }

        BudgetTrimmer.Trimmed<RelevantMemory> result = BudgetTrimmer.trim(
            memories,
            ProfileLayerBuilder::render,
            settings.tokenBudget(),
            estimator,
            ProfileLayerBuilder::leastRelevant
        );
        int tokens = estimator.estimate(result.content());
        if (config.debug().logLayerTokens()) {
            LOG.info("Profile layer: {} memories, {} tokens{}", result.items().size(), tokens, result.trimmed() ? " (trimmed)" : "");
        }
        return new ContextLayer(kind(), result.content(), tokens, result.items().size(), result.trimmed());
    }

    private static Set<String> lowerCased(List<String> types) {
        return types.stream().map(type -> type.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    private static String render(List<RelevantMemory> memories) {
        return memories.stream().map(memory -> "- " + memory.content()).collect(Collectors.joining("\n"));
    }

    /**
     * Index of the lowest-relevance memory; among equals, the last one.
     */
    static int leastRelevant(List<RelevantMemory> memories) {
        int victim = memories.size() - 1;
        for (int i = memories.size() - 1; i >= 0; i--) {
            if (memories.get(i).relevance() < memories.get(victim).relevance()) {
                victim = i;
            }
        }
        return victim;
    }
}
