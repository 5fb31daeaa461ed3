package io.memoria.core.disclosure;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.RelevantMemory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Type, tier and relevance filtering, ordering and capping of retrieved memories. Runs
 * before the disclosure filter. Identity memories are not subject to the type switches.
 */
public final class MemorySelector {

    private MemorySelector() {
    }

    public static List<RelevantMemory> select(List<RelevantMemory> memories, ContextInjectionConfig config) {
        Set<String> types = config.filter().enabledTypes().stream()
            .map(type -> type.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<String> tiers = config.filter().enabledTiers();
        double minRelevance = config.injection().minRelevance();

        List<RelevantMemory> selected = new ArrayList<>();
        for (RelevantMemory memory : memories) {
            boolean typeEnabled = types.contains(memory.type().toLowerCase(Locale.ROOT)) || MemoryDisclosureFilter.isIdentity(memory);
            if (typeEnabled && tiers.contains(memory.tier()) && memory.relevance() >= minRelevance) {
                selected.add(memory);
            }
        }

        switch (config.injection().sortBy()) {
            case RELEVANCE -> selected.sort(Comparator.comparingDouble(RelevantMemory::relevance).reversed());
            case RECENCY -> selected.sort(Comparator.comparing(RelevantMemory::createdAt).reversed());
            case TYPE -> selected.sort(Comparator.comparing(RelevantMemory::type));
            default -> {
            }
        }
        return List.copyOf(selected.subList(0, Math.min(selected.size(), config.injection().maxMemories())));
    }
}
