package io.memoria.core.disclosure;

import io.memoria.core.model.RelevantMemory;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Narrows retrieved memories to what the intent allows the reply to mention. It only ever
 * removes memories; without an intent, only identity memories survive.
 */
public final class MemoryDisclosureFilter {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryDisclosureFilter.class);

    static final Set<String> PERSONAL_TYPES = Set.of("event", "appointment", "preference", "work", "todo", "goal", "relationship");
    static final double HIGH_RELEVANCE = 0.8;

    private MemoryDisclosureFilter() {
    }

    public static List<RelevantMemory> filter(List<RelevantMemory> memories, Optional<String> intent) {
        if (memories.isEmpty()) {
            return List.of();
        }
        if (intent.isEmpty()) {
            LOG.debug("No intent provided, keeping identity memories only");
            return memories.stream().filter(MemoryDisclosureFilter::isIdentity).toList();
        }

        String value = intent.get();
        if (Intents.SOCIAL.contains(value)) {
            return memories.stream()
                .filter(memory -> isIdentity(memory) && !PERSONAL_TYPES.contains(lower(memory.type())))
                .toList();
        }
        if (Intents.MEMORY_INSTRUCTION.equals(value) || Intents.MEMORY_USE.contains(value)) {
            return List.copyOf(memories);
        }
        return memories.stream()
            .filter(memory -> isIdentity(memory) || ("fact".equals(lower(memory.type())) && memory.relevance() >= HIGH_RELEVANCE))
            .toList();
    }

    static boolean isIdentity(RelevantMemory memory) {
        return RelevantMemory.IDENTITY_TYPE.equals(lower(memory.type()))
            || RelevantMemory.IDENTITY_CONTEXT.equals(lower(memory.context()));
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
