package io.memoria.core.disclosure;

import java.util.Set;

final class Intents {
    static final String GREETING = "greeting";
    static final String SMALLTALK = "smalltalk";
    static final String MEMORY_INSTRUCTION = "memory_instruction";
    static final String QUESTION = "question";
    static final String MEMORY_RECALL = "memory_recall";
    static final String MEMORY_RECALL_TEMPORAL = "memory_recall_temporal";

    static final Set<String> SOCIAL = Set.of(GREETING, SMALLTALK);
    static final Set<String> MEMORY_USE = Set.of(QUESTION, MEMORY_RECALL, MEMORY_RECALL_TEMPORAL, "recommendation", "advice");

    private Intents() {
    }
}
