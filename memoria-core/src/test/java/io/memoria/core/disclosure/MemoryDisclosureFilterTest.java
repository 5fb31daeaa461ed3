package io.memoria.core.disclosure;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.model.RelevantMemory;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MemoryDisclosureFilterTest {

    private static final RelevantMemory NAME = memory("User's name is Sam", "name", "", 0.95);
    private static final RelevantMemory DENTIST = memory("Dentist on Tuesday", "event", "", 0.9);
    private static final RelevantMemory SUSHI = memory("Loves sushi", "preference", "", 0.9);
    private static final RelevantMemory MARATHON = memory("Run a marathon", "goal", "", 0.85);
    private static final List<RelevantMemory> MEMORIES = List.of(NAME, DENTIST, SUSHI, MARATHON);

    @Test
    void shouldKeepOnlyIdentityOnGreeting() {
        List<RelevantMemory> disclosed = MemoryDisclosureFilter.filter(MEMORIES, Optional.of("greeting"));

        assertThat(disclosed).containsExactly(NAME);
        assertThat(ContextModeResolver.resolve(Optional.of("greeting"))).isEqualTo(ContextMode.IDENTITY_ONLY);
    }

    @Test
    void shouldExcludePersonalTypedMemoriesEvenWithIdentityContextOnSmalltalk() {
        RelevantMemory taggedEvent = memory("Birthday party for Sam", "event", "identity", 0.9);
        RelevantMemory taggedFact = memory("Goes by Sammy", "fact", "IDENTITY", 0.9);

        List<RelevantMemory> disclosed = MemoryDisclosureFilter.filter(List.of(taggedEvent, taggedFact), Optional.of("smalltalk"));

        assertThat(disclosed).containsExactly(taggedFact);
    }

    @Test
    void shouldKeepOnlyIdentityWithoutIntent() {
        assertThat(MemoryDisclosureFilter.filter(MEMORIES, Optional.empty())).containsExactly(NAME);
        assertThat(ContextModeResolver.resolve(Optional.empty())).isEqualTo(ContextMode.NEUTRAL_ACK);
    }

    @Test
    void shouldDiscloseEverythingForMemoryUseIntents() {
        for (String intent : List.of("question", "memory_recall", "memory_recall_temporal", "recommendation", "advice")) {
            assertThat(MemoryDisclosureFilter.filter(MEMORIES, Optional.of(intent))).containsExactlyElementsOf(MEMORIES);
            assertThat(ContextModeResolver.resolve(Optional.of(intent))).isEqualTo(ContextMode.MEMORY_USE_ALLOWED);
        }
    }

    @Test
    void shouldDiscloseEverythingForMemoryInstruction() {
        assertThat(MemoryDisclosureFilter.filter(MEMORIES, Optional.of("memory_instruction"))).hasSize(4);
        assertThat(ContextModeResolver.resolve(Optional.of("memory_instruction"))).isEqualTo(ContextMode.MEMORY_CONFIRM_ALLOWED);
    }

    @Test
    void shouldKeepIdentityAndHighRelevanceFactsForOtherIntents() {
        RelevantMemory strongFact = memory("Lives in Berlin", "fact", "", 0.8);
        RelevantMemory weakFact = memory("Has a bike", "fact", "", 0.79);

        List<RelevantMemory> disclosed = MemoryDisclosureFilter.filter(
            List.of(NAME, strongFact, weakFact, SUSHI),
            Optional.of("statement")
        );

        assertThat(disclosed).containsExactly(NAME, strongFact);
        assertThat(ContextModeResolver.resolve(Optional.of("statement"))).isEqualTo(ContextMode.NEUTRAL_ACK);
    }

    @Test
    void shouldOnlyEverRemoveMemories() {
        for (String intent : List.of("greeting", "smalltalk", "question", "statement", "memory_instruction")) {
            List<RelevantMemory> disclosed = MemoryDisclosureFilter.filter(MEMORIES, Optional.of(intent));
            assertThat(MEMORIES).containsAll(disclosed);
        }
        assertThat(MemoryDisclosureFilter.filter(List.of(), Optional.of("question"))).isEmpty();
    }

    private static RelevantMemory memory(String content, String type, String context, double relevance) {
        return new RelevantMemory(content, content, type, context, relevance, null, null);
    }
}
