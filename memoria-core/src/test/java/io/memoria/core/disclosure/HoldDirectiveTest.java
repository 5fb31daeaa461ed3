package io.memoria.core.disclosure;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.SaveDecision;
import io.memoria.core.model.SlotDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HoldDirectiveTest {

    private static final List<SlotDefinition> REQUIRED = List.of(SlotDefinition.of("what", null), SlotDefinition.of("when_date", null));

    @Test
    void shouldRenderNothingUnlessHolding() {
        assertThat(HoldDirective.render(null)).isEmpty();
        assertThat(HoldDirective.render(new SaveDecision(true, 1, "", SaveDecision.Kind.SAVE, List.of()))).isEmpty();
        assertThat(HoldDirective.render(SaveDecision.hold(List.of()))).isEmpty();
    }

    @Test
    void shouldCountOnlyIncompleteCards() {
        MemoryCard pending = card("tmp-1", "Dentist", List.of("when_date"));
        MemoryCard done = card("tmp-2", "Lunch with Ana", List.of());

        String directive = HoldDirective.render(SaveDecision.hold(List.of(pending, done))).orElseThrow();

        assertThat(directive)
            .startsWith("[CONTEXT: MEMORY CARDS PENDING]")
            .contains("1 item(s) need more details before saving.")
            .contains("- 📅 Dentist: missing when_date\n- 📅 Lunch with Ana: missing none")
            .contains("Do NOT list all missing fields in text");
    }

    private static MemoryCard card(String id, String title, List<String> missing) {
        return new MemoryCard(id, "event", "📅", title, "No date set", null, missing, REQUIRED, List.of(), Map.of());
    }
}
