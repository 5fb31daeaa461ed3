package io.memoria.core.clarification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.SlotValue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SlotCompletionCheckerTest {

    @Test
    void shouldReportMissingRequiredSlotInTypeOrder() {
        ExtractedMemoryCandidate item = Fixtures.dentistWithoutDate();

        List<String> missing = SlotCompletionChecker.missingRequired(item);
        MemoryCard card = CardBuilder.memoryCard(item, missing);

        assertThat(missing).containsExactly("when_date");
        assertThat(card.complete()).isFalse();
        assertThat(card.missingRequired()).containsExactly("when_date");
        assertThat(card.title()).isEqualTo("Dentist");
        assertThat(card.subtitle()).isEqualTo("No date set");
        assertThat(CardBuilder.fallbackQuestions(item, missing)).containsExactly("What is the when date?");
    }

    @Test
    void shouldTreatBlankValuesAsMissing() {
        ExtractedMemoryCandidate item = Fixtures.event("tmp-1", Map.of(
            "what", SlotValue.filled("   "),
            "when_date", new SlotValue("2026-03-03", false, null)
        ));

        assertThat(SlotCompletionChecker.missingRequired(item)).containsExactly("what", "when_date");
    }

    @Test
    void shouldFillQuestionTemplateFromFilledSlots() {
        ExtractedMemoryCandidate item = new ExtractedMemoryCandidate(
            "tmp-2",
            "Anna is important to me",
            "relationship",
            0.8,
            Map.of("person_name", SlotValue.filled("Anna")),
            Fixtures.RELATIONSHIP,
            "Anna is important to me"
        );

        List<String> missing = SlotCompletionChecker.missingRequired(item);

        assertThat(missing).containsExactly("relationship_type");
        assertThat(CardBuilder.fallbackQuestions(item, missing)).containsExactly("How do you know Anna?");
    }

    @Test
    void shouldScoreCompletenessAsMeanFilledShare() {
        ExtractedMemoryCandidate half = Fixtures.dentistWithoutDate();
        ExtractedMemoryCandidate full = Fixtures.event("tmp-2", Map.of(
            "what", SlotValue.filled("dentist"),
            "when_date", SlotValue.filled("2026-03-03")
        ));
        ExtractedMemoryCandidate untyped = new ExtractedMemoryCandidate("tmp-3", "Likes tea", "preference", 0.9, Map.of(), null, "");

        assertThat(SlotCompletionChecker.completenessScore(List.of(half, full, untyped))).isCloseTo(2.5 / 3, within(1e-9));
        assertThat(SlotCompletionChecker.completenessScore(List.of())).isEqualTo(1.0);
        assertThat(SlotCompletionChecker.complete(full)).isTrue();
    }

    @Test
    void shouldRenderEventSubtitleWithDateAndTime() {
        ExtractedMemoryCandidate item = Fixtures.event("tmp-1", Map.of(
            "what", SlotValue.filled("dentist"),
            "when_date", SlotValue.filled("2026-03-03"),
            "when_time", SlotValue.filled("15:00")
        ));

        assertThat(CardBuilder.subtitle(item)).isEqualTo("2026-03-03 at 15:00");
    }
}
