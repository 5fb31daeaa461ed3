package io.memoria.core.disclosure;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.model.SaveDecision;
import io.memoria.core.model.SaveResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class SaveTruthGuardTest {

    @Test
    void shouldForbidConfirmationWithoutSaveInformation() {
        assertThat(SaveTruthGuard.directive(null, List.of())).isEqualTo(SaveTruthGuard.NO_SAVE_DIRECTIVE);
        assertThat(SaveTruthGuard.directive(null, null)).isEqualTo(SaveTruthGuard.NO_SAVE_DIRECTIVE);
        assertThat(SaveTruthGuard.NO_SAVE_DIRECTIVE)
            .startsWith("[CRITICAL MEMORY RULE — NO SAVE CONFIRMED]")
            .endsWith("[END RULE]");
    }

    @Test
    void shouldAllowConfirmationOnlyWhenDecisionSaved() {
        SaveDecision saved = new SaveDecision(true, 1, "stored", SaveDecision.Kind.SAVE, List.of());
        SaveDecision skipped = new SaveDecision(false, 0, "duplicate", SaveDecision.Kind.SKIP, List.of());

        assertThat(SaveTruthGuard.directive(saved, List.of())).isEqualTo(SaveTruthGuard.SAVE_CONFIRMED_DIRECTIVE);
        assertThat(SaveTruthGuard.directive(skipped, List.of())).isEqualTo(SaveTruthGuard.NO_SAVE_DIRECTIVE);
    }

    @Test
    void shouldLetDecisionWinOverLegacyResults() {
        SaveDecision skipped = new SaveDecision(false, 0, "", SaveDecision.Kind.SKIP, List.of());
        List<SaveResult> legacy = List.of(new SaveResult(true, "Loves sushi", null));

        assertThat(SaveTruthGuard.directive(skipped, legacy)).isEqualTo(SaveTruthGuard.NO_SAVE_DIRECTIVE);
    }

    @Test
    void shouldListSavedContentsFromLegacyResults() {
        List<SaveResult> legacy = List.of(
            new SaveResult(true, "Loves sushi", null),
            new SaveResult(false, "Maybe likes golf", "low confidence"),
            new SaveResult(true, "Sister named Anna", null)
        );

        String directive = SaveTruthGuard.directive(null, legacy);

        assertThat(directive).isEqualTo("""
            [MEMORY SAVE CONFIRMED]
            - Successfully saved to memory:
              * "Loves sushi"
              * "Sister named Anna"
            - You MAY confirm to the user that this information was saved.
            [END CONFIRMATION]""");
    }

    @Test
    void shouldForbidConfirmationWhenNoLegacyResultSaved() {
        List<SaveResult> legacy = List.of(new SaveResult(false, "Maybe likes golf", "low confidence"));

        assertThat(SaveTruthGuard.directive(null, legacy)).isEqualTo(SaveTruthGuard.NO_SAVE_DIRECTIVE);
    }
}
