package io.memoria.core.disclosure;

import io.memoria.core.model.SaveDecision;
import io.memoria.core.model.SaveResult;
import java.util.List;

/**
 * Chooses the save directive. Confirmation is allowed only when the save step reported a
 * save; everything else, including no save information at all, gets {@link #NO_SAVE_DIRECTIVE}.
 * An explicit decision always wins over legacy per-item results.
 */
public final class SaveTruthGuard {

    public static final String NO_SAVE_DIRECTIVE = """
        [CRITICAL MEMORY RULE — NO SAVE CONFIRMED]

        - No new memory has been saved during this message.
        - You MUST NOT say or imply that you:
          - remembered this
          - saved this
          - added this to memory
          - updated your memory
          - will remember this later
        - Treat the user's statement as conversational only.
        - You MAY acknowledge the information neutrally (e.g. "Got it", "Thanks for sharing").
        - You MUST NOT suggest persistence, future recall, or learning.

        [END RULE]""";

    public static final String SAVE_CONFIRMED_DIRECTIVE = """
        [MEMORY SAVE CONFIRMED]
        - Successfully saved to memory.
        - You MAY confirm to the user that this information was saved.
        - You MAY say "I'll remember that" or similar confirmation.
        [END CONFIRMATION]""";

    private SaveTruthGuard() {
    }

    public static String directive(SaveDecision decision, List<SaveResult> legacyResults) {
        if (decision != null) {
            return decision.saved() ? SAVE_CONFIRMED_DIRECTIVE : NO_SAVE_DIRECTIVE;
        }
        if (legacyResults == null || legacyResults.isEmpty()) {
            return NO_SAVE_DIRECTIVE;
        }
        List<SaveResult> saved = legacyResults.stream().filter(SaveResult::saved).toList();
        if (saved.isEmpty()) {
            return NO_SAVE_DIRECTIVE;
        }
        StringBuilder directive = new StringBuilder("[MEMORY SAVE CONFIRMED]\n- Successfully saved to memory:");
        for (SaveResult result : saved) {
            directive.append("\n  * \"").append(result.content()).append('"');
        }
        directive.append("\n- You MAY confirm to the user that this information was saved.\n[END CONFIRMATION]");
        return directive.toString();
    }
}
