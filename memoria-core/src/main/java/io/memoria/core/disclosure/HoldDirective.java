package io.memoria.core.disclosure;

import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.SaveDecision;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Directive for turns held until the user completes the pending memory cards.
 */
public final class HoldDirective {

    private HoldDirective() {
    }

    public static Optional<String> render(SaveDecision decision) {
        if (decision == null || !decision.holding() || decision.pendingCards().isEmpty()) {
            return Optional.empty();
        }
        long incomplete = decision.pendingCards().stream().filter(card -> !card.complete()).count();
        String cards = decision.pendingCards().stream()
            .map(HoldDirective::cardLine)
            .collect(Collectors.joining("\n"));
        return Optional.of("""
            [CONTEXT: MEMORY CARDS PENDING]
            The user shared information that I'm capturing.
            %d item(s) need more details before saving.

            Items detected:
            %s

            IMPORTANT INSTRUCTIONS:
            - The UI will show interactive cards for the user to complete
            - Keep your text response brief and friendly
            - Acknowledge what you understood
            - Do NOT list all missing fields in text - the cards show that
            - Example: "Got it! I'll save that once you complete the details.\"""".formatted(incomplete, cards));
    }

    private static String cardLine(MemoryCard card) {
        String missing = card.missingRequired().isEmpty() ? "none" : String.join(", ", card.missingRequired());
        return "- " + card.icon() + " " + card.title() + ": missing " + missing;
    }
}
