package io.memoria.core.disclosure;

import io.memoria.core.model.SaveDecision;
import java.util.List;
import java.util.Optional;

/**
 * Fixed follow-up suggestions keyed by intent. A held turn gets none since its cards take
 * the user's attention.
 */
public final class QuickReplyMenu {

    static final List<QuickReply> GREETING = List.of(
        new QuickReply("qr_howareyou", "How are you?", "How are you doing today?", "👋"),
        new QuickReply("qr_whatcanido", "What can you do?", "What can you help me with?", "❓"),
        new QuickReply("qr_tellme", "Tell me something", "Tell me something interesting", "💡")
    );
    static final List<QuickReply> SAVED = List.of(
        new QuickReply("qr_showmemories", "Show my memories", "Show me what you remember about me", "🧠"),
        new QuickReply("qr_addmore", "Add more", "I want to tell you something else", "➕"),
        new QuickReply("qr_thanks", "Thanks!", "Thanks, that's all for now", "👍")
    );
    static final List<QuickReply> RECALL = List.of(
        new QuickReply("qr_lastweek", "Last week", "What happened last week?", "📅"),
        new QuickReply("qr_relationships", "My people", "Who do you know about in my life?", "👥"),
        new QuickReply("qr_events", "Upcoming events", "What events do I have coming up?", "📆")
    );
    static final List<QuickReply> QUESTION = List.of(
        new QuickReply("qr_tellmore", "Tell me more", "Tell me more about that", "📖"),
        new QuickReply("qr_example", "Give an example", "Can you give me an example?", "💡")
    );

    private QuickReplyMenu() {
    }

    public static List<QuickReply> forTurn(Optional<String> intent, SaveDecision decision, boolean holding) {
        if (holding || intent.isEmpty()) {
            return List.of();
        }
        String value = intent.get();
        if (Intents.SOCIAL.contains(value)) {
            return GREETING;
        }
        if (Intents.MEMORY_INSTRUCTION.equals(value) && decision != null && decision.saved()) {
            return SAVED;
        }
        if (Intents.MEMORY_RECALL.equals(value) || Intents.MEMORY_RECALL_TEMPORAL.equals(value)) {
            return RECALL;
        }
        if (Intents.QUESTION.equals(value)) {
            return QUESTION;
        }
        return List.of();
    }
}
