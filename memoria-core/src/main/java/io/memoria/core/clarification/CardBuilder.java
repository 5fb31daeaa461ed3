package io.memoria.core.clarification;

import io.memoria.core.model.ConflictCard;
import io.memoria.core.model.ConflictRelation;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.SlotDefinition;
import io.memoria.core.model.SlotValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class CardBuilder {

    private CardBuilder() {
    }

    public static MemoryCard memoryCard(ExtractedMemoryCandidate item, List<String> missingRequired) {
        return new MemoryCard(
            item.tempId(),
            item.type(),
            item.typeConfig().icon(),
            title(item),
            subtitle(item),
            item.typeConfig().color(),
            missingRequired,
            item.typeConfig().requiredSlots(),
            item.typeConfig().optionalSlots(),
            item.slots()
        );
    }

    public static ConflictCard conflictCard(ConflictVerdict verdict, String conflictId) {
        boolean update = verdict.relation() == ConflictRelation.UPDATE;
        String existing = verdict.existing().content();
        String incoming = verdict.candidate().content();
        String question = update
            ? "I remember \"" + existing + "\". Did this change to \"" + incoming + "\"?"
            : "I have conflicting information: \"" + existing + "\" vs \"" + incoming + "\". Which is correct?";
        return new ConflictCard(
            conflictId,
            update ? ConflictCard.Kind.UPDATE : ConflictCard.Kind.CONFLICT,
            new ConflictCard.ExistingRef(verdict.existing().id(), existing, verdict.existing().type()),
            new ConflictCard.IncomingRef(verdict.candidate().tempId(), incoming, verdict.candidate().type()),
            question,
            ConflictCard.CANONICAL_OPTIONS
        );
    }

    /**
     * One question per missing slot: the slot's template with {@code {slot}} placeholders filled
     * from the item's filled slots, or "What is the &lt;label&gt;?".
     */
    public static List<String> fallbackQuestions(ExtractedMemoryCandidate item, List<String> missingSlotIds) {
        List<String> questions = new ArrayList<>();
        for (String slotId : missingSlotIds) {
            Optional<SlotDefinition> definition = item.typeConfig().requiredSlot(slotId);
            String template = definition.map(SlotDefinition::questionTemplate).orElse(null);
            if (template != null && !template.isBlank()) {
                questions.add(fillTemplate(template, item.slots()));
            } else {
                String label = definition.map(SlotDefinition::displayLabel).orElse(slotId.replace('_', ' '));
                questions.add("What is the " + label.toLowerCase(Locale.ROOT) + "?");
            }
        }
        return questions;
    }

    static String title(ExtractedMemoryCandidate item) {
        return switch (item.type()) {
            case "event" -> orDefault(capitalize(item.slotText("what")), "Event");
            case "relationship" -> orDefault(capitalize(item.slotText("person_name")), "Person");
            case "preference" -> orDefault(capitalize(item.slotText("what")), "Preference");
            case "todo" -> orDefault(capitalize(truncate(item.slotText("task"), 30)), "Task");
            case "goal" -> orDefault(capitalize(truncate(item.slotText("goal"), 30)), "Goal");
            case "fact" -> orDefault(capitalize(item.slotText("subject")), "Fact");
            default -> capitalize(item.type());
        };
    }

    static String subtitle(ExtractedMemoryCandidate item) {
        return switch (item.type()) {
            case "event" -> eventSubtitle(item.slotText("when_date"), item.slotText("when_time"));
            case "relationship" -> capitalize(item.slotText("relationship_type"));
            case "preference" -> item.slotText("sentiment");
            case "todo" -> item.slotText("due_date");
            case "goal" -> item.slotText("target_date");
            case "fact" -> truncate(item.slotText("value"), 40);
            default -> "";
        };
    }

    private static String eventSubtitle(String date, String time) {
        if (!date.isEmpty() && !time.isEmpty()) {
            return date + " at " + time;
        }
        if (!date.isEmpty()) {
            return date;
        }
        return "No date set";
    }

    private static String fillTemplate(String template, Map<String, SlotValue> slots) {
        String question = template;
        for (Map.Entry<String, SlotValue> entry : slots.entrySet()) {
            if (entry.getValue().hasValue()) {
                question = question.replace("{" + entry.getKey() + "}", entry.getValue().value());
            }
        }
        return question;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String orDefault(String value, String fallback) {
        return value.isEmpty() ? fallback : value;
    }
}
