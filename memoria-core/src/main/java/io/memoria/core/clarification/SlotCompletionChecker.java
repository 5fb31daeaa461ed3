package io.memoria.core.clarification;

import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.SlotValue;
import java.util.ArrayList;
import java.util.List;

public final class SlotCompletionChecker {

    private SlotCompletionChecker() {
    }

    /**
     * Required slot ids of the item's type whose slot is absent or not filled, in the type's order.
     */
    public static List<String> missingRequired(ExtractedMemoryCandidate item) {
        List<String> missing = new ArrayList<>();
        for (String slotId : item.typeConfig().requiredSlotIds()) {
            SlotValue slot = item.slots().get(slotId);
            if (slot == null || !slot.hasValue()) {
                missing.add(slotId);
            }
        }
        return List.copyOf(missing);
    }

    public static boolean complete(ExtractedMemoryCandidate item) {
        return missingRequired(item).isEmpty();
    }

    /**
     * Mean share of filled required slots. Items without required slots count as complete,
     * and an empty list scores 1.
     */
    public static double completenessScore(List<ExtractedMemoryCandidate> items) {
        if (items.isEmpty()) {
            return 1;
        }
        double total = 0;
        for (ExtractedMemoryCandidate item : items) {
            int required = item.typeConfig().requiredSlots().size();
            if (required == 0) {
                total += 1;
            } else {
                int filled = Math.max(0, required - missingRequired(item).size());
                total += (double) filled / required;
            }
        }
        return total / items.size();
    }
}
