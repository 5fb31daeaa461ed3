package io.memoria.core.clarification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides locally which remote suggestions are acted on:
 * <ol>
 *   <li>a suggestion with a resolved value is applied, whatever the budget;</li>
 *   <li>a high or medium priority suggestion for a required slot is asked while the budget allows;</li>
 *   <li>anything else is dropped.</li>
 * </ol>
 */
public final class SuggestionArbiter {
    private static final Logger LOG = LoggerFactory.getLogger(SuggestionArbiter.class);

    private SuggestionArbiter() {
    }

    public static ArbitrationOutcome arbitrate(
        List<AmbiguitySuggestion> suggestions,
        List<String> requiredSlotIds,
        QuestionBudget budget
    ) {
        Map<String, String> autoApply = new LinkedHashMap<>();
        List<AmbiguitySuggestion> ask = new ArrayList<>();

        for (AmbiguitySuggestion suggestion : suggestions) {
            if (suggestion.resolvable()) {
                autoApply.put(suggestion.slotId(), suggestion.resolvedValue());
                continue;
            }
            boolean required = requiredSlotIds.contains(suggestion.slotId());
            if (!required || !suggestion.priority().worthAsking()) {
                LOG.debug("Dropping suggestion for {} ({}, required={})", suggestion.slotId(), suggestion.priority(), required);
                continue;
            }
            if (budget.itemCapReached(ask.size())) {
                LOG.debug("Skipping suggestion for {}: question cap reached", suggestion.slotId());
                continue;
            }
            if (budget.fatigueReached(ask.size())) {
                LOG.debug("Skipping suggestion for {}: user fatigue limit", suggestion.slotId());
                continue;
            }
            ask.add(suggestion);
        }
        return new ArbitrationOutcome(autoApply, ask);
    }
}
