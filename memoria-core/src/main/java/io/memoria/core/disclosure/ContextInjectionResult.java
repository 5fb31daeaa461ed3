package io.memoria.core.disclosure;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.memoria.core.context.AssembledContext;
import io.memoria.core.model.MemoryCard;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextInjectionResult(
    PromptParts prompt,
    ContextMode mode,
    int memoriesUsed,
    int memoriesFiltered,
    int tokenEstimate,
    boolean holdForClarification,
    List<MemoryCard> memoryCards,
    List<QuickReply> quickReplies,
    AssembledContext layerContext,
    List<String> enabledTypes,
    List<String> enabledTiers
) {

    public ContextInjectionResult {
        memoryCards = memoryCards == null ? List.of() : List.copyOf(memoryCards);
        quickReplies = quickReplies == null ? List.of() : List.copyOf(quickReplies);
        enabledTypes = enabledTypes == null ? List.of() : List.copyOf(enabledTypes);
        enabledTiers = enabledTiers == null ? List.of() : List.copyOf(enabledTiers);
    }
}
