package io.memoria.core.clarification;

import io.memoria.core.config.model.ClarificationConfig;
import io.memoria.core.model.ConflictCard;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.TurnAction;
import java.util.List;

public record ClarificationResult(
    List<ExtractedMemoryCandidate> memories,
    boolean holdForClarification,
    List<MemoryCard> memoryCards,
    List<ConflictCard> conflictCards,
    List<String> questions,
    TurnAction action,
    double completenessScore,
    int incompleteCount,
    int conflictsDetected,
    ClarificationConfig.Mode mode
) {

    public ClarificationResult {
        memories = memories == null ? List.of() : List.copyOf(memories);
        memoryCards = memoryCards == null ? List.of() : List.copyOf(memoryCards);
        conflictCards = conflictCards == null ? List.of() : List.copyOf(conflictCards);
        questions = questions == null ? List.of() : List.copyOf(questions);
        action = action == null ? TurnAction.PROCEED : action;
    }

    public static ClarificationResult proceed(List<ExtractedMemoryCandidate> memories, int conflictsDetected, ClarificationConfig.Mode mode) {
        return new ClarificationResult(memories, false, List.of(), List.of(), List.of(), TurnAction.PROCEED, 1, 0, conflictsDetected, mode);
    }
}
