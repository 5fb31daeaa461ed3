package io.memoria.core.clarification;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExtractedMemoryCandidate;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClarificationRequest(
    String iin,
    @JsonAlias({"extractedMemories"}) List<ExtractedMemoryCandidate> items,
    String originalMessage,
    int questionsAskedCount,
    boolean userDismissed,
    String intent,
    List<ConflictVerdict> pendingConflicts
) {

    public ClarificationRequest {
        iin = iin == null || iin.isBlank() ? "unknown" : iin;
        items = items == null ? List.of() : List.copyOf(items);
        originalMessage = originalMessage == null ? "" : originalMessage;
        if (questionsAskedCount < 0) {
            throw new IllegalArgumentException("questionsAskedCount must not be negative");
        }
        pendingConflicts = pendingConflicts == null ? List.of() : List.copyOf(pendingConflicts);
        for (ConflictVerdict conflict : pendingConflicts) {
            if (conflict.existing() == null) {
                throw new IllegalArgumentException("pending conflict must reference an existing memory");
            }
        }
    }
}
