package io.memoria.core.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExtractedMemoryCandidate;
import java.util.ArrayList;
import java.util.List;

public record ConflictCheckResult(
    int checked,
    List<ExtractedMemoryCandidate> clean,
    List<ConflictVerdict> autoResolved,
    List<ConflictVerdict> pendingClarifications
) {

    public ConflictCheckResult {
        clean = clean == null ? List.of() : List.copyOf(clean);
        autoResolved = autoResolved == null ? List.of() : List.copyOf(autoResolved);
        pendingClarifications = pendingClarifications == null ? List.of() : List.copyOf(pendingClarifications);
    }

    public static ConflictCheckResult allClean(int checked, List<ExtractedMemoryCandidate> candidates) {
        return new ConflictCheckResult(checked, candidates, List.of(), List.of());
    }

    /**
     * Every verdict that found a relation needing action, auto-resolved ones first.
     */
    @JsonProperty("conflicts")
    public List<ConflictVerdict> conflicts() {
        List<ConflictVerdict> all = new ArrayList<>(autoResolved);
        all.addAll(pendingClarifications);
        return List.copyOf(all);
    }
}
