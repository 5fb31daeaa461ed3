package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Outcome of comparing one extracted memory against one existing record.
 * At most one of {@code autoResolved} and {@code needsClarification} is set,
 * and neither is set for relations that can coexist.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConflictVerdict(
    ConflictRelation relation,
    double confidence,
    String reason,
    ExistingMemoryRecord existing,
    ExtractedMemoryCandidate candidate,
    boolean needsClarification,
    boolean autoResolved
) {

    public ConflictVerdict {
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        reason = reason == null ? "" : reason;
        if (needsClarification && autoResolved) {
            throw new IllegalArgumentException("verdict cannot be both auto-resolved and pending clarification");
        }
        if (relation.coexists() && (needsClarification || autoResolved)) {
            throw new IllegalArgumentException(relation + " verdict cannot require resolution");
        }
    }

    public static ConflictVerdict autoResolved(
        ConflictRelation relation,
        double confidence,
        String reason,
        ExistingMemoryRecord existing,
        ExtractedMemoryCandidate candidate
    ) {
        return new ConflictVerdict(relation, confidence, reason, existing, candidate, false, true);
    }

    public static ConflictVerdict pending(
        ConflictRelation relation,
        double confidence,
        String reason,
        ExistingMemoryRecord existing,
        ExtractedMemoryCandidate candidate
    ) {
        return new ConflictVerdict(relation, confidence, reason, existing, candidate, true, false);
    }
}
