package io.memoria.core.conflict;

import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ConflictRelation;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import java.util.Optional;

public final class ResolutionPolicy {
    static final String DUPLICATE_REASON = "Duplicate detected, skipping";
    static final String UPDATE_REASON = "Auto-resolved as update";

    private ResolutionPolicy() {
    }

    /**
     * Turns a classification into a verdict. Relations that can coexist yield no verdict, so
     * the caller keeps scanning.
     */
    public static Optional<ConflictVerdict> resolve(
        Classification classification,
        ExistingMemoryRecord existing,
        ExtractedMemoryCandidate candidate,
        ConflictCheckConfig.Behavior behavior
    ) {
        ConflictRelation relation = classification.relation();
        if (relation.coexists()) {
            return Optional.empty();
        }
        double confidence = classification.confidence();
        if (relation == ConflictRelation.DUPLICATE && behavior.skipDuplicates()) {
            return Optional.of(ConflictVerdict.autoResolved(relation, confidence, DUPLICATE_REASON, existing, candidate));
        }
        if (relation == ConflictRelation.UPDATE && behavior.autoResolveUpdates()) {
            return Optional.of(ConflictVerdict.autoResolved(relation, confidence, UPDATE_REASON, existing, candidate));
        }
        return Optional.of(ConflictVerdict.pending(relation, confidence, classification.reason(), existing, candidate));
    }

    static int severity(ConflictRelation relation) {
        return switch (relation) {
            case CONFLICT -> 3;
            case UPDATE -> 2;
            case DUPLICATE -> 1;
            case ADDITION, NONE -> 0;
        };
    }
}
