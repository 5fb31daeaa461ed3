package io.memoria.core.conflict;

import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;

/**
 * Semantic relation between an existing record and a new memory. Implementations fail open:
 * any failure yields {@link io.memoria.core.model.ConflictRelation#NONE}.
 */
public interface ConflictClassifier {
    Classification classify(ExistingMemoryRecord existing, ExtractedMemoryCandidate candidate, ConflictCheckConfig config);
}
