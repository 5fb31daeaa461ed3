package io.memoria.core.conflict;

import io.memoria.core.model.ExistingMemoryRecord;

public record ScoredRecord(ExistingMemoryRecord record, double similarity) {
}
