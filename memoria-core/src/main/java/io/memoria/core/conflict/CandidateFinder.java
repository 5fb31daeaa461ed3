package io.memoria.core.conflict;

import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class CandidateFinder {

    private CandidateFinder() {
    }

    /**
     * Existing records that may conflict with {@code candidate}, most similar first.
     * A record qualifies when it shares the candidate's type (or the candidate falls in a
     * conflict category) and its similarity reaches half the configured threshold.
     */
    public static List<ScoredRecord> find(
        ExtractedMemoryCandidate candidate,
        List<ExistingMemoryRecord> existingRecords,
        ConflictCheckConfig config
    ) {
        List<ScoredRecord> matches = new ArrayList<>();
        boolean categoryMatch = CategoryMatcher.matches(candidate.type(), candidate.content(), config.categories());
        for (ExistingMemoryRecord existing : existingRecords) {
            if (!candidate.type().equals(existing.type()) && !categoryMatch) {
                continue;
            }
            double similarity = SimilarityScorer.jaccard(candidate.content(), existing.content());
            if (similarity >= config.similarity().candidateThreshold()) {
                matches.add(new ScoredRecord(existing, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(ScoredRecord::similarity).reversed());
        return List.copyOf(matches.subList(0, Math.min(matches.size(), config.similarity().maxCandidates())));
    }
}
