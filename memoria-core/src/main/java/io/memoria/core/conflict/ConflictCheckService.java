package io.memoria.core.conflict;

import io.memoria.core.config.model.ConflictCheckConfig;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.store.MemoryRecordStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConflictCheckService {
    private static final Logger LOG = LoggerFactory.getLogger(ConflictCheckService.class);
    static final int EXISTING_RECORD_LIMIT = 100;

    private final ConflictClassifier classifier;
    private final MemoryRecordStore records;

    public ConflictCheckService(ConflictClassifier classifier, MemoryRecordStore records) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.records = Objects.requireNonNull(records, "records must not be null");
    }

    /**
     * Loads the user's latest active records and checks the candidates against them.
     * A failing store is treated as having no records.
     */
    public ConflictCheckResult check(String iin, List<ExtractedMemoryCandidate> candidates, ConflictCheckConfig config) {
        if (!config.enabled()) {
            LOG.info("Conflict check disabled, passing {} memories through", candidates.size());
            return ConflictCheckResult.allClean(0, candidates);
        }
        List<ExistingMemoryRecord> existing;
        try {
            existing = records.activeRecords(iin, EXISTING_RECORD_LIMIT);
        } catch (IOException e) {
            LOG.warn("Failed to load existing memories for {}: {}", iin, e.getMessage());
            existing = List.of();
        }
        return findConflicts(candidates, existing, config);
    }

    public ConflictCheckResult findConflicts(
        List<ExtractedMemoryCandidate> candidates,
        List<ExistingMemoryRecord> existingRecords,
        ConflictCheckConfig config
    ) {
        if (!config.enabled()) {
            return ConflictCheckResult.allClean(0, candidates);
        }
        if (existingRecords.isEmpty()) {
            return ConflictCheckResult.allClean(candidates.size(), candidates);
        }

        List<ExtractedMemoryCandidate> clean = new ArrayList<>();
        List<ConflictVerdict> autoResolved = new ArrayList<>();
        List<ConflictVerdict> pending = new ArrayList<>();

        for (ExtractedMemoryCandidate candidate : candidates) {
            List<ScoredRecord> matches = CandidateFinder.find(candidate, existingRecords, config);
            if (matches.isEmpty()) {
                logCheck(config, "No candidates for \"{}\"", abbreviate(candidate.content(), 50));
                clean.add(candidate);
                continue;
            }

            Optional<ConflictVerdict> verdict = config.strategy() == ConflictCheckConfig.Strategy.MOST_SEVERE
                ? mostSevere(candidate, matches, config)
                : firstMatch(candidate, matches, config);

            if (verdict.isEmpty()) {
                clean.add(candidate);
            } else if (verdict.get().autoResolved()) {
                autoResolved.add(verdict.get());
            } else {
                pending.add(verdict.get());
            }
        }

        LOG.info(
            "Conflict check complete: {} need clarification, {} auto-resolved, {} clean",
            pending.size(),
            autoResolved.size(),
            clean.size()
        );
        return new ConflictCheckResult(candidates.size(), clean, autoResolved, pending);
    }

    private Optional<ConflictVerdict> firstMatch(
        ExtractedMemoryCandidate candidate,
        List<ScoredRecord> matches,
        ConflictCheckConfig config
    ) {
        for (ScoredRecord match : matches) {
            if (match.similarity() < config.similarity().threshold()) {
                continue;
            }
            Classification classification = classify(candidate, match, config);
            Optional<ConflictVerdict> verdict = ResolutionPolicy.resolve(
                classification, match.record(), candidate, config.behavior()
            );
            if (verdict.isPresent()) {
                return verdict;
            }
        }
        return Optional.empty();
    }

    private Optional<ConflictVerdict> mostSevere(
        ExtractedMemoryCandidate candidate,
        List<ScoredRecord> matches,
        ConflictCheckConfig config
    ) {
        Classification worst = null;
        ScoredRecord worstMatch = null;
        for (ScoredRecord match : matches) {
            if (match.similarity() < config.similarity().threshold()) {
                continue;
            }
            Classification classification = classify(candidate, match, config);
            int severity = ResolutionPolicy.severity(classification.relation());
            if (severity > 0 && (worst == null || severity > ResolutionPolicy.severity(worst.relation()))) {
                worst = classification;
                worstMatch = match;
            }
        }
        if (worst == null) {
            return Optional.empty();
        }
        return ResolutionPolicy.resolve(worst, worstMatch.record(), candidate, config.behavior());
    }

    private Classification classify(ExtractedMemoryCandidate candidate, ScoredRecord match, ConflictCheckConfig config) {
        Classification classification = classifier.classify(match.record(), candidate, config);
        logCheck(
            config,
            "\"{}\" vs \"{}\" = {} ({})",
            abbreviate(candidate.content(), 30),
            abbreviate(match.record().content(), 30),
            classification.relation(),
            classification.confidence()
        );
        return classification;
    }

    private void logCheck(ConflictCheckConfig config, String format, Object... args) {
        if (config.behavior().logAllChecks()) {
            LOG.info(format, args);
        } else {
            LOG.debug(format, args);
        }
    }

    private static String abbreviate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
