package io.memoria.core.clarification;

import io.memoria.core.config.model.ClarificationConfig;
import io.memoria.core.model.ConflictCard;
import io.memoria.core.model.ConflictVerdict;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MemoryCard;
import io.memoria.core.model.TurnAction;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether the turn pauses for clarification, and renders the cards and questions that
 * explain why. Conflicts always pause the turn; so does any memory missing a required slot.
 */
public final class ClarificationService {
    private static final Logger LOG = LoggerFactory.getLogger(ClarificationService.class);

    private final AmbiguityAnalyzer analyzer;
    private final Clock clock;
    private final Supplier<String> conflictIds;

    public ClarificationService(AmbiguityAnalyzer analyzer, Clock clock) {
        this(analyzer, clock, () -> "conflict_" + clock.millis() + "_" + randomSuffix());
    }

    public ClarificationService(AmbiguityAnalyzer analyzer, Clock clock, Supplier<String> conflictIds) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.conflictIds = Objects.requireNonNull(conflictIds, "conflictIds must not be null");
    }

    public ClarificationResult process(ClarificationRequest request, ClarificationConfig config) {
        List<ExtractedMemoryCandidate> items = request.items();
        List<ConflictVerdict> conflicts = request.pendingConflicts();

        if (!config.enabled()) {
            LOG.info("Clarification disabled, passing {} memories through", items.size());
            return ClarificationResult.proceed(items, conflicts.size(), config.mode());
        }
        if (items.isEmpty() && conflicts.isEmpty()) {
            return ClarificationResult.proceed(List.of(), 0, config.mode());
        }
        if (config.mode() == ClarificationConfig.Mode.LLM) {
            LOG.info("Clarification mode llm is not implemented, using local slot checks");
        }

        Set<String> questions = new LinkedHashSet<>();
        boolean hold = false;

        List<ConflictCard> conflictCards = new ArrayList<>();
        for (ConflictVerdict conflict : conflicts) {
            ConflictCard card = CardBuilder.conflictCard(conflict, conflictIds.get());
            conflictCards.add(card);
            questions.add(card.question());
            hold = true;
        }

        List<ExtractedMemoryCandidate> memories = new ArrayList<>();
        List<MemoryCard> memoryCards = new ArrayList<>();
        for (ExtractedMemoryCandidate item : items) {
            Optional<String> skipped = skipReason(item, request, config);
            ItemOutcome outcome;
            if (skipped.isPresent()) {
                LOG.info("Not clarifying {}: {}", item.tempId(), skipped.get());
                outcome = unquestioned(item);
            } else if (config.mode() == ClarificationConfig.Mode.HYBRID) {
                outcome = hybrid(item, request, config);
            } else {
                outcome = local(item);
            }
            memories.add(outcome.item());
            memoryCards.add(outcome.card());
            questions.addAll(outcome.questions());
            hold = hold || outcome.hold();
            LOG.info(
                "{} {}: complete={}, missing={}",
                outcome.card().icon(),
                outcome.card().title(),
                outcome.card().complete(),
                outcome.card().missingRequired().isEmpty() ? "none" : String.join(",", outcome.card().missingRequired())
            );
        }

        List<String> limited = questions.stream().limit(config.limits().maxQuestionsPerTurn()).toList();
        TurnAction action = hold ? config.behavior().whenIncomplete() : TurnAction.PROCEED;
        int incompleteCount = (int) memoryCards.stream().filter(card -> !card.complete()).count();

        LOG.info(
            "Generated {} memory cards, {} conflict cards, {} incomplete, hold={}, mode={}",
            memoryCards.size(),
            conflictCards.size(),
            incompleteCount,
            hold,
            config.mode()
        );
        return new ClarificationResult(
            memories,
            hold,
            memoryCards,
            conflictCards,
            limited,
            action,
            SlotCompletionChecker.completenessScore(memories),
            incompleteCount,
            conflictCards.size(),
            config.mode()
        );
    }

    private static Optional<String> skipReason(
        ExtractedMemoryCandidate item,
        ClarificationRequest request,
        ClarificationConfig config
    ) {
        if (!config.behavior().checkRequired()) {
            return Optional.of("required slot checks are off");
        }
        ClarificationConfig.Skip skip = config.skip();
        if (request.userDismissed() && skip.userSaysEnough()) {
            return Optional.of("user dismissed questions");
        }
        if (skip.lowConfidence() && item.confidence() < skip.lowConfidenceThreshold()) {
            return Optional.of("confidence " + item.confidence() + " below " + skip.lowConfidenceThreshold());
        }
        boolean never = config.typeSetting(item.type())
            .map(setting -> setting.level() == ClarificationConfig.Level.NEVER)
            .orElse(false);
        if (never) {
            return Optional.of(item.type() + " memories are never clarified");
        }
        return Optional.empty();
    }

    private ItemOutcome unquestioned(ExtractedMemoryCandidate item) {
        MemoryCard card = CardBuilder.memoryCard(item, SlotCompletionChecker.missingRequired(item));
        return new ItemOutcome(item, card, List.of(), false);
    }

    private ItemOutcome local(ExtractedMemoryCandidate item) {
        List<String> missing = SlotCompletionChecker.missingRequired(item);
        MemoryCard card = CardBuilder.memoryCard(item, missing);
        return new ItemOutcome(item, card, CardBuilder.fallbackQuestions(item, missing), !missing.isEmpty());
    }

    private ItemOutcome hybrid(ExtractedMemoryCandidate item, ClarificationRequest request, ClarificationConfig config) {
        try {
            List<String> locallyMissing = SlotCompletionChecker.missingRequired(item);
            AmbiguityAnalysis analysis = analyzer.suggest(
                item,
                request.originalMessage().isEmpty() ? item.originalMessage() : request.originalMessage(),
                LocalDate.now(clock),
                config.llm()
            );
            LOG.info("Ambiguity analysis: {} suggestions, {}", analysis.suggestions().size(), analysis.analysis());

            QuestionBudget budget = new QuestionBudget(
                config.perItemQuestionCap(item.type()),
                config.behavior().allowPartialAfter(),
                request.questionsAskedCount()
            );
            ArbitrationOutcome outcome = SuggestionArbiter.arbitrate(
                analysis.suggestions(),
                item.typeConfig().requiredSlotIds(),
                budget
            );

            ExtractedMemoryCandidate resolved = item;
            MemoryCard card = CardBuilder.memoryCard(item, locallyMissing);
            for (Map.Entry<String, String> entry : outcome.autoApply().entrySet()) {
                if (!knownSlot(item, entry.getKey())) {
                    continue;
                }
                LOG.info("Auto-resolving {} -> {}", entry.getKey(), entry.getValue());
                resolved = resolved.withResolvedSlot(entry.getKey(), entry.getValue());
                card = card.withResolvedSlot(entry.getKey(), entry.getValue());
            }

            List<String> questions = new ArrayList<>();
            Set<String> asked = new LinkedHashSet<>();
            for (AmbiguitySuggestion suggestion : outcome.ask()) {
                questions.add(suggestion.question());
                asked.add(suggestion.slotId());
                card = card.withMissing(suggestion.slotId());
            }

            List<String> uncovered = card.missingRequired().stream().filter(slotId -> !asked.contains(slotId)).toList();
            questions.addAll(CardBuilder.fallbackQuestions(resolved, uncovered));

            boolean hold = !outcome.ask().isEmpty() || !card.complete();
            return new ItemOutcome(resolved, card, questions, hold);
        } catch (RuntimeException e) {
            LOG.warn("Hybrid clarification failed for {}, falling back to local check: {}", item.tempId(), e.getMessage());
            return local(item);
        }
    }

    private static boolean knownSlot(ExtractedMemoryCandidate item, String slotId) {
        return item.slots().containsKey(slotId)
            || item.typeConfig().requiredSlotIds().contains(slotId)
            || item.typeConfig().optionalSlots().stream().anyMatch(slot -> slot.id().equals(slotId));
    }

    private static String randomSuffix() {
        return Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36 * 36), 36);
    }

    private record ItemOutcome(ExtractedMemoryCandidate item, MemoryCard card, List<String> questions, boolean hold) {
    }
}
