package io.memoria.core.pipeline;

import io.memoria.core.clarification.ClarificationRequest;
import io.memoria.core.clarification.ClarificationResult;
import io.memoria.core.clarification.ClarificationService;
import io.memoria.core.config.StageConfigService;
import io.memoria.core.conflict.ConflictCheckRequest;
import io.memoria.core.conflict.ConflictCheckResult;
import io.memoria.core.conflict.ConflictCheckService;
import io.memoria.core.disclosure.ContextInjectionRequest;
import io.memoria.core.disclosure.ContextInjectionResult;
import io.memoria.core.disclosure.ContextInjectionService;
import io.memoria.core.disclosure.IntentNormalizer;
import io.memoria.core.model.SaveDecision;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the three stages of a turn in order. Stage configuration is re-read on every call so
 * edits to the stage documents apply to the next turn.
 */
public final class MemoryPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryPipeline.class);

    private final ConflictCheckService conflicts;
    private final ClarificationService clarification;
    private final ContextInjectionService contextInjection;
    private final StageConfigService stageConfig;

    public MemoryPipeline(
        ConflictCheckService conflicts,
        ClarificationService clarification,
        ContextInjectionService contextInjection,
        StageConfigService stageConfig
    ) {
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts must not be null");
        this.clarification = Objects.requireNonNull(clarification, "clarification must not be null");
        this.contextInjection = Objects.requireNonNull(contextInjection, "contextInjection must not be null");
        this.stageConfig = Objects.requireNonNull(stageConfig, "stageConfig must not be null");
    }

    public ConflictCheckResult checkConflicts(ConflictCheckRequest request) {
        if (request.existing() != null) {
            return conflicts.findConflicts(request.candidates(), request.existing(), stageConfig.conflictCheck());
        }
        return conflicts.check(request.iin(), request.candidates(), stageConfig.conflictCheck());
    }

    public ClarificationResult clarify(ClarificationRequest request) {
        return clarification.process(request, stageConfig.clarification());
    }

    public ContextInjectionResult injectContext(ContextInjectionRequest request) {
        return contextInjection.build(request, stageConfig.contextInjection());
    }

    public TurnResult runTurn(TurnRequest request) {
        long started = System.nanoTime();
        ConflictCheckResult conflictCheck = conflicts.check(request.iin(), request.extractedMemories(), stageConfig.conflictCheck());

        ClarificationResult clarified = clarification.process(
            new ClarificationRequest(
                request.iin(),
                conflictCheck.clean(),
                request.message(),
                request.questionsAskedCount(),
                request.userDismissed(),
                IntentNormalizer.normalize(request.intent()).orElse(null),
                conflictCheck.pendingClarifications()
            ),
            stageConfig.clarification()
        );

        SaveDecision decision = request.saveDecision();
        if (clarified.holdForClarification() && (decision == null || !decision.holding())) {
            if (decision != null) {
                LOG.warn("Clarification holds the turn for {}, replacing supplied {} decision", request.iin(), decision.decision());
            }
            decision = SaveDecision.hold(clarified.memoryCards());
        }
        ContextInjectionResult context = contextInjection.build(
            new ContextInjectionRequest(
                request.iin(),
                request.message(),
                request.sessionId(),
                request.sessionMessages(),
                request.memories(),
                request.intent(),
                decision,
                request.saveResults(),
                request.userName()
            ),
            stageConfig.contextInjection()
        );

        LOG.info(
            "Turn for {} done in {}ms: {} checked, {} pending conflicts, action={}, mode={}",
            request.iin(),
            (System.nanoTime() - started) / 1_000_000,
            conflictCheck.checked(),
            conflictCheck.pendingClarifications().size(),
            clarified.action(),
            context.mode().key()
        );
        return new TurnResult(conflictCheck, clarified, context);
    }
}
