package io.memoria.core.pipeline;

import io.memoria.core.clarification.ClarificationResult;
import io.memoria.core.conflict.ConflictCheckResult;
import io.memoria.core.disclosure.ContextInjectionResult;

public record TurnResult(ConflictCheckResult conflictCheck, ClarificationResult clarification, ContextInjectionResult context) {
}
