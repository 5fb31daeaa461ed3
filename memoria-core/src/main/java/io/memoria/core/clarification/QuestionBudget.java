package io.memoria.core.clarification;

/**
 * Limits on how many questions one item may queue. {@code perItemCap} bounds the item's own
 * questions; {@code allowPartialAfter} bounds the user's total including questions asked in earlier turns.
 */
public record QuestionBudget(int perItemCap, int allowPartialAfter, int questionsAskedCount) {

    public QuestionBudget {
        if (perItemCap < 0 || allowPartialAfter < 0 || questionsAskedCount < 0) {
            throw new IllegalArgumentException("question budget values must not be negative");
        }
    }

    public boolean itemCapReached(int queued) {
        return queued >= perItemCap;
    }

    public boolean fatigueReached(int queued) {
        return questionsAskedCount + queued >= allowPartialAfter;
    }
}
