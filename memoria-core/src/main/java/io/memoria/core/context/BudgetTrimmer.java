package io.memoria.core.context;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Removes one item at a time until the rendered text fits the budget or a single item remains.
 * Every step removes an item, so the loop ends after at most {@code items.size() - 1} steps.
 */
public final class BudgetTrimmer {

    private BudgetTrimmer() {
    }

    public static <T> Trimmed<T> trim(
        List<T> items,
        Function<List<T>, String> render,
        int tokenBudget,
        TokenEstimator estimator,
        ToIntFunction<List<T>> victim
    ) {
        List<T> remaining = new ArrayList<>(items);
        String content = render.apply(remaining);
        boolean trimmed = false;
        while (remaining.size() > 1 && estimator.estimate(content) > tokenBudget) {
            remaining.remove(victim.applyAsInt(remaining));
            content = render.apply(remaining);
            trimmed = true;
        }
        return new Trimmed<>(List.copyOf(remaining), content, trimmed);
    }

    public static <T> ToIntFunction<List<T>> dropFirst() {
        return items -> 0;
    }

    public static <T> ToIntFunction<List<T>> dropLast() {
        return items -> items.size() - 1;
    }

    public record Trimmed<T>(List<T> items, String content, boolean trimmed) {
    }
}
