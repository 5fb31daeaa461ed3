package io.memoria.core.context;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.DaySummary;
import io.memoria.core.store.DaySummaryFeed;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Day summaries from the nightly batch, newest first. Over budget, the oldest day goes first.
 */
public final class PastConversationsLayerBuilder implements LayerBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(PastConversationsLayerBuilder.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMM d", Locale.US);

    private final DaySummaryFeed feed;
    private final TokenEstimator estimator;

    public PastConversationsLayerBuilder(DaySummaryFeed feed, TokenEstimator estimator) {
        this.feed = Objects.requireNonNull(feed, "feed must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
    }

    @Override
    public LayerKind kind() {
        return LayerKind.PAST_CONVERSATIONS;
    }

    @Override
    public ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException {
        ContextInjectionConfig.PastConversations settings = config.layers().pastConversations();
        if (!settings.enabled()) {
            return ContextLayer.empty(kind());
        }

        List<DaySummary> summaries = feed.recent(context.iin(), settings.maxDays());
        if (summaries.isEmpty()) {
            LOG.debug("No day summaries available for {}", context.iin());
            return ContextLayer.empty(kind());
        }

        BudgetTrimmer.Trimmed<DaySummary> result = BudgetTrimmer.trim(
            summaries,
            PastConversationsLayerBuilder::render,
            settings.tokenBudget(),
            estimator,
            BudgetTrimmer.dropLast()
        );
        int tokens = estimator.estimate(result.content());
        if (config.debug().logLayerTokens()) {
            LOG.info("Past conversations layer: {} days, {} tokens{}", result.items().size(), tokens, result.trimmed() ? " (trimmed)" : "");
        }
        return new ContextLayer(kind(), result.content(), tokens, result.items().size(), result.trimmed());
    }

    private static String render(List<DaySummary> summaries) {
        return summaries.stream()
            .map(summary -> DAY.format(summary.date()) + ": " + summary.content())
            .collect(Collectors.joining("\n"));
    }
}
