package io.memoria.core.context;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.config.model.LlmSettings;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.provider.CompletionParams;
import io.memoria.core.provider.CompletionResponse;
import io.memoria.core.provider.ProviderRegistry;
import io.memoria.core.store.CachedSummary;
import io.memoria.core.store.MessageLog;
import io.memoria.core.store.SessionSummaryCache;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summary of the opening messages of a long session. Summaries are cached per session and
 * reused until their time-to-live elapses. The layer's token budget caps the summary's output tokens.
 */
public final class SessionSummaryLayerBuilder implements LayerBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(SessionSummaryLayerBuilder.class);

    private final MessageLog messageLog;
    private final SessionSummaryCache cache;
    private final ProviderRegistry providers;
    private final TokenEstimator estimator;
    private final Clock clock;

    public SessionSummaryLayerBuilder(
        MessageLog messageLog,
        SessionSummaryCache cache,
        ProviderRegistry providers,
        TokenEstimator estimator,
        Clock clock
    ) {
        this.messageLog = Objects.requireNonNull(messageLog, "messageLog must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public LayerKind kind() {
        return LayerKind.SESSION_SUMMARY;
    }

    @Override
    public ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException {
        ContextInjectionConfig.SessionSummary settings = config.layers().sessionSummary();
        if (!settings.enabled()) {
            return ContextLayer.empty(kind());
        }

        List<ConversationMessage> messages = context.sessionMessages();
        if (messages.isEmpty() && context.hasSession()) {
            messages = messageLog.all(context.iin(), context.sessionId());
        }
        if (messages.size() <= settings.threshold()) {
            LOG.debug("Session has {} messages, threshold is {}, skipping summary", messages.size(), settings.threshold());
            return ContextLayer.empty(kind());
        }

        boolean cacheable = settings.cacheEnabled() && context.hasSession();
        if (cacheable) {
            Optional<CachedSummary> cached = cache.find(context.iin(), context.sessionId(), settings.cacheTtlMinutes());
            if (cached.isPresent()) {
                LOG.debug("Using cached session summary for {}", context.sessionId());
                String summary = cached.get().summary();
                return new ContextLayer(kind(), summary, estimator.estimate(summary), cached.get().messageCount(), false);
            }
        }

        List<ConversationMessage> head = messages.subList(0, Math.min(settings.summarizeCount(), messages.size()));
        ContextInjectionConfig.SummaryLlm llm = config.summaryLlm();
        String prompt = llm.prompt().replace("{{messages}}", ImmediateLayerBuilder.conversation(head));
        LlmSettings settingsForLlm = llm.settings();
        CompletionParams params = new CompletionParams(
            settingsForLlm.model(),
            settingsForLlm.temperature(),
            Math.min(settingsForLlm.maxTokens(), settings.tokenBudget())
        );
        CompletionResponse response = providers.resolve(settingsForLlm.provider()).complete(prompt, params);
        if (response.isError()) {
            LOG.warn("Session summary generation failed: {}", response.errorDetail());
            return ContextLayer.empty(kind());
        }

        String summary = response.text().trim();
        if (summary.isEmpty()) {
            return ContextLayer.empty(kind());
        }
        if (cacheable) {
            cache.put(context.iin(), context.sessionId(), new CachedSummary(summary, head.size(), clock.instant()));
        }
        int tokens = estimator.estimate(summary);
        if (config.debug().logLayerTokens()) {
            LOG.info("Session summary layer: {} messages summarized, {} tokens", head.size(), tokens);
        }
        return new ContextLayer(kind(), summary, tokens, head.size(), false);
    }
}
