package io.memoria.core.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.MessageRole;
import io.memoria.core.store.MessageLog;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The latest messages of the active session, trimmed from the oldest end.
 */
public final class ImmediateLayerBuilder implements LayerBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ImmediateLayerBuilder.class);

    private final MessageLog messageLog;
    private final TokenEstimator estimator;
    private final ObjectMapper mapper;

    public ImmediateLayerBuilder(MessageLog messageLog, TokenEstimator estimator) {
        this.messageLog = Objects.requireNonNull(messageLog, "messageLog must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public LayerKind kind() {
        return LayerKind.IMMEDIATE;
    }

    @Override
    public ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException {
        ContextInjectionConfig.Immediate settings = config.layers().immediate();
        if (!settings.enabled()) {
            return ContextLayer.empty(kind());
        }

        List<ConversationMessage> messages = context.sessionMessages();
        if (messages.isEmpty() && context.hasSession()) {
            messages = messageLog.recent(context.iin(), context.sessionId(), settings.maxMessages());
        }
        int from = Math.max(0, messages.size() - settings.maxMessages());
        List<ConversationMessage> recent = messages.subList(from, messages.size());
        if (recent.isEmpty()) {
            return ContextLayer.empty(kind());
        }

        BudgetTrimmer.Trimmed<ConversationMessage> result = BudgetTrimmer.trim(
            recent,
            items -> render(items, settings.format()),
            settings.tokenBudget(),
            estimator,
            BudgetTrimmer.dropFirst()
        );
        int tokens = estimator.estimate(result.content());
        if (config.debug().logLayerTokens()) {
            LOG.info("Immediate layer: {} messages, {} tokens{}", result.items().size(), tokens, result.trimmed() ? " (trimmed)" : "");
        }
        return new ContextLayer(kind(), result.content(), tokens, result.items().size(), result.trimmed());
    }

    private String render(List<ConversationMessage> messages, String format) {
        return switch (format) {
            case "json" -> toJson(messages);
            case "summary" -> messages.stream().map(ConversationMessage::content).collect(Collectors.joining(" | "));
            default -> conversation(messages);
        };
    }

    static String conversation(List<ConversationMessage> messages) {
        return messages.stream()
            .map(message -> (message.role() == MessageRole.USER ? "User" : "Assistant") + ": " + message.content())
            .collect(Collectors.joining("\n"));
    }

    private String toJson(List<ConversationMessage> messages) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(messages);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session messages", e);
        }
    }
}
