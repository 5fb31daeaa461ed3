package io.memoria.core.context;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.CalendarEvent;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.DaySummary;
import io.memoria.core.model.RelevantMemory;
import io.memoria.core.provider.ProviderRegistry;
import io.memoria.core.provider.ScriptedProvider;
import io.memoria.core.store.DaySummaryFeed;
import io.memoria.core.store.EventStore;
import io.memoria.core.store.InMemorySessionSummaryCache;
import io.memoria.core.store.MessageLog;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    private static final TokenEstimator ESTIMATOR = new CharRatioTokenEstimator();

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldJoinAllFiveLayersInConfiguredOrder() {
        ContextAssembler assembler = new ContextAssembler(allBuilders(), executor);
        ContextInjectionConfig config = ContextInjectionConfig.defaults();

        AssembledContext assembled = assembler.assemble(userContext(), config);

        String text = assembled.assembledText();
        int profile = text.indexOf("USER PROFILE:\n- Lives in Berlin");
        int calendar = text.indexOf("UPCOMING EVENTS:\n- Mon Mar 2 3:00 PM: Dentist");
        int past = text.indexOf("PAST CONVERSATIONS:\nFeb 28: Talked about the move");
        int session = text.indexOf("SESSION CONTEXT:\nUser planned a move to Berlin.");
        int immediate = text.indexOf("RECENT CONVERSATION:\nAssistant: reply 15\nUser: message 16");
        assertThat(profile).isZero();
        assertThat(calendar).isGreaterThan(profile);
        assertThat(past).isGreaterThan(calendar);
        assertThat(session).isGreaterThan(past);
        assertThat(immediate).isGreaterThan(session);
        assertThat(assembled.debug().trimmed()).isEmpty();
        assertThat(assembled.debug().layersIncluded())
            .containsExactly("profile", "calendar", "pastConversations", "sessionSummary", "immediate");
        assertThat(assembled.totalTokens())
            .isEqualTo(assembled.debug().tokensPerLayer().values().stream().mapToInt(Integer::intValue).sum());
        assertThat(assembled.layers()).hasSize(5);
    }

    @Test
    void shouldKeepEveryLayerWithinItsBudget() {
        ContextAssembler assembler = new ContextAssembler(allBuilders(), executor);
        ContextInjectionConfig config = ContextInjectionConfig.defaults();
        Map<LayerKind, Integer> budgets = Map.of(
            LayerKind.IMMEDIATE, 400,
            LayerKind.SESSION_SUMMARY, 200,
            LayerKind.PROFILE, 300,
            LayerKind.CALENDAR, 100,
            LayerKind.PAST_CONVERSATIONS, 200
        );

        AssembledContext assembled = assembler.assemble(userContext(), config);

        for (ContextLayer layer : assembled.layers()) {
            assertThat(layer.tokenCount()).isLessThanOrEqualTo(budgets.get(layer.name()));
            assertThat(layer.tokenCount()).isEqualTo(ESTIMATOR.estimate(layer.content()));
        }
    }

    @Test
    void shouldSkipFailingAndEmptyLayers() {
        LayerBuilder failing = new FixedBuilder(LayerKind.CALENDAR, null);
        LayerBuilder empty = new FixedBuilder(LayerKind.PROFILE, "");
        LayerBuilder immediate = new FixedBuilder(LayerKind.IMMEDIATE, "User: hi");
        ContextAssembler assembler = new ContextAssembler(List.of(failing, empty, immediate), executor);

        AssembledContext assembled = assembler.assemble(userContext(), ContextInjectionConfig.defaults());

        assertThat(assembled.assembledText()).isEqualTo("RECENT CONVERSATION:\nUser: hi");
        assertThat(assembled.debug().layersIncluded()).containsExactly("immediate");
    }

    @Test
    void shouldIgnoreUnknownAndRepeatedSections() {
        ContextAssembler assembler = new ContextAssembler(
            List.of(new FixedBuilder(LayerKind.PROFILE, "- Likes tea"), new FixedBuilder(LayerKind.IMMEDIATE, "User: hi")),
            executor
        );
        ContextInjectionConfig defaults = ContextInjectionConfig.defaults();
        ContextInjectionConfig config = new ContextInjectionConfig(
            defaults.injection(),
            defaults.filter(),
            defaults.format(),
            defaults.prompts(),
            defaults.layers(),
            new ContextInjectionConfig.PromptStructure(
                null,
                Map.of("profile", "ABOUT YOU:"),
                List.of("immediate", "weather", "profile", "immediate")
            ),
            defaults.summaryLlm(),
            defaults.debug()
        );

        AssembledContext assembled = assembler.assemble(userContext(), config);

        assertThat(assembled.assembledText()).isEqualTo("IMMEDIATE:\nUser: hi\n\nABOUT YOU:\n- Likes tea");
    }

    @Test
    void shouldProduceEmptyContextWhenNothingIsAvailable() {
        ContextAssembler assembler = new ContextAssembler(List.of(), executor);

        AssembledContext assembled = assembler.assemble(
            new UserContext("iin-1", "hi", null, List.of(), List.of(), null),
            ContextInjectionConfig.defaults()
        );

        assertThat(assembled.isEmpty()).isTrue();
        assertThat(assembled.totalTokens()).isZero();
    }

    private List<LayerBuilder> allBuilders() {
        ScriptedProvider gemini = new ScriptedProvider("gemini", "User planned a move to Berlin.");
        EventStore events = new EventStore() {
            @Override
            public List<CalendarEvent> upcoming(String iin, Instant from, Instant to, int limit) {
                return List.of(new CalendarEvent("ev-1", "Dentist", Instant.parse("2026-03-02T15:00:00Z"), null, null));
            }

            @Override
            public void save(String iin, CalendarEvent event) {
                throw new UnsupportedOperationException();
            }
        };
        DaySummaryFeed feed = (iin, maxDays) -> List.of(new DaySummary(LocalDate.of(2026, 2, 28), "Talked about the move", List.of("move")));
        MessageLog log = new EmptyMessageLog();
        return List.of(
            new ImmediateLayerBuilder(log, ESTIMATOR),
            new SessionSummaryLayerBuilder(log, new InMemorySessionSummaryCache(CLOCK), new ProviderRegistry().register(gemini), ESTIMATOR, CLOCK),
            new ProfileLayerBuilder(ESTIMATOR),
            new CalendarLayerBuilder(events, ESTIMATOR, CLOCK),
            new PastConversationsLayerBuilder(feed, ESTIMATOR)
        );
    }

    private static UserContext userContext() {
        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            messages.add(i % 2 == 0 ? ConversationMessage.user("message " + i) : ConversationMessage.assistant("reply " + i));
        }
        List<RelevantMemory> memories = List.of(
            new RelevantMemory("m-1", "Lives in Berlin", "fact", "", 0.9, null, null)
        );
        return new UserContext("iin-1", "what's on this week?", null, messages, memories, "Sam");
    }

    private record FixedBuilder(LayerKind kind, String content) implements LayerBuilder {
        @Override
        public ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException {
            if (content == null) {
                throw new IOException("source unavailable");
            }
            return new ContextLayer(kind, content, ESTIMATOR.estimate(content), 1, false);
        }
    }

    static final class EmptyMessageLog implements MessageLog {
        @Override
        public void append(String iin, String sessionId, ConversationMessage message) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<ConversationMessage> recent(String iin, String sessionId, int limit) {
            return List.of();
        }

        @Override
        public List<ConversationMessage> all(String iin, String sessionId) {
            return List.of();
        }
    }
}
