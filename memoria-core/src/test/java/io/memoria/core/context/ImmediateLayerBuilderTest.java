package io.memoria.core.context;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.store.SqliteMessageLog;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImmediateLayerBuilderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRenderLatestMessagesOfStoredSession() throws Exception {
        SqliteMessageLog log = new SqliteMessageLog(tempDir.resolve("messages.db"));
        for (int i = 0; i < 12; i++) {
            log.append("iin-1", "session-1", i % 2 == 0 ? ConversationMessage.user("q" + i) : ConversationMessage.assistant("a" + i));
        }
        ImmediateLayerBuilder builder = new ImmediateLayerBuilder(log, new CharRatioTokenEstimator());

        ContextLayer layer = builder.build(
            new UserContext("iin-1", "next", "session-1", List.of(), List.of(), null),
            ContextInjectionConfig.defaults()
        );

        assertThat(layer.itemCount()).isEqualTo(10);
        assertThat(layer.content()).startsWith("User: q2\nAssistant: a3").endsWith("Assistant: a11");
    }

    @Test
    void shouldDropOldestMessagesWhenOverBudget() throws Exception {
        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            messages.add(ConversationMessage.user(i + " " + "x".repeat(38)));
        }
        ContextInjectionConfig config = ContextInjectionConfig.defaults().withLayers(new ContextInjectionConfig.Layers(
            new ContextInjectionConfig.Immediate(true, 10, 25, "conversation"),
            null,
            null,
            null,
            null
        ));
        ImmediateLayerBuilder builder = new ImmediateLayerBuilder(new ContextAssemblerTest.EmptyMessageLog(), new CharRatioTokenEstimator());

        ContextLayer layer = builder.build(new UserContext("iin-1", "next", null, messages, List.of(), null), config);

        assertThat(layer.trimmed()).isTrue();
        assertThat(layer.itemCount()).isEqualTo(2);
        assertThat(layer.content()).startsWith("User: 2 ");
    }

    @Test
    void shouldRenderSummaryFormat() throws Exception {
        ContextInjectionConfig config = ContextInjectionConfig.defaults().withLayers(new ContextInjectionConfig.Layers(
            new ContextInjectionConfig.Immediate(true, 10, 400, "summary"),
            null,
            null,
            null,
            null
        ));
        ImmediateLayerBuilder builder = new ImmediateLayerBuilder(new ContextAssemblerTest.EmptyMessageLog(), new CharRatioTokenEstimator());

        ContextLayer layer = builder.build(
            new UserContext("iin-1", "next", null, List.of(ConversationMessage.user("hi"), ConversationMessage.assistant("hello")), List.of(), null),
            config
        );

        assertThat(layer.content()).isEqualTo("hi | hello");
    }
}
