package io.memoria.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.MessageRole;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteMessageLogTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistMessagesInInsertionOrder() throws Exception {
        SqliteMessageLog log = new SqliteMessageLog(tempDir.resolve("workspace/messages.db"));
        log.append("iin-1", "s1", new ConversationMessage(MessageRole.USER, "hello", Instant.parse("2026-03-01T09:00:00Z")));
        log.append("iin-1", "s1", new ConversationMessage(MessageRole.ASSISTANT, "hi", Instant.parse("2026-03-01T09:00:01Z")));

        List<ConversationMessage> messages = log.all("iin-1", "s1");

        assertThat(messages).extracting(ConversationMessage::role).containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(messages.get(1).content()).isEqualTo("hi");
        assertThat(messages.get(0).timestamp()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
    }

    @Test
    void shouldReturnLastMessagesOldestFirst() throws Exception {
        SqliteMessageLog log = new SqliteMessageLog(tempDir.resolve("messages.db"));
        for (int i = 1; i <= 5; i++) {
            log.append("iin-1", "s1", ConversationMessage.user("message " + i));
        }
        log.append("iin-1", "other", ConversationMessage.user("elsewhere"));
        log.append("iin-2", "s1", ConversationMessage.user("someone else"));

        assertThat(log.recent("iin-1", "s1", 2)).extracting(ConversationMessage::content).containsExactly("message 4", "message 5");
        assertThat(log.all("iin-1", "s1")).hasSize(5);
    }

    @Test
    void shouldSurviveReopen() throws Exception {
        Path db = tempDir.resolve("messages.db");
        new SqliteMessageLog(db).append("iin-1", "s1", ConversationMessage.user("kept"));

        assertThat(new SqliteMessageLog(db).all("iin-1", "s1")).extracting(ConversationMessage::content).containsExactly("kept");
    }

    @Test
    void shouldReturnEmptyListForFreshDatabase() throws Exception {
        assertThat(new SqliteMessageLog(tempDir.resolve("messages.db")).recent("iin-1", "s1", 10)).isEmpty();
    }
}
