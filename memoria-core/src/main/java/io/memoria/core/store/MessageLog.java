package io.memoria.core.store;

import io.memoria.core.model.ConversationMessage;
import java.io.IOException;
import java.util.List;

/**
 * Messages of one chat session, in chronological order.
 */
public interface MessageLog {

    void append(String iin, String sessionId, ConversationMessage message) throws IOException;

    /**
     * The last {@code limit} messages of the session, oldest first.
     */
    List<ConversationMessage> recent(String iin, String sessionId, int limit) throws IOException;

    List<ConversationMessage> all(String iin, String sessionId) throws IOException;
}
