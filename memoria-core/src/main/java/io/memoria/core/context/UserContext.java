package io.memoria.core.context;

import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.RelevantMemory;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one context assembly. {@code sessionMessages} may be empty, in which case the
 * session's messages are read from the message log when a session id is known.
 */
public record UserContext(
    String iin,
    String message,
    String sessionId,
    List<ConversationMessage> sessionMessages,
    List<RelevantMemory> memories,
    String userName
) {

    public UserContext {
        Objects.requireNonNull(iin, "iin must not be null");
        message = message == null ? "" : message;
        sessionMessages = sessionMessages == null ? List.of() : List.copyOf(sessionMessages);
        memories = memories == null ? List.of() : List.copyOf(memories);
    }

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
