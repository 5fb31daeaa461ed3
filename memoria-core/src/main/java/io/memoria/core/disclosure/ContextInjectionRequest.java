package io.memoria.core.disclosure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.RelevantMemory;
import io.memoria.core.model.SaveDecision;
import io.memoria.core.model.SaveResult;
import java.util.List;

/**
 * One turn's input to context injection. {@code intent} is kept as raw JSON because upstream
 * sends either a string or an object with a {@code primary} field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextInjectionRequest(
    String iin,
    String message,
    String sessionId,
    List<ConversationMessage> sessionMessages,
    List<RelevantMemory> memories,
    JsonNode intent,
    SaveDecision saveDecision,
    List<SaveResult> saveResults,
    String userName
) {

    public ContextInjectionRequest {
        message = message == null ? "" : message;
        sessionMessages = sessionMessages == null ? List.of() : List.copyOf(sessionMessages);
        memories = memories == null ? List.of() : List.copyOf(memories);
        saveResults = saveResults == null ? List.of() : List.copyOf(saveResults);
    }

    public ContextInjectionRequest withSaveDecision(SaveDecision decision) {
        return new ContextInjectionRequest(iin, message, sessionId, sessionMessages, memories, intent, decision, saveResults, userName);
    }
}
