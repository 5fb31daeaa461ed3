package io.memoria.core.pipeline;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.model.ConversationMessage;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MalformedInputException;
import io.memoria.core.model.RelevantMemory;
import io.memoria.core.model.SaveDecision;
import io.memoria.core.model.SaveResult;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TurnRequest(
    String iin,
    String message,
    String sessionId,
    List<ConversationMessage> sessionMessages,
    @JsonAlias({"candidates"}) List<ExtractedMemoryCandidate> extractedMemories,
    List<RelevantMemory> memories,
    JsonNode intent,
    SaveDecision saveDecision,
    List<SaveResult> saveResults,
    String userName,
    int questionsAskedCount,
    boolean userDismissed
) {

    public TurnRequest {
        if (iin == null || iin.isBlank()) {
            throw new MalformedInputException("iin is required");
        }
        message = message == null ? "" : message;
        sessionMessages = sessionMessages == null ? List.of() : List.copyOf(sessionMessages);
        extractedMemories = extractedMemories == null ? List.of() : List.copyOf(extractedMemories);
        memories = memories == null ? List.of() : List.copyOf(memories);
        saveResults = saveResults == null ? List.of() : List.copyOf(saveResults);
        if (questionsAskedCount < 0) {
            throw new MalformedInputException("questionsAskedCount must not be negative");
        }
    }
}
