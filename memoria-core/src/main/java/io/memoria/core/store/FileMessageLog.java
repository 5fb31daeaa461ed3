package io.memoria.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import io.memoria.core.model.ConversationMessage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class FileMessageLog implements MessageLog {
    private static final TypeReference<List<ConversationMessage>> MESSAGES = new TypeReference<>() {
    };

    private final UserDocuments documents;

    public FileMessageLog(Path root) {
        this.documents = new UserDocuments(root);
    }

    @Override
    public synchronized void append(String iin, String sessionId, ConversationMessage message) throws IOException {
        Path path = sessionFile(iin, sessionId);
        List<ConversationMessage> messages = new ArrayList<>(documents.readList(path, MESSAGES));
        Instant timestamp = message.timestamp() == null ? Instant.now() : message.timestamp();
        messages.add(new ConversationMessage(message.role(), message.content(), timestamp));
        documents.writeList(path, messages);
    }

    @Override
    public synchronized List<ConversationMessage> recent(String iin, String sessionId, int limit) throws IOException {
        List<ConversationMessage> messages = all(iin, sessionId);
        int from = Math.max(0, messages.size() - Math.max(0, limit));
        return List.copyOf(messages.subList(from, messages.size()));
    }

    @Override
    public synchronized List<ConversationMessage> all(String iin, String sessionId) throws IOException {
        return documents.readList(sessionFile(iin, sessionId), MESSAGES);
    }

    private Path sessionFile(String iin, String sessionId) {
        String session = UserDocuments.safeKey(sessionId, "sessionId");
        return documents.userDir(iin).resolve("sessions").resolve(session + ".json");
    }
}
