package io.memoria.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import io.memoria.core.model.CalendarEvent;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class FileEventStore implements EventStore {
    private static final String FILE_NAME = "events.json";
    private static final TypeReference<List<CalendarEvent>> EVENTS = new TypeReference<>() {
    };

    private final UserDocuments documents;

    public FileEventStore(Path root) {
        this.documents = new UserDocuments(root);
    }

    @Override
    public synchronized List<CalendarEvent> upcoming(String iin, Instant from, Instant to, int limit) throws IOException {
        return documents.readList(documents.document(iin, FILE_NAME), EVENTS).stream()
            .filter(event -> event.start() != null)
            .filter(event -> !event.start().isBefore(from) && !event.start().isAfter(to))
            .sorted(Comparator.comparing(CalendarEvent::start))
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public synchronized void save(String iin, CalendarEvent event) throws IOException {
        Path path = documents.document(iin, FILE_NAME);
        List<CalendarEvent> events = new ArrayList<>(documents.readList(path, EVENTS));
        if (event.id() != null) {
            events.removeIf(existing -> event.id().equals(existing.id()));
        }
        events.add(event);
        documents.writeList(path, events);
    }
}
