package io.memoria.core.store;

import io.memoria.core.model.CalendarEvent;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface EventStore {

    /**
     * Events starting within {@code [from, to]}, earliest first, at most {@code limit}.
     */
    List<CalendarEvent> upcoming(String iin, Instant from, Instant to, int limit) throws IOException;

    void save(String iin, CalendarEvent event) throws IOException;
}
