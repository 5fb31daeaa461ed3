package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarEvent(String id, String title, Instant start, String time, String description) {

    public CalendarEvent {
        title = title == null || title.isBlank() ? "Untitled event" : title;
        description = description == null ? "" : description;
        time = time == null ? "" : time;
    }
}
