package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * One entry of the nightly long-range summary feed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DaySummary(LocalDate date, String content, List<String> topics) {

    public DaySummary {
        Objects.requireNonNull(date, "date must not be null");
        content = content == null ? "" : content;
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
