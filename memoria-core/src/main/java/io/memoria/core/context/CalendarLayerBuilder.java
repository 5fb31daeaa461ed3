package io.memoria.core.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.CalendarEvent;
import io.memoria.core.store.EventStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upcoming events in the lookahead window. The event cap bounds the layer; it is never trimmed, so the
 * calendar {@code tokenBudget} is accepted but has no effect.
 */
public final class CalendarLayerBuilder implements LayerBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CalendarLayerBuilder.class);
    private static final DateTimeFormatter LIST_DATE = DateTimeFormatter.ofPattern("EEE MMM d", Locale.US);
    private static final DateTimeFormatter LIST_TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter PROSE_DATE = DateTimeFormatter.ofPattern("EEEE MMMM d", Locale.US);

    private final EventStore events;
    private final TokenEstimator estimator;
    private final Clock clock;
    private final ObjectMapper mapper;

    public CalendarLayerBuilder(EventStore events, TokenEstimator estimator, Clock clock) {
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public LayerKind kind() {
        return LayerKind.CALENDAR;
    }

    @Override
    public ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException {
        ContextInjectionConfig.Calendar settings = config.layers().calendar();
        if (!settings.enabled()) {
            return ContextLayer.empty(kind());
        }

        Instant now = clock.instant();
        Instant until = now.plus(Duration.ofHours(settings.lookaheadHours()));
        List<CalendarEvent> upcoming = events.upcoming(context.iin(), now, until, settings.maxEvents());
        if (upcoming.isEmpty()) {
            LOG.debug("No upcoming events for {}", context.iin());
            return ContextLayer.empty(kind());
        }

        String content = render(upcoming, settings.format());
        int tokens = estimator.estimate(content);
        if (config.debug().logLayerTokens()) {
            LOG.info("Calendar layer: {} events, {} tokens", upcoming.size(), tokens);
        }
        return new ContextLayer(kind(), content, tokens, upcoming.size(), false);
    }

    private String render(List<CalendarEvent> upcoming, String format) {
        return switch (format) {
            case "list" -> upcoming.stream().map(this::listLine).collect(Collectors.joining("\n"));
            case "prose" -> upcoming.stream().map(this::proseLine).collect(Collectors.joining(". "));
            default -> toJson(upcoming);
        };
    }

    private String listLine(CalendarEvent event) {
        ZonedDateTime start = event.start().atZone(clock.getZone());
        String time = event.time().isBlank() ? LIST_TIME.format(start) : event.time();
        return "- " + LIST_DATE.format(start) + " " + time + ": " + event.title();
    }

    private String proseLine(CalendarEvent event) {
        return event.title() + " on " + PROSE_DATE.format(event.start().atZone(clock.getZone()));
    }

    private String toJson(List<CalendarEvent> upcoming) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(upcoming);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize events", e);
        }
    }
}
