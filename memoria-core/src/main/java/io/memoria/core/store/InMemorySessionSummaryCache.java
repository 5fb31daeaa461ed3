package io.memoria.core.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expired entries are dropped when looked up. Beyond {@code maxEntries} the oldest summaries are evicted on write.
 */
public final class InMemorySessionSummaryCache implements SessionSummaryCache {
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final Clock clock;
    private final int maxEntries;
    private final Map<String, CachedSummary> entries = new ConcurrentHashMap<>();

    public InMemorySessionSummaryCache(Clock clock) {
        this(clock, DEFAULT_MAX_ENTRIES);
    }

    public InMemorySessionSummaryCache(Clock clock, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxEntries = maxEntries;
    }

    @Override
    public Optional<CachedSummary> find(String iin, String sessionId, long ttlMinutes) {
        String key = key(iin, sessionId);
        CachedSummary cached = entries.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        Instant expiresAt = cached.generatedAt().plus(Duration.ofMinutes(ttlMinutes));
        if (!clock.instant().isBefore(expiresAt)) {
            entries.remove(key, cached);
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    @Override
    public void put(String iin, String sessionId, CachedSummary summary) {
        entries.put(key(iin, sessionId), summary);
        while (entries.size() > maxEntries) {
            Optional<Map.Entry<String, CachedSummary>> oldest = entries.entrySet().stream()
                .min(Map.Entry.comparingByValue(Comparator.comparing(CachedSummary::generatedAt)));
            if (oldest.isEmpty()) {
                break;
            }
            entries.remove(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    int size() {
        return entries.size();
    }

    private String key(String iin, String sessionId) {
        return iin + '\u0000' + sessionId;
    }
}
