package io.memoria.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InMemorySessionSummaryCacheTest {

    private static final Instant GENERATED = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void shouldServeEntryUntilTtlElapses() {
        CachedSummary summary = new CachedSummary("Talked about travel plans.", 15, GENERATED);

        assertThat(cacheAt(GENERATED.plusSeconds(29 * 60), summary).find("iin-1", "s1", 30)).contains(summary);
        assertThat(cacheAt(GENERATED.plusSeconds(30 * 60), summary).find("iin-1", "s1", 30)).isEmpty();
    }

    @Test
    void shouldKeepSessionsApart() {
        InMemorySessionSummaryCache cache = cacheAt(GENERATED, new CachedSummary("first", 15, GENERATED));

        assertThat(cache.find("iin-1", "s2", 30)).isEmpty();
        assertThat(cache.find("iin-2", "s1", 30)).isEmpty();
    }

    @Test
    void shouldDropExpiredEntryOnLookup() {
        InMemorySessionSummaryCache cache = cacheAt(GENERATED.plusSeconds(31 * 60), new CachedSummary("stale", 15, GENERATED));

        assertThat(cache.find("iin-1", "s1", 30)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldEvictOldestSummariesBeyondCapacity() {
        InMemorySessionSummaryCache cache = new InMemorySessionSummaryCache(Clock.fixed(GENERATED, ZoneOffset.UTC), 2);
        cache.put("iin-1", "s1", new CachedSummary("oldest", 15, GENERATED.minusSeconds(120)));
        cache.put("iin-1", "s2", new CachedSummary("middle", 15, GENERATED.minusSeconds(60)));
        cache.put("iin-1", "s3", new CachedSummary("newest", 15, GENERATED));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.find("iin-1", "s1", 30)).isEmpty();
        assertThat(cache.find("iin-1", "s2", 30)).map(CachedSummary::summary).contains("middle");
        assertThat(cache.find("iin-1", "s3", 30)).map(CachedSummary::summary).contains("newest");
    }

    private static InMemorySessionSummaryCache cacheAt(Instant now, CachedSummary summary) {
        InMemorySessionSummaryCache cache = new InMemorySessionSummaryCache(Clock.fixed(now, ZoneOffset.UTC));
        cache.put("iin-1", "s1", summary);
        return cache;
    }
}
