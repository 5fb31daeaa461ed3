package io.memoria.core.store;

import java.util.Optional;

/**
 * Summaries of the early part of long sessions. Entries expire after a time-to-live;
 * content changes of the session do not invalidate them.
 */
public interface SessionSummaryCache {

    Optional<CachedSummary> find(String iin, String sessionId, long ttlMinutes);

    void put(String iin, String sessionId, CachedSummary summary);
}
