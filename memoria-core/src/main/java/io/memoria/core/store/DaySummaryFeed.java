package io.memoria.core.store;

import io.memoria.core.model.DaySummary;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of the summaries produced by the nightly compression batch.
 */
public interface DaySummaryFeed {

    /**
     * The latest {@code maxDays} day summaries, newest first.
     */
    List<DaySummary> recent(String iin, int maxDays) throws IOException;
}
