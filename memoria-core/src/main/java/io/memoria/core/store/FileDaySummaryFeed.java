package io.memoria.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import io.memoria.core.model.DaySummary;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

public final class FileDaySummaryFeed implements DaySummaryFeed {
    private static final String FILE_NAME = "day_summaries.json";
    private static final TypeReference<List<DaySummary>> SUMMARIES = new TypeReference<>() {
    };

    private final UserDocuments documents;

    public FileDaySummaryFeed(Path root) {
        this.documents = new UserDocuments(root);
    }

    @Override
    public List<DaySummary> recent(String iin, int maxDays) throws IOException {
        return documents.readList(documents.document(iin, FILE_NAME), SUMMARIES).stream()
            .sorted(Comparator.comparing(DaySummary::date).reversed())
            .limit(Math.max(0, maxDays))
            .toList();
    }
}
