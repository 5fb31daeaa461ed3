package io.memoria.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import io.memoria.core.model.ExistingMemoryRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class FileMemoryRecordStore implements MemoryRecordStore {
    private static final String FILE_NAME = "memories.json";
    private static final TypeReference<List<ExistingMemoryRecord>> RECORDS = new TypeReference<>() {
    };

    private final UserDocuments documents;

    public FileMemoryRecordStore(Path root) {
        this.documents = new UserDocuments(root);
    }

    @Override
    public synchronized List<ExistingMemoryRecord> activeRecords(String iin, int limit) throws IOException {
        return documents.readList(documents.document(iin, FILE_NAME), RECORDS).stream()
            .filter(ExistingMemoryRecord::active)
            .sorted(Comparator.comparing(ExistingMemoryRecord::createdAt).reversed())
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public synchronized void save(String iin, ExistingMemoryRecord record) throws IOException {
        Path path = documents.document(iin, FILE_NAME);
        List<ExistingMemoryRecord> records = new ArrayList<>(documents.readList(path, RECORDS));
        records.removeIf(existing -> existing.id().equals(record.id()));
        records.add(record);
        documents.writeList(path, records);
    }
}
