package io.memoria.core.store;

import io.memoria.core.model.ExistingMemoryRecord;
import java.io.IOException;
import java.util.List;

public interface MemoryRecordStore {

    /**
     * Active records of the user, newest first, at most {@code limit}.
     */
    List<ExistingMemoryRecord> activeRecords(String iin, int limit) throws IOException;

    void save(String iin, ExistingMemoryRecord record) throws IOException;
}
