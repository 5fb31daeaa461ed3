package io.memoria.core.conflict;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.memoria.core.model.ExistingMemoryRecord;
import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MalformedInputException;
import java.util.List;

/**
 * Candidates to check for one user. When {@code existing} is given, it is used instead of the
 * user's stored records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConflictCheckRequest(
    String iin,
    @JsonAlias({"extractedMemories"}) List<ExtractedMemoryCandidate> candidates,
    List<ExistingMemoryRecord> existing
) {

    public ConflictCheckRequest {
        if (iin == null || iin.isBlank()) {
            throw new MalformedInputException("iin is required");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        existing = existing == null ? null : List.copyOf(existing);
    }
}
