package io.memoria.core.model;

import java.util.List;
import java.util.Objects;

public record ConflictCard(
    String conflictId,
    Kind kind,
    ExistingRef existing,
    IncomingRef incoming,
    String question,
    List<ResolutionOption> options
) {
    public static final List<ResolutionOption> CANONICAL_OPTIONS = List.of(
        new ResolutionOption("replace", "Update to new", "replace"),
        new ResolutionOption("keep_both", "Keep both", "keep_both"),
        new ResolutionOption("discard", "Keep old, discard new", "discard")
    );

    public ConflictCard {
        Objects.requireNonNull(conflictId, "conflictId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        options = options == null ? CANONICAL_OPTIONS : List.copyOf(options);
    }

    public enum Kind {
        CONFLICT,
        UPDATE
    }

    public record ExistingRef(String id, String content, String type) {
    }

    public record IncomingRef(String tempId, String content, String type) {
    }

    public record ResolutionOption(String id, String label, String action) {
    }
}
