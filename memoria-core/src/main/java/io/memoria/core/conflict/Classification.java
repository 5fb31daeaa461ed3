package io.memoria.core.conflict;

import io.memoria.core.model.ConflictRelation;
import java.util.Objects;

public record Classification(ConflictRelation relation, double confidence, String reason) {

    public Classification {
        Objects.requireNonNull(relation, "relation must not be null");
        reason = reason == null ? "" : reason;
    }

    public static Classification none(double confidence, String reason) {
        return new Classification(ConflictRelation.NONE, confidence, reason);
    }
}
