package io.memoria.core.model;

import java.util.Locale;

public enum ConflictRelation {
    CONFLICT,
    UPDATE,
    ADDITION,
    DUPLICATE,
    NONE;

    /**
     * Reads a classifier label. Anything outside the four known relations maps to {@link #NONE}.
     */
    public static ConflictRelation fromLabel(String label) {
        if (label == null) {
            return NONE;
        }
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "CONFLICT" -> CONFLICT;
            case "UPDATE" -> UPDATE;
            case "ADDITION" -> ADDITION;
            case "DUPLICATE" -> DUPLICATE;
            default -> NONE;
        };
    }

    public boolean coexists() {
        return this == NONE || this == ADDITION;
    }
}
