package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single slot of an extracted memory. {@code source} records who filled it:
 * {@code extracted}, {@code inferred}, {@code user} or {@code llm_resolved}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlotValue(String value, boolean filled, String source) {
    public static final String SOURCE_EXTRACTED = "extracted";
    public static final String SOURCE_RESOLVED = "llm_resolved";

    public SlotValue {
        source = source == null || source.isBlank() ? SOURCE_EXTRACTED : source;
    }

    public static SlotValue filled(String value) {
        return new SlotValue(value, true, SOURCE_EXTRACTED);
    }

    public static SlotValue empty() {
        return new SlotValue(null, false, SOURCE_EXTRACTED);
    }

    public static SlotValue resolved(String value) {
        return new SlotValue(value, true, SOURCE_RESOLVED);
    }

    public boolean hasValue() {
        return filled && value != null && !value.isBlank();
    }
}
