package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A memory produced by the upstream extraction step for the current turn.
 * Instances are immutable; slot resolution returns a copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedMemoryCandidate(
    String tempId,
    String content,
    String type,
    double confidence,
    Map<String, SlotValue> slots,
    MemoryTypeConfig typeConfig,
    String originalMessage
) {

    public ExtractedMemoryCandidate {
        Objects.requireNonNull(tempId, "tempId must not be null");
        content = content == null ? "" : content;
        type = type == null || type.isBlank() ? "unknown" : type;
        slots = slots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slots));
        typeConfig = typeConfig == null ? MemoryTypeConfig.unknown() : typeConfig;
        originalMessage = originalMessage == null ? "" : originalMessage;
    }

    public ExtractedMemoryCandidate withResolvedSlot(String slotId, String resolvedValue) {
        Map<String, SlotValue> updated = new LinkedHashMap<>(slots);
        updated.put(slotId, SlotValue.resolved(resolvedValue));
        return new ExtractedMemoryCandidate(tempId, content, type, confidence, updated, typeConfig, originalMessage);
    }

    public String slotText(String slotId) {
        SlotValue slot = slots.get(slotId);
        if (slot == null || slot.value() == null) {
            return "";
        }
        return slot.value();
    }
}
