package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Presentation projection of an extracted memory. A card is complete exactly when no
 * required slot is missing, and every missing slot is one of the type's required slots.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryCard(
    String tempId,
    String type,
    String icon,
    String title,
    String subtitle,
    String color,
    List<String> missingRequired,
    List<SlotDefinition> requiredSlots,
    List<SlotDefinition> optionalSlots,
    Map<String, SlotValue> slots
) {

    public MemoryCard {
        Objects.requireNonNull(tempId, "tempId must not be null");
        type = type == null ? "unknown" : type;
        icon = icon == null || icon.isBlank() ? MemoryTypeConfig.DEFAULT_ICON : icon;
        title = title == null ? "" : title;
        subtitle = subtitle == null ? "" : subtitle;
        color = color == null || color.isBlank() ? MemoryTypeConfig.DEFAULT_COLOR : color;
        missingRequired = missingRequired == null ? List.of() : List.copyOf(missingRequired);
        requiredSlots = requiredSlots == null ? List.of() : List.copyOf(requiredSlots);
        optionalSlots = optionalSlots == null ? List.of() : List.copyOf(optionalSlots);
        slots = slots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slots));

        Set<String> requiredIds = requiredSlots.stream().map(SlotDefinition::id).collect(Collectors.toSet());
        for (String slotId : missingRequired) {
            if (!requiredIds.contains(slotId)) {
                throw new IllegalArgumentException("missing slot " + slotId + " is not a required slot of " + type);
            }
        }
    }

    @JsonProperty("complete")
    public boolean complete() {
        return missingRequired.isEmpty();
    }

    @JsonProperty("status")
    public CardStatus status() {
        return complete() ? CardStatus.COMPLETE : CardStatus.PENDING;
    }

    public MemoryCard withResolvedSlot(String slotId, String value) {
        Map<String, SlotValue> updatedSlots = new LinkedHashMap<>(slots);
        updatedSlots.put(slotId, SlotValue.resolved(value));
        List<String> missing = new ArrayList<>(missingRequired);
        missing.remove(slotId);
        return new MemoryCard(tempId, type, icon, title, subtitle, color, missing, requiredSlots, optionalSlots, updatedSlots);
    }

    public MemoryCard withMissing(String slotId) {
        if (missingRequired.contains(slotId)) {
            return this;
        }
        List<String> missing = new ArrayList<>(missingRequired);
        missing.add(slotId);
        return new MemoryCard(tempId, type, icon, title, subtitle, color, missing, requiredSlots, optionalSlots, slots);
    }
}
