package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryTypeConfig(
    String icon,
    String name,
    String color,
    List<SlotDefinition> requiredSlots,
    List<SlotDefinition> optionalSlots
) {
    public static final String DEFAULT_ICON = "📝";
    public static final String DEFAULT_COLOR = "#607D8B";

    public MemoryTypeConfig {
        icon = icon == null || icon.isBlank() ? DEFAULT_ICON : icon;
        name = name == null || name.isBlank() ? "Unknown" : name;
        color = color == null || color.isBlank() ? DEFAULT_COLOR : color;
        requiredSlots = requiredSlots == null ? List.of() : List.copyOf(requiredSlots);
        optionalSlots = optionalSlots == null ? List.of() : List.copyOf(optionalSlots);
    }

    public static MemoryTypeConfig unknown() {
        return new MemoryTypeConfig(DEFAULT_ICON, "Unknown", DEFAULT_COLOR, List.of(), List.of());
    }

    public List<String> requiredSlotIds() {
        return requiredSlots.stream().map(SlotDefinition::id).toList();
    }

    public Optional<SlotDefinition> requiredSlot(String slotId) {
        return requiredSlots.stream().filter(slot -> slot.id().equals(slotId)).findFirst();
    }
}
