package io.memoria.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlotDefinition(
    String id,
    String label,
    String icon,
    String inputType,
    String placeholder,
    String questionTemplate,
    List<String> options
) {

    public SlotDefinition {
        Objects.requireNonNull(id, "slot id must not be null");
        inputType = inputType == null || inputType.isBlank() ? "text" : inputType;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static SlotDefinition of(String id, String label) {
        return new SlotDefinition(id, label, null, "text", null, null, List.of());
    }

    public static SlotDefinition withTemplate(String id, String label, String questionTemplate) {
        return new SlotDefinition(id, label, null, "text", null, questionTemplate, List.of());
    }

    /**
     * Label used in fallback questions; slot ids such as {@code when_date} read as "when date".
     */
    public String displayLabel() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        return id.replace('_', ' ');
    }
}
