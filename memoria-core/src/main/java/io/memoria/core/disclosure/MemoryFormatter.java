package io.memoria.core.disclosure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoria.core.config.model.ContextInjectionConfig;
import io.memoria.core.model.RelevantMemory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the memory section of the legacy, non-layered prompt.
 */
public final class MemoryFormatter {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> TYPE_LABELS = Map.of(
        "fact", "Facts",
        "preference", "Preferences",
        "relationship", "Relationships",
        "event", "Events",
        "goal", "Goals",
        "todo", "Tasks",
        "note", "Notes"
    );

    private MemoryFormatter() {
    }

    public static String format(List<RelevantMemory> memories, ContextInjectionConfig config) {
        if (memories.isEmpty()) {
            return "";
        }
        ContextInjectionConfig.Format format = config.format();
        if (format.groupByType()) {
            return grouped(memories);
        }
        if ("json".equals(format.memoryFormat())) {
            return json(memories);
        }

        List<String> items = new ArrayList<>();
        for (int i = 0; i < memories.size(); i++) {
            RelevantMemory memory = memories.get(i);
            String item = switch (format.memoryFormat()) {
                case "numbered" -> (i + 1) + ". " + memory.content();
                case "prose" -> memory.content();
                default -> config.prompts().memoryItemFormat()
                    .replace("{{content}}", memory.content())
                    .replace("{{type}}", memory.type())
                    .replace("{{context}}", memory.context());
            };
            if (format.includeMetadata()) {
                item += " [" + memory.type() + "]";
            }
            items.add(item);
        }

        if ("prose".equals(format.memoryFormat())) {
            return String.join(". ", items) + ".";
        }
        return String.join("newline".equals(format.separator()) ? "\n" : ", ", items);
    }

    private static String grouped(List<RelevantMemory> memories) {
        Map<String, List<RelevantMemory>> groups = new LinkedHashMap<>();
        for (RelevantMemory memory : memories) {
            groups.computeIfAbsent(memory.type(), key -> new ArrayList<>()).add(memory);
        }
        return groups.entrySet().stream()
            .map(entry -> "**" + TYPE_LABELS.getOrDefault(entry.getKey(), entry.getKey()) + ":**\n"
                + entry.getValue().stream().map(memory -> "- " + memory.content()).collect(Collectors.joining("\n")))
            .collect(Collectors.joining("\n\n"));
    }

    private static String json(List<RelevantMemory> memories) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (RelevantMemory memory : memories) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("type", memory.type());
            row.put("content", memory.content());
            row.put("context", memory.context());
            rows.add(row);
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memories", e);
        }
    }
}
