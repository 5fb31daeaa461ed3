package io.memoria.core.clarification;

import io.memoria.core.model.ExtractedMemoryCandidate;
import io.memoria.core.model.MemoryTypeConfig;
import io.memoria.core.model.SlotDefinition;
import io.memoria.core.model.SlotValue;
import java.util.List;
import java.util.Map;

final class Fixtures {

    static final MemoryTypeConfig EVENT = new MemoryTypeConfig(
        "📅",
        "Event",
        "#4CAF50",
        List.of(SlotDefinition.of("what", null), SlotDefinition.of("when_date", null)),
        List.of(SlotDefinition.of("when_time", "Time"), SlotDefinition.of("location", "Location"))
    );

    static final MemoryTypeConfig RELATIONSHIP = new MemoryTypeConfig(
        "👥",
        "Relationship",
        "#9C27B0",
        List.of(
            SlotDefinition.of("person_name", "Name"),
            SlotDefinition.withTemplate("relationship_type", "Relationship", "How do you know {person_name}?")
        ),
        List.of()
    );

    private Fixtures() {
    }

    static ExtractedMemoryCandidate event(String tempId, Map<String, SlotValue> slots) {
        return new ExtractedMemoryCandidate(tempId, "Dentist appointment", "event", 0.9, slots, EVENT, "I have a dentist appointment");
    }

    static ExtractedMemoryCandidate dentistWithoutDate() {
        return event("tmp-1", Map.of("what", SlotValue.filled("dentist"), "when_date", SlotValue.empty()));
    }
}
