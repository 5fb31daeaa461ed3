package io.memoria.core.disclosure;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the reply model may reference or confirm on this turn. Each mode carries a fixed
 * directive that is appended after the base persona.
 */
public enum ContextMode {
    IDENTITY_ONLY("identity_only", """
        [CONTEXT MODE: IDENTITY ONLY]
        You may acknowledge the user by name.
        You MUST NOT reference personal facts, preferences, reminders, work, family, or past events.
        You MUST NOT imply memory updates or long-term recall."""),
    NEUTRAL_ACK("neutral_ack", """
        [CONTEXT MODE: NEUTRAL ACKNOWLEDGEMENT]
        You may acknowledge the statement conversationally.
        You MUST NOT say you will remember, store, save, or recall this information later.
        You MUST NOT reference unrelated personal memories.
        Do not imply persistence."""),
    MEMORY_CONFIRM_ALLOWED("memory_confirm_allowed", """
        [CONTEXT MODE: MEMORY CONFIRMATION ALLOWED]
        You may confirm that the information was saved, but ONLY if explicitly instructed below.
        Do not restate unrelated memories."""),
    MEMORY_USE_ALLOWED("memory_use_allowed", """
        [CONTEXT MODE: MEMORY USE ALLOWED]
        You have access to memories about the user listed below.
        You MUST actively use these memories to provide personalized, relevant responses.
        When answering questions or making suggestions, reference what you know about the user.
        If a memory is directly relevant to the user's question, incorporate it naturally into your response.
        Do not just acknowledge - use the information to be helpful.""");

    private final String key;
    private final String directive;

    ContextMode(String key, String directive) {
        this.key = key;
        this.directive = directive;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String directive() {
        return directive;
    }
}
