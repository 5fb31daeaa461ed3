package io.memoria.core.disclosure;

/**
 * The pieces of the reply prompt, plus {@code full}, the exact text handed to the reply model.
 */
public record PromptParts(String system, String memories, String saveInstruction, String user, String full) {
}
