package io.memoria.core.disclosure;

import java.util.Optional;

public final class ContextModeResolver {

    private ContextModeResolver() {
    }

    public static ContextMode resolve(Optional<String> intent) {
        if (intent.isEmpty()) {
            return ContextMode.NEUTRAL_ACK;
        }
        String value = intent.get();
        if (Intents.SOCIAL.contains(value)) {
            return ContextMode.IDENTITY_ONLY;
        }
        if (Intents.MEMORY_INSTRUCTION.equals(value)) {
            return ContextMode.MEMORY_CONFIRM_ALLOWED;
        }
        if (Intents.MEMORY_USE.contains(value)) {
            return ContextMode.MEMORY_USE_ALLOWED;
        }
        return ContextMode.NEUTRAL_ACK;
    }
}
