package io.memoria.core.provider;

import java.util.Optional;

/**
 * Model output often wraps JSON in prose or code fences. The object is taken to span
 * from the first {@code '{'} to the last {@code '}'}.
 */
public final class JsonSpan {

    private JsonSpan() {
    }

    public static Optional<String> firstObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }
}
