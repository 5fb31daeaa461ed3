package io.memoria.core.context;

import java.util.Objects;

public record ContextLayer(LayerKind name, String content, int tokenCount, int itemCount, boolean trimmed) {

    public ContextLayer {
        Objects.requireNonNull(name, "name must not be null");
        content = content == null ? "" : content;
    }

    public static ContextLayer empty(LayerKind name) {
        return new ContextLayer(name, "", 0, 0, false);
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }
}
