package io.memoria.core.context;

import java.util.List;

public record AssembledContext(List<ContextLayer> layers, String assembledText, int totalTokens, AssemblyDebug debug) {

    public AssembledContext {
        layers = layers == null ? List.of() : List.copyOf(layers);
        assembledText = assembledText == null ? "" : assembledText;
    }

    public boolean isEmpty() {
        return assembledText.isEmpty();
    }
}
