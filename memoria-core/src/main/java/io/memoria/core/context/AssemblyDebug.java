package io.memoria.core.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AssemblyDebug(List<String> layersIncluded, Map<String, Integer> tokensPerLayer, List<String> trimmed) {

    public AssemblyDebug {
        layersIncluded = layersIncluded == null ? List.of() : List.copyOf(layersIncluded);
        tokensPerLayer = tokensPerLayer == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tokensPerLayer));
        trimmed = trimmed == null ? List.of() : List.copyOf(trimmed);
    }
}
