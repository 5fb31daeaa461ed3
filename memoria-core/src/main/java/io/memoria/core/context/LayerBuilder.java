package io.memoria.core.context;

import io.memoria.core.config.model.ContextInjectionConfig;
import java.io.IOException;

public interface LayerBuilder {
    LayerKind kind();

    ContextLayer build(UserContext context, ContextInjectionConfig config) throws IOException;
}
