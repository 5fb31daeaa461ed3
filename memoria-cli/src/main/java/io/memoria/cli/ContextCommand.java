package io.memoria.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.disclosure.ContextInjectionRequest;
import io.memoria.core.disclosure.ContextInjectionResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "context", description = "Build the reply prompt for a message")
public final class ContextCommand extends StageCommand {

    @Option(names = "--prompt-only", description = "Print only the assembled prompt text")
    boolean promptOnly;

    public ContextCommand(CliContext context) {
        super(context);
    }

    @Override
    protected Object run(JsonNode payload) {
        ContextInjectionResult result = context.pipeline().injectContext(reader.read(payload, ContextInjectionRequest.class));
        return promptOnly ? result.prompt().full() : result;
    }

    @Override
    protected String stageName() {
        return "Context";
    }
}
