package io.memoria.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.clarification.ClarificationRequest;
import picocli.CommandLine.Command;

@Command(name = "clarify", description = "Decide whether extracted memories need clarifying questions")
public final class ClarifyCommand extends StageCommand {

    public ClarifyCommand(CliContext context) {
        super(context);
    }

    @Override
    protected Object run(JsonNode payload) {
        return context.pipeline().clarify(reader.read(payload, ClarificationRequest.class));
    }

    @Override
    protected String stageName() {
        return "Clarify";
    }
}
