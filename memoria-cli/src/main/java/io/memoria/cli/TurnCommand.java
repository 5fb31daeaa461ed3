package io.memoria.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.pipeline.TurnRequest;
import picocli.CommandLine.Command;

@Command(name = "turn", description = "Run conflict check, clarification and context injection for one turn")
public final class TurnCommand extends StageCommand {

    public TurnCommand(CliContext context) {
        super(context);
    }

    @Override
    protected Object run(JsonNode payload) {
        return context.pipeline().runTurn(reader.read(payload, TurnRequest.class));
    }

    @Override
    protected String stageName() {
        return "Turn";
    }
}
