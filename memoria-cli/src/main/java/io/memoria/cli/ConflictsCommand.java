package io.memoria.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.conflict.ConflictCheckRequest;
import picocli.CommandLine.Command;

@Command(name = "conflicts", description = "Check extracted memories against what is already stored")
public final class ConflictsCommand extends StageCommand {

    public ConflictsCommand(CliContext context) {
        super(context);
    }

    @Override
    protected Object run(JsonNode payload) {
        return context.pipeline().checkConflicts(reader.read(payload, ConflictCheckRequest.class));
    }

    @Override
    protected String stageName() {
        return "Conflicts";
    }
}
