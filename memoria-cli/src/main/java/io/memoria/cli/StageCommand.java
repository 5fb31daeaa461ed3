package io.memoria.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.memoria.core.model.MalformedInputException;
import io.memoria.core.pipeline.PayloadReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/**
 * Reads a JSON request, runs one pipeline stage on it and prints the result as JSON.
 * Exit codes: 0 on success, 2 for a malformed request, 1 for anything else.
 */
abstract class StageCommand implements Callable<Integer> {
    static final int EXIT_MALFORMED = 2;

    protected final CliContext context;
    protected final PayloadReader reader = new PayloadReader();

    @Option(names = {"-i", "--input"}, required = true, description = "JSON request file, or - for stdin")
    String input;

    StageCommand(CliContext context) {
        this.context = context;
    }

    protected abstract Object run(JsonNode payload);

    protected abstract String stageName();

    @Override
    public Integer call() {
        try {
            Object result = run(reader.tree(readInput()));
            if (result instanceof String text) {
                System.out.println(text);
            } else {
                System.out.println(reader.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
            }
            return 0;
        } catch (MalformedInputException e) {
            System.err.println("Malformed " + stageName() + " request: " + e.getMessage());
            return EXIT_MALFORMED;
        } catch (Exception e) {
            System.err.println(stageName() + " command failed: " + e.getMessage());
            return 1;
        }
    }

    private String readInput() throws IOException {
        if ("-".equals(input)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input));
    }
}
