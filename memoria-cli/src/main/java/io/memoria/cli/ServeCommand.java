package io.memoria.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP pipeline server")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address override")
    String host;

    @Option(names = {"--port"}, description = "Port override")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
