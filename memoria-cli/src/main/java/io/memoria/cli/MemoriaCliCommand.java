package io.memoria.cli;

import picocli.CommandLine.Command;

@Command(name = "memoria", mixinStandardHelpOptions = true, description = "Memoria conversational memory pipeline")
public final class MemoriaCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
