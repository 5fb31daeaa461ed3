package io.memoria.cli;

@FunctionalInterface
public interface ServerRunner {
    int run(String host, Integer port) throws Exception;
}
