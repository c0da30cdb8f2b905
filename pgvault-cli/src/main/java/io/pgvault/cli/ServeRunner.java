package io.pgvault.cli;

@FunctionalInterface
public interface ServeRunner {
    // null port means the configured one
    int run(Integer portOverride) throws Exception;
}
