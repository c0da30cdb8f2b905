package io.pgvault.cli;

import picocli.CommandLine.Command;

@Command(name = "pgvault", mixinStandardHelpOptions = true, description = "Scheduled PostgreSQL backup service")
public final class PgvaultCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
