package io.pgvault.core.backup;

import io.pgvault.core.schedule.ExecutionOutcome;
import io.pgvault.core.scheduler.ActionExecutor;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class BackupActionExecutor implements ActionExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(BackupActionExecutor.class);
    private static final int MAX_REASON_CHARS = 2_000;

    private final BackupCommandBuilder commandBuilder;
    private final Duration timeout;

    public BackupActionExecutor(BackupCommandBuilder commandBuilder) {
        this(commandBuilder, Duration.ZERO);
    }

    public BackupActionExecutor(BackupCommandBuilder commandBuilder, Duration timeout) {
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder must not be null");
        this.timeout = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
    }

    @Override
    public ExecutionOutcome execute(int ownerId, Map<String, Object> payload) throws IOException, InterruptedException {
        List<String> command = commandBuilder.build(ownerId, payload);
        if (command == null || command.isEmpty()) {
            return ExecutionOutcome.failure("no backup command for owner " + ownerId);
        }
        LOG.debug("Starting backup utility for owner {}: {}", ownerId, command.get(0));

        Process process = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .start();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));

        try {
            if (timeout.isZero()) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ExecutionOutcome.failure("backup utility timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        int exitCode = process.exitValue();
        String tail = tail(output.join());
        if (exitCode == 0) {
            return ExecutionOutcome.succeeded();
        }
        return ExecutionOutcome.failure(tail.isBlank()
            ? "exit status " + exitCode
            : "exit status " + exitCode + ": " + tail);
    }

    private String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Backup utility output closed early", e);
            return "";
        }
    }

    private String tail(String output) {
        String trimmed = output == null ? "" : output.trim();
        if (trimmed.length() <= MAX_REASON_CHARS) {
            return trimmed;
        }
        return trimmed.substring(trimmed.length() - MAX_REASON_CHARS);
    }
}
