package io.pgvault.core.backup;

import io.pgvault.core.config.model.BackupConfig;
import io.pgvault.core.config.model.ServerConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class TemplateBackupCommandBuilder implements BackupCommandBuilder {
    private final BackupConfig config;

    public TemplateBackupCommandBuilder(BackupConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public List<String> build(int ownerId, Map<String, Object> payload) {
        String file = text(payload.get("file"));
        if (file.isBlank()) {
            throw new IllegalArgumentException("backup payload has no target file");
        }

        List<String> command = new ArrayList<>();
        command.add(config.utility() == null || config.utility().isBlank() ? "pg_dump" : config.utility());
        ServerConnection server = config.server(ownerId);
        if (server != null) {
            if (!text(server.host()).isBlank()) {
                command.add("--host");
                command.add(server.host());
            }
            if (server.port() > 0) {
                command.add("--port");
                command.add(String.valueOf(server.port()));
            }
            if (!text(server.username()).isBlank()) {
                command.add("--username");
                command.add(server.username());
            }
            command.add("--no-password");
        }
        command.add("--file");
        command.add(file);
        String format = text(payload.get("format"));
        if (!format.isBlank()) {
            command.add("--format=" + format);
        }
        String database = text(payload.get("database"));
        if (!database.isBlank()) {
            command.add(database);
        }
        return command;
    }

    private String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }
}
