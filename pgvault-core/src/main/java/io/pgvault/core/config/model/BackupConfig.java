package io.pgvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupConfig(
    String utility,
    int processTimeoutSeconds,
    Map<String, ServerConnection> servers
) {

    public BackupConfig {
        servers = servers == null ? Map.of() : Map.copyOf(servers);
    }

    public static BackupConfig defaults() {
        return new BackupConfig("pg_dump", 0, Map.of());
    }

    public ServerConnection server(int ownerId) {
        return servers.get(String.valueOf(ownerId));
    }
}
