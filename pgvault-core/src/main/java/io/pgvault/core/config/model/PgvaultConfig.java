package io.pgvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PgvaultConfig(
    SchedulerConfig scheduler,
    GatewayConfig gateway,
    StorageConfig storage,
    BackupConfig backup
) {

    public static PgvaultConfig defaults() {
        return new PgvaultConfig(
            SchedulerConfig.defaults(),
            GatewayConfig.defaults(),
            StorageConfig.defaults(),
            BackupConfig.defaults()
        );
    }
}
