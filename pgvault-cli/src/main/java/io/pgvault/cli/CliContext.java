package io.pgvault.cli;

import io.pgvault.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, portOverride -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
