package io.pgvault.core.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pgvault.core.config.model.BackupConfig;
import io.pgvault.core.config.model.ServerConnection;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateBackupCommandBuilderTest {

    @Test
    void shouldBuildCommandWithOwnerServerConnection() {
        BackupConfig config = new BackupConfig(
            "/usr/bin/pg_dump",
            0,
            Map.of("7", new ServerConnection("db.internal", 5433, "backup"))
        );

        var command = new TemplateBackupCommandBuilder(config)
            .build(7, Map.of("file", "/backups/app.dump", "format", "c", "database", "app"));

        assertThat(command).containsExactly(
            "/usr/bin/pg_dump",
            "--host", "db.internal",
            "--port", "5433",
            "--username", "backup",
            "--no-password",
            "--file", "/backups/app.dump",
            "--format=c",
            "app"
        );
    }

    @Test
    void shouldFallBackToLocalConnectionWhenOwnerHasNoServer() {
        var command = new TemplateBackupCommandBuilder(BackupConfig.defaults())
            .build(3, Map.of("file", "/backups/local.sql"));

        assertThat(command).containsExactly("pg_dump", "--file", "/backups/local.sql");
    }

    @Test
    void shouldRequireTargetFile() {
        TemplateBackupCommandBuilder builder = new TemplateBackupCommandBuilder(BackupConfig.defaults());

        assertThatThrownBy(() -> builder.build(3, Map.of("database", "app")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no target file");
    }
}
