package io.pgvault.app;

import io.pgvault.cli.CliContext;
import io.pgvault.cli.InitCommand;
import io.pgvault.cli.PgvaultCliCommand;
import io.pgvault.cli.ServeCommand;
import io.pgvault.cli.StatusCommand;
import io.pgvault.cli.SubmitCommand;
import io.pgvault.core.api.SchedulerGateway;
import io.pgvault.core.backup.BackupActionExecutor;
import io.pgvault.core.backup.TemplateBackupCommandBuilder;
import io.pgvault.core.config.ConfigPaths;
import io.pgvault.core.config.ConfigService;
import io.pgvault.core.config.model.PgvaultConfig;
import io.pgvault.core.config.model.StorageConfig;
import io.pgvault.core.schedule.JobRegistry;
import io.pgvault.core.scheduler.SchedulerService;
import io.pgvault.core.store.JobStore;
import io.pgvault.core.store.NoopJobStore;
import io.pgvault.core.store.SqliteJobStore;
import io.pgvault.core.submission.ScheduleRequestParser;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class PgvaultApplication {
    private static final Logger LOG = LoggerFactory.getLogger(PgvaultApplication.class);

    private PgvaultApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            portOverride -> runServe(configService, configPath, portOverride)
        );

        CommandLine commandLine = new CommandLine(new PgvaultCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("submit", new SubmitCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServe(ConfigService configService, Path configPath, Integer portOverride) throws Exception {
        PgvaultConfig config = configService.load(configPath);
        int port = portOverride != null ? portOverride : config.gateway().port();

        BackupActionExecutor executor = new BackupActionExecutor(
            new TemplateBackupCommandBuilder(config.backup()),
            Duration.ofSeconds(Math.max(0, config.backup().processTimeoutSeconds()))
        );
        CountDownLatch shutdown = new CountDownLatch(1);
        try (SchedulerService scheduler = new SchedulerService(
                new JobRegistry(),
                buildJobStore(config.storage()),
                config.scheduler().toSettings()
            );
             SchedulerGateway gateway = new SchedulerGateway(
                port,
                config.gateway().host(),
                scheduler,
                new ScheduleRequestParser()
            )) {
            scheduler.initialize(executor, Clock.systemDefaultZone());
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "pgvault-shutdown"));
            gateway.start();
            scheduler.start();
            System.out.println("pgvault scheduler running, gateway on http://" + config.gateway().host() + ":" + gateway.port());
            System.out.println("Endpoints: GET /healthz, GET /scheduler/status, GET /scheduler/jobs?owner=<id>, POST /backup/job/{ownerId}");
            shutdown.await();
        }
        return 0;
    }

    private static JobStore buildJobStore(StorageConfig storage) {
        if (!storage.enabled()) {
            LOG.info("Job storage disabled, scheduled jobs live in memory only");
            return new NoopJobStore();
        }
        Path dbPath = ConfigPaths.resolveStorage(storage.path());
        try {
            return new SqliteJobStore(dbPath);
        } catch (IOException e) {
            LOG.warn("Could not open job store at {}, continuing without persistence", dbPath, e);
            return new NoopJobStore();
        }
    }
}
