package io.pgvault.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pgvault.core.schedule.OutcomeStatus;
import io.pgvault.core.schedule.RecurrenceKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteJobStore.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteJobStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized void insert(StoredJob job) throws IOException {
        String sql = """
            INSERT INTO scheduled_backup_jobs (
                job_id, owner_id, payload_location, payload_json, enabled, recurrence_kind,
                start_at, time_of_day, repeat_days, repeat_months, created_at,
                last_run, next_run, run_count, last_outcome
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.jobId());
            statement.setInt(2, job.ownerId());
            statement.setString(3, job.payloadLocation());
            statement.setString(4, mapper.writeValueAsString(job.payload()));
            statement.setInt(5, job.enabled() ? 1 : 0);
            statement.setString(6, job.recurrence().wireName());
            statement.setString(7, job.startAt().toString());
            statement.setString(8, job.timeOfDay().toString());
            statement.setString(9, mapper.writeValueAsString(job.repeatDays()));
            statement.setString(10, mapper.writeValueAsString(job.repeatMonths()));
            statement.setString(11, text(job.createdAt()));
            statement.setString(12, text(job.lastRun()));
            statement.setString(13, text(job.nextRun()));
            statement.setInt(14, job.runCount());
            statement.setString(15, job.lastOutcome().name());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to insert scheduled job " + job.jobId(), e);
        }
    }

    @Override
    public synchronized void updateRunHistory(
        String jobId,
        LocalDateTime lastRun,
        LocalDateTime nextRun,
        int runCount,
        OutcomeStatus lastOutcome
    ) throws IOException {
        String sql = """
            UPDATE scheduled_backup_jobs
            SET last_run = ?, next_run = ?, run_count = ?, last_outcome = ?
            WHERE job_id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, text(lastRun));
            statement.setString(2, text(nextRun));
            statement.setInt(3, runCount);
            statement.setString(4, (lastOutcome == null ? OutcomeStatus.UNKNOWN : lastOutcome).name());
            statement.setString(5, jobId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update run history of job " + jobId, e);
        }
    }

    @Override
    public synchronized List<StoredJob> loadEnabled() throws IOException {
        String sql = """
            SELECT job_id, owner_id, payload_location, payload_json, enabled, recurrence_kind,
                   start_at, time_of_day, repeat_days, repeat_months, created_at,
                   last_run, next_run, run_count, last_outcome
            FROM scheduled_backup_jobs
            WHERE enabled = 1
            ORDER BY seq ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<StoredJob> jobs = new ArrayList<>();
            while (resultSet.next()) {
                String jobId = resultSet.getString("job_id");
                try {
                    jobs.add(readRow(jobId, resultSet));
                } catch (IOException | RuntimeException e) {
                    LOG.warn("Skipping unreadable scheduled job {}: {}", jobId, e.getMessage());
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to load scheduled jobs", e);
        }
    }

    private StoredJob readRow(String jobId, ResultSet resultSet) throws SQLException, IOException {
        return new StoredJob(
            jobId,
            resultSet.getInt("owner_id"),
            resultSet.getString("payload_location"),
            mapper.readValue(resultSet.getString("payload_json"), PAYLOAD),
            resultSet.getInt("enabled") != 0,
            RecurrenceKind.fromWireName(resultSet.getString("recurrence_kind")),
            LocalDateTime.parse(resultSet.getString("start_at")),
            LocalTime.parse(resultSet.getString("time_of_day")),
            mapper.readValue(resultSet.getString("repeat_days"), STRINGS),
            mapper.readValue(resultSet.getString("repeat_months"), STRINGS),
            dateTime(resultSet.getString("created_at")),
            dateTime(resultSet.getString("last_run")),
            dateTime(resultSet.getString("next_run")),
            resultSet.getInt("run_count"),
            OutcomeStatus.valueOf(resultSet.getString("last_outcome"))
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS scheduled_backup_jobs (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id TEXT NOT NULL UNIQUE,
                owner_id INTEGER NOT NULL,
                payload_location TEXT NOT NULL,
                payload_json TEXT NOT NULL,
                enabled INTEGER NOT NULL DEFAULT 1,
                recurrence_kind TEXT NOT NULL,
                start_at TEXT NOT NULL,
                time_of_day TEXT NOT NULL,
                repeat_days TEXT NOT NULL,
                repeat_months TEXT NOT NULL,
                created_at TEXT,
                last_run TEXT,
                next_run TEXT,
                run_count INTEGER NOT NULL DEFAULT 0,
                last_outcome TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_scheduled_backup_jobs_owner
            ON scheduled_backup_jobs(owner_id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }

    private String text(LocalDateTime value) {
        return value == null ? null : value.toString();
    }

    private LocalDateTime dateTime(String value) {
        return value == null || value.isBlank() ? null : LocalDateTime.parse(value);
    }
}
