package io.pgvault.core.store;

import io.pgvault.core.schedule.AnchorTime;
import io.pgvault.core.schedule.OutcomeStatus;
import io.pgvault.core.schedule.RecurrenceKind;
import io.pgvault.core.schedule.ScheduledJob;
import io.pgvault.core.submission.ScheduleRequest;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

public record StoredJob(
    String jobId,
    int ownerId,
    String payloadLocation,
    Map<String, Object> payload,
    boolean enabled,
    RecurrenceKind recurrence,
    LocalDateTime startAt,
    LocalTime timeOfDay,
    List<String> repeatDays,
    List<String> repeatMonths,
    LocalDateTime createdAt,
    LocalDateTime lastRun,
    LocalDateTime nextRun,
    int runCount,
    OutcomeStatus lastOutcome
) {

    public StoredJob {
        payloadLocation = payloadLocation == null ? "" : payloadLocation;
        payload = payload == null ? Map.of() : payload;
        repeatDays = repeatDays == null ? List.of() : List.copyOf(repeatDays);
        repeatMonths = repeatMonths == null ? List.of() : List.copyOf(repeatMonths);
        lastOutcome = lastOutcome == null ? OutcomeStatus.UNKNOWN : lastOutcome;
    }

    public static StoredJob of(ScheduledJob job, ScheduleRequest request) {
        return new StoredJob(
            job.id(),
            job.ownerId(),
            request.payloadLocation(),
            job.payload(),
            true,
            job.recurrence(),
            job.anchor().start(),
            job.anchor().timeOfDay(),
            request.repeatDays(),
            request.repeatMonths(),
            job.createdAt(),
            job.lastRun().orElse(null),
            job.nextRun().orElse(null),
            job.runCount(),
            job.lastOutcome()
        );
    }

    public ScheduledJob toScheduledJob() {
        return ScheduledJob.restore(
            jobId,
            ownerId,
            payload,
            recurrence,
            AnchorTime.of(startAt),
            createdAt == null ? startAt : createdAt,
            lastRun,
            runCount,
            lastOutcome
        );
    }
}
