package io.pgvault.core.schedule;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class ScheduledJob {
    private final int ownerId;
    private final Map<String, Object> payload;
    private final RecurrenceKind recurrence;
    private final AnchorTime anchor;
    private final LocalDateTime createdAt;

    private String id;
    private LocalDateTime lastRun;
    private LocalDateTime nextRun;
    private int runCount;
    private OutcomeStatus lastOutcome;
    private String lastFailureReason;

    public ScheduledJob(
        int ownerId,
        Map<String, Object> payload,
        RecurrenceKind recurrence,
        AnchorTime anchor,
        LocalDateTime createdAt
    ) {
        this.ownerId = ownerId;
        this.payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.recurrence = Objects.requireNonNull(recurrence, "recurrence must not be null");
        this.anchor = Objects.requireNonNull(anchor, "anchor must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.lastOutcome = OutcomeStatus.UNKNOWN;
        this.lastFailureReason = "";
        this.nextRun = RecurrenceRule.computeNextRun(recurrence, anchor, null).orElse(null);
    }

    public static ScheduledJob restore(
        String id,
        int ownerId,
        Map<String, Object> payload,
        RecurrenceKind recurrence,
        AnchorTime anchor,
        LocalDateTime createdAt,
        LocalDateTime lastRun,
        int runCount,
        OutcomeStatus lastOutcome
    ) {
        ScheduledJob job = new ScheduledJob(ownerId, payload, recurrence, anchor, createdAt);
        job.assignId(id);
        job.lastRun = lastRun;
        job.runCount = Math.max(0, runCount);
        job.lastOutcome = lastOutcome == null ? OutcomeStatus.UNKNOWN : lastOutcome;
        job.nextRun = RecurrenceRule.computeNextRun(recurrence, anchor, lastRun).orElse(null);
        return job;
    }

    public synchronized void recordOutcome(ExecutionOutcome outcome, LocalDateTime at) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(at, "at must not be null");
        lastRun = at;
        lastOutcome = outcome.status();
        lastFailureReason = outcome.success() ? "" : outcome.reason();
        runCount++;
        nextRun = RecurrenceRule.computeNextRun(recurrence, anchor, lastRun).orElse(null);
    }

    public boolean isDue(LocalDateTime now) {
        return RecurrenceRule.isDue(this, now);
    }

    synchronized void assignId(String value) {
        if (id != null) {
            throw new IllegalStateException("job already registered as " + id);
        }
        id = Objects.requireNonNull(value, "id must not be null");
    }

    public synchronized String id() {
        return id;
    }

    public int ownerId() {
        return ownerId;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public RecurrenceKind recurrence() {
        return recurrence;
    }

    public AnchorTime anchor() {
        return anchor;
    }

    public LocalDateTime createdAt() {
        return createdAt;
    }

    public synchronized Optional<LocalDateTime> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    public synchronized Optional<LocalDateTime> nextRun() {
        return Optional.ofNullable(nextRun);
    }

    public synchronized int runCount() {
        return runCount;
    }

    public synchronized OutcomeStatus lastOutcome() {
        return lastOutcome;
    }

    public synchronized String lastFailureReason() {
        return lastFailureReason;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(
            id,
            ownerId,
            recurrence,
            anchor.start(),
            createdAt,
            lastRun,
            nextRun,
            runCount,
            lastOutcome,
            lastFailureReason
        );
    }

    @Override
    public synchronized String toString() {
        return "ScheduledJob{id=" + id + ", owner=" + ownerId + ", recurrence=" + recurrence.wireName()
            + ", nextRun=" + nextRun + ", runCount=" + runCount + "}";
    }
}
