package io.pgvault.core.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;

public record JobSnapshot(
    @JsonProperty("job_id") String id,
    @JsonProperty("owner_id") int ownerId,
    RecurrenceKind recurrence,
    @JsonProperty("start_at") LocalDateTime startAt,
    @JsonProperty("created_at") LocalDateTime createdAt,
    @JsonProperty("last_run") LocalDateTime lastRun,
    @JsonProperty("next_run") LocalDateTime nextRun,
    @JsonProperty("run_count") int runCount,
    @JsonProperty("last_outcome") OutcomeStatus lastOutcome,
    @JsonProperty("last_failure_reason") String lastFailureReason
) {
}
