package io.pgvault.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.List;

public record SchedulerStatus(
    SchedulerState state,
    boolean running,
    boolean initialized,
    @JsonProperty("job_count") int jobCount,
    @JsonProperty("consecutive_loop_failures") int consecutiveLoopFailures,
    @JsonProperty("last_iteration_at") LocalDateTime lastIterationAt,
    @JsonProperty("last_loop_error") String lastLoopError,
    List<OwnerJobSummary> owners
) {
}
