package io.pgvault.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.pgvault.core.schedule.JobSnapshot;
import java.util.List;

public record OwnerJobSummary(
    @JsonProperty("owner_id") int ownerId,
    List<JobSnapshot> jobs
) {
}
