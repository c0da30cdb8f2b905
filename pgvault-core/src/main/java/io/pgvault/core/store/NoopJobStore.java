package io.pgvault.core.store;

import io.pgvault.core.schedule.OutcomeStatus;
import java.time.LocalDateTime;
import java.util.List;

public final class NoopJobStore implements JobStore {

    @Override
    public void insert(StoredJob job) {
    }

    @Override
    public void updateRunHistory(
        String jobId,
        LocalDateTime lastRun,
        LocalDateTime nextRun,
        int runCount,
        OutcomeStatus lastOutcome
    ) {
    }

    @Override
    public List<StoredJob> loadEnabled() {
        return List.of();
    }
}
