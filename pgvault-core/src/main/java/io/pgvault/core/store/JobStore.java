package io.pgvault.core.store;

import io.pgvault.core.schedule.OutcomeStatus;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

public interface JobStore {
    void insert(StoredJob job) throws IOException;

    void updateRunHistory(
        String jobId,
        LocalDateTime lastRun,
        LocalDateTime nextRun,
        int runCount,
        OutcomeStatus lastOutcome
    ) throws IOException;

    List<StoredJob> loadEnabled() throws IOException;
}
