package io.pgvault.core.scheduler;

import io.pgvault.core.schedule.ExecutionOutcome;
import java.util.Map;

@FunctionalInterface
public interface ActionExecutor {
    ExecutionOutcome execute(int ownerId, Map<String, Object> payload) throws Exception;
}
