package io.pgvault.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.pgvault.core.scheduler.SchedulerSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    int pollIntervalSeconds,
    int initialDelaySeconds,
    int stopTimeoutSeconds,
    int maxConsecutiveLoopFailures,
    boolean autoStart,
    boolean restoreOnStartup
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(60, 0, 10, 5, true, true);
    }

    public SchedulerSettings toSettings() {
        return new SchedulerSettings(
            Duration.ofSeconds(Math.max(1, pollIntervalSeconds)),
            Duration.ofSeconds(Math.max(0, initialDelaySeconds)),
            Duration.ofSeconds(Math.max(1, stopTimeoutSeconds)),
            Math.max(1, maxConsecutiveLoopFailures),
            autoStart,
            restoreOnStartup
        );
    }
}
