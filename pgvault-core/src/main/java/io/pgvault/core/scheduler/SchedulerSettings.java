package io.pgvault.core.scheduler;

import java.time.Duration;
import java.util.Objects;

public record SchedulerSettings(
    Duration pollInterval,
    Duration initialDelay,
    Duration stopTimeout,
    int maxConsecutiveLoopFailures,
    boolean autoStart,
    boolean restoreOnStartup
) {

    public SchedulerSettings {
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(stopTimeout, "stopTimeout must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (maxConsecutiveLoopFailures <= 0) {
            throw new IllegalArgumentException("maxConsecutiveLoopFailures must be > 0");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(Duration.ofSeconds(60), Duration.ZERO, Duration.ofSeconds(10), 5, true, true);
    }
}
