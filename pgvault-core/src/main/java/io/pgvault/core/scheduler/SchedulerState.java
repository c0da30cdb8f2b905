package io.pgvault.core.scheduler;

public enum SchedulerState {
    UNINITIALIZED,
    INITIALIZED,
    RUNNING,
    STOPPED
}
