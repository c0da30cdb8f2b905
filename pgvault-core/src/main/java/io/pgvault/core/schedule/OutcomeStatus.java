package io.pgvault.core.schedule;

public enum OutcomeStatus {
    SUCCESS,
    FAILED,
    UNKNOWN
}
