package io.pgvault.core.schedule;

public record RegisteredJob(int ownerId, ScheduledJob job) {
}
