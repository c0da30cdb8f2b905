package io.pgvault.core.schedule;

public record ExecutionOutcome(boolean success, String reason) {

    public ExecutionOutcome {
        reason = reason == null ? "" : reason;
    }

    public static ExecutionOutcome succeeded() {
        return new ExecutionOutcome(true, "");
    }

    public static ExecutionOutcome failure(String reason) {
        return new ExecutionOutcome(false, reason == null || reason.isBlank() ? "unknown failure" : reason);
    }

    public OutcomeStatus status() {
        return success ? OutcomeStatus.SUCCESS : OutcomeStatus.FAILED;
    }
}
