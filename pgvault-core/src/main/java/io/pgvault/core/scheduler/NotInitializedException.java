package io.pgvault.core.scheduler;

public class NotInitializedException extends IllegalStateException {

    public NotInitializedException(String message) {
        super(message);
    }
}
