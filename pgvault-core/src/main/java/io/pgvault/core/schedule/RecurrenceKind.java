package io.pgvault.core.schedule;

import java.util.Locale;

public enum RecurrenceKind {
    ONE_TIME("one_time"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String wireName;

    RecurrenceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecurrenceKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("schedule type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RecurrenceKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unsupported schedule type: " + value);
    }
}
