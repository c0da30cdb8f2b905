package io.pgvault.core.schedule;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

public record AnchorTime(LocalDateTime start) {

    public AnchorTime {
        Objects.requireNonNull(start, "start must not be null");
        start = start.withNano(0);
    }

    public static AnchorTime of(LocalDateTime start) {
        return new AnchorTime(start);
    }

    public LocalTime timeOfDay() {
        return start.toLocalTime();
    }

    public LocalDateTime alignTimeOfDay(LocalDateTime value) {
        return value.with(timeOfDay());
    }
}
