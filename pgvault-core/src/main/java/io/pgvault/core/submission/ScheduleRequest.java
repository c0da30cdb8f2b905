package io.pgvault.core.submission;

import io.pgvault.core.schedule.RecurrenceKind;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ScheduleRequest(
    int ownerId,
    Map<String, Object> payload,
    RecurrenceKind recurrence,
    LocalDateTime startAt,
    List<String> repeatDays,
    List<String> repeatMonths,
    String payloadLocation
) {

    public ScheduleRequest {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        Objects.requireNonNull(startAt, "startAt must not be null");
        repeatDays = repeatDays == null ? List.of() : List.copyOf(repeatDays);
        repeatMonths = repeatMonths == null ? List.of() : List.copyOf(repeatMonths);
        payloadLocation = payloadLocation == null ? "" : payloadLocation;
    }

    public static ScheduleRequest of(
        int ownerId,
        Map<String, Object> payload,
        RecurrenceKind recurrence,
        LocalDateTime startAt
    ) {
        return new ScheduleRequest(ownerId, payload, recurrence, startAt, List.of(), List.of(), "");
    }
}
