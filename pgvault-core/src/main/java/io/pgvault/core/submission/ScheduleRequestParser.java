package io.pgvault.core.submission;

import io.pgvault.core.schedule.RecurrenceKind;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class ScheduleRequestParser {
    public static final String ENABLE_SCHEDULER = "enable_scheduler";
    public static final String SCHEDULE_TYPE = "schedule_type";
    public static final String START_DATE_TIME = "start_date_time";
    public static final String REPEAT_DAYS = "repeat_days";
    public static final String REPEAT_MONTHS = "repeat_months";
    public static final String FILE = "file";

    private static final Set<String> SCHEDULER_FIELDS = Set.of(
        ENABLE_SCHEDULER,
        SCHEDULE_TYPE,
        START_DATE_TIME,
        REPEAT_DAYS,
        REPEAT_MONTHS
    );
    private static final Pattern TRAILING_OFFSET = Pattern.compile("(Z|[+-]\\d{2}(:?\\d{2})?)$");
    private static final DateTimeFormatter START_FORMAT = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd")
        .optionalStart().appendLiteral(' ').optionalEnd()
        .optionalStart().appendLiteral('T').optionalEnd()
        .appendPattern("HH:mm")
        .optionalStart().appendPattern(":ss").optionalEnd()
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
        .toFormatter(Locale.ROOT);

    public boolean isSchedulingRequest(Map<String, Object> body) {
        if (body == null) {
            return false;
        }
        Object flag = body.get(ENABLE_SCHEDULER);
        if (flag instanceof Boolean enabled) {
            return enabled;
        }
        if (flag instanceof Number number) {
            return number.intValue() != 0;
        }
        return flag != null && "true".equalsIgnoreCase(String.valueOf(flag).trim());
    }

    public ScheduleRequest parse(int ownerId, Map<String, Object> body) {
        if (body == null) {
            throw new ValidationException("request body is required");
        }
        RecurrenceKind recurrence;
        try {
            recurrence = RecurrenceKind.fromWireName(stringValue(body.get(SCHEDULE_TYPE)));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        LocalDateTime startAt = parseStart(stringValue(body.get(START_DATE_TIME)));

        Map<String, Object> payload = new LinkedHashMap<>(body);
        payload.keySet().removeAll(SCHEDULER_FIELDS);

        return new ScheduleRequest(
            ownerId,
            payload,
            recurrence,
            startAt,
            stringList(body.get(REPEAT_DAYS)),
            stringList(body.get(REPEAT_MONTHS)),
            stringValue(body.get(FILE))
        );
    }

    LocalDateTime parseStart(String raw) {
        if (raw.isBlank()) {
            throw new ValidationException("Start date and time is required for scheduling");
        }
        String local = TRAILING_OFFSET.matcher(raw.trim()).replaceFirst("").trim();
        try {
            return LocalDateTime.parse(local, START_FORMAT).withNano(0);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid datetime format: " + raw, e);
        }
    }

    private List<String> stringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String text = stringValue(item);
                if (!text.isBlank()) {
                    values.add(text);
                }
            }
            return values;
        }
        for (String part : String.valueOf(value).split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isBlank()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private String stringValue(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }
}
