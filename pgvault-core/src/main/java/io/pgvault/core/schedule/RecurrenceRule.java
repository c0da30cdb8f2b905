package io.pgvault.core.schedule;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Next-run arithmetic for the four supported recurrence kinds.
 *
 * <p>Every recurring occurrence is placed on the anchor's time-of-day. Monthly occurrences keep
 * the calendar day of the last run and fall back to the last day of the target month when that
 * day does not exist there (31 January is followed by 28 or 29 February).
 */
public final class RecurrenceRule {

    private RecurrenceRule() {
    }

    public static Optional<LocalDateTime> computeNextRun(
        RecurrenceKind recurrence,
        AnchorTime anchor,
        LocalDateTime lastRun
    ) {
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        Objects.requireNonNull(anchor, "anchor must not be null");
        if (lastRun == null) {
            return Optional.of(anchor.start());
        }

        LocalDateTime aligned = anchor.alignTimeOfDay(lastRun);
        return switch (recurrence) {
            case ONE_TIME -> Optional.empty();
            case DAILY -> Optional.of(aligned.plusDays(1));
            case WEEKLY -> Optional.of(aligned.plusWeeks(1));
            // plusMonths clamps to the last valid day of the target month
            case MONTHLY -> Optional.of(aligned.plusMonths(1));
        };
    }

    public static boolean isDue(ScheduledJob job, LocalDateTime now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (job.recurrence() == RecurrenceKind.ONE_TIME && job.lastRun().isPresent()) {
            return false;
        }
        return job.nextRun()
            .map(next -> !now.isBefore(next))
            .orElse(false);
    }
}
