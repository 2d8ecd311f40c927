package io.jobs4j.core;

import java.time.Instant;

/**
 * Postmortem of a schedule whose job could not be resolved, constructed, initialized or registered.
 */
public record ScheduleFailure(
        String scheduleIdentifier,
        ScheduleRecord record,
        Instant failedAt,
        String errorType,
        String message
) {

    public static ScheduleFailure of(ScheduleRecord record, Exception error) {
        return new ScheduleFailure(
                record.scheduleIdentifier(),
                record,
                Instant.now(),
                error.getClass().getName(),
                error.getMessage()
        );
    }
}
