package io.jobs4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A persisted description of a future, possibly recurring, job instantiation.
 *
 * <p>Timestamps are nanoseconds since the epoch. {@code recurInterval} is {@code 0} for a
 * one-shot schedule, otherwise an interval in nanoseconds. {@code maxRecurrences} of {@code -1} means unlimited.
 */
public record ScheduleRecord(
        @JsonProperty("schedule_identifier") String scheduleIdentifier,
        @JsonProperty("schedule_creator_identifier") String scheduleCreatorIdentifier,
        @JsonProperty("schedule_timestamp") long scheduleTimestamp,
        @JsonProperty("target_timestamp") long targetTimestamp,
        @JsonProperty("recur_interval") long recurInterval,
        @JsonProperty("occurrences") int occurrences,
        @JsonProperty("max_recurrences") int maxRecurrences,
        @JsonProperty("class_uuid") String classUuid,
        @JsonProperty("job_args") List<Object> jobArgs,
        @JsonProperty("job_kwargs") Map<String, Object> jobKwargs
) {

    public static final long NO_RECURRENCE = 0L;
    public static final int UNLIMITED = -1;

    public ScheduleRecord {
        jobArgs = jobArgs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(jobArgs));
        jobKwargs = jobKwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(jobKwargs));
    }

    @JsonIgnore
    public boolean isRecurring() {
        return recurInterval != NO_RECURRENCE;
    }

    public JobArguments arguments() {
        return new JobArguments(jobArgs, jobKwargs);
    }

    public ScheduleRecord withOccurrences(int occurrences) {
        return new ScheduleRecord(scheduleIdentifier, scheduleCreatorIdentifier, scheduleTimestamp,
                targetTimestamp, recurInterval, occurrences, maxRecurrences, classUuid, jobArgs, jobKwargs);
    }

    /**
     * Whether another occurrence may run after {@code occurrences} have already run.
     */
    public boolean hasRemainingOccurrences() {
        if (!isRecurring()) {
            return occurrences == 0;
        }
        return maxRecurrences == UNLIMITED || occurrences < maxRecurrences;
    }
}
