package io.jobs4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable export of a manager's schedule table:
 * {@code { identifiers: [...], data: { "<target ns>": { "<schedule id>": record } } }}.
 * The postmortem bucket {@code "0"} is never part of a snapshot.
 */
public record ScheduleSnapshot(
        @JsonProperty("identifiers") List<String> identifiers,
        @JsonProperty("data") Map<String, Map<String, ScheduleRecord>> data
) {

    public ScheduleSnapshot {
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
        if (data == null) {
            data = Map.of();
        } else {
            Map<String, Map<String, ScheduleRecord>> copy = new LinkedHashMap<>();
            data.forEach((ts, bucket) -> copy.put(ts, Collections.unmodifiableMap(new LinkedHashMap<>(bucket))));
            data = Collections.unmodifiableMap(copy);
        }
    }

    public static ScheduleSnapshot empty() {
        return new ScheduleSnapshot(List.of(), Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return identifiers.isEmpty();
    }

    public int size() {
        return identifiers.size();
    }
}
