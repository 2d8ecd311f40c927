package io.jobs4j.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Constructor arguments for a job: positional values plus named values.
 *
 * <p>Arguments of scheduled jobs survive a persistence round-trip as plain JSON values, so job
 * constructors read them through {@link #get(int, Class)} / {@link #get(String, Class)}, which
 * convert the stored value into the requested type.
 */
public record JobArguments(
        @JsonProperty("args") List<Object> args,
        @JsonProperty("kwargs") Map<String, Object> kwargs
) {

    private static final ObjectMapper CONVERTER = JsonMapper.builder().findAndAddModules().build();

    private static final JobArguments EMPTY = new JobArguments(List.of(), Map.of());

    @JsonCreator
    public JobArguments {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static JobArguments empty() {
        return EMPTY;
    }

    public static JobArguments of(Object... args) {
        return new JobArguments(Arrays.asList(args), Map.of());
    }

    public static JobArguments named(Map<String, Object> kwargs) {
        return new JobArguments(List.of(), kwargs);
    }

    public JobArguments with(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(kwargs);
        copy.put(name, value);
        return new JobArguments(args, copy);
    }

    public boolean isEmpty() {
        return args.isEmpty() && kwargs.isEmpty();
    }

    public <T> T get(int index, Class<T> type) {
        if (index < 0 || index >= args.size()) {
            throw new IndexOutOfBoundsException("no positional job argument at index " + index);
        }
        return convert(args.get(index), type);
    }

    public <T> T get(String name, Class<T> type) {
        return convert(kwargs.get(name), type);
    }

    public <T> T getOrDefault(String name, Class<T> type, T defaultValue) {
        return kwargs.containsKey(name) ? convert(kwargs.get(name), type) : defaultValue;
    }

    private static <T> T convert(Object raw, Class<T> type) {
        if (raw == null) {
            return null;
        }
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        return CONVERTER.convertValue(raw, type);
    }
}
