package com.premwatch.ingest.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable named parameters for one task invocation.
 */
public final class TaskParameters {

    private static final TaskParameters EMPTY = new TaskParameters(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private TaskParameters(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TaskParameters empty() {
        return EMPTY;
    }

    public static TaskParameters of(Map<String, ?> values) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                copy.put(name, value);
            }
        });
        return new TaskParameters(copy);
    }

    /**
     * Copy with one more parameter; a null value removes it.
     */
    public TaskParameters with(String name, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(name);
        } else {
            copy.put(name, value);
        }
        return new TaskParameters(copy);
    }

    /**
     * Copy with every parameter of {@code other} laid over this one.
     */
    public TaskParameters withAll(TaskParameters other) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new TaskParameters(copy);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    /**
     * Integer value, or null when absent.
     *
     * @throws IllegalArgumentException if the value is not a whole number
     */
    public Long getLong(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not an integer: " + value, e);
        }
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Flag value; absent means false.
     */
    public boolean getBoolean(String name) {
        Object value = values.get(name);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskParameters that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
