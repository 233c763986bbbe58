package com.premwatch.ingest.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One flat-ish row headed for the store: field name to scalar or nested value.
 * Field order follows insertion order. Instances are immutable; the with* methods
 * return modified copies.
 */
public final class DataRecord {

    /** Field holding the durable identity of a resource. */
    public static final String ID = "id";

    private static final DataRecord EMPTY = new DataRecord(new LinkedHashMap<>());

    private final Map<String, Object> fields;

    private DataRecord(LinkedHashMap<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static DataRecord empty() {
        return EMPTY;
    }

    /**
     * Copy a map into a record, keeping its iteration order.
     */
    public static DataRecord of(Map<String, ?> fields) {
        return new DataRecord(new LinkedHashMap<>(fields));
    }

    /**
     * Convenience for tests and fixed records: alternating name/value pairs.
     */
    public static DataRecord of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        LinkedHashMap<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return new DataRecord(map);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * True when the record carries a non-null {@code id}, i.e. it should be upserted
     * rather than appended.
     */
    public boolean hasIdentity() {
        return fields.get(ID) != null;
    }

    public Object identity() {
        return fields.get(ID);
    }

    public DataRecord with(String name, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new DataRecord(copy);
    }

    public DataRecord without(String name) {
        if (!fields.containsKey(name)) {
            return this;
        }
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove(name);
        return new DataRecord(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataRecord other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "DataRecord" + fields;
    }
}
