package com.premwatch.ingest.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Snapshot of a table's columns and their kinds, in creation order.
 * Schemas only grow: {@link #withColumn} returns a copy with one more column.
 * Column lookups are case-insensitive, matching SQLite.
 */
public final class TableSchema {

    private final String table;
    private final String identityColumn;
    private final boolean surrogateIdentity;
    private final Map<String, ColumnKind> columns;
    private final Map<String, String> canonicalNames;

    TableSchema(String table, String identityColumn, boolean surrogateIdentity, Map<String, ColumnKind> columns) {
        this.table = table;
        this.identityColumn = identityColumn;
        this.surrogateIdentity = surrogateIdentity;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        TreeMap<String, String> names = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : columns.keySet()) {
            names.putIfAbsent(name, name);
        }
        this.canonicalNames = names;
    }

    public String getTable() {
        return table;
    }

    /**
     * Name of the primary key column, normally {@code id}.
     */
    public String getIdentityColumn() {
        return identityColumn;
    }

    /**
     * True when the identity is store-generated (AUTOINCREMENT) rather than taken
     * from the first record's {@code id}.
     */
    public boolean isSurrogateIdentity() {
        return surrogateIdentity;
    }

    /**
     * All columns including the identity column, in creation order.
     */
    public Map<String, ColumnKind> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return canonicalNames.containsKey(name);
    }

    public Optional<ColumnKind> kindOf(String name) {
        String canonical = canonicalNames.get(name);
        return canonical == null ? Optional.empty() : Optional.of(columns.get(canonical));
    }

    TableSchema withColumn(String name, ColumnKind kind) {
        if (hasColumn(name)) {
            return this;
        }
        LinkedHashMap<String, ColumnKind> copy = new LinkedHashMap<>(columns);
        copy.put(name, kind);
        return new TableSchema(table, identityColumn, surrogateIdentity, copy);
    }

    @Override
    public String toString() {
        return "TableSchema{" + table + ", identity=" + identityColumn
            + (surrogateIdentity ? " (surrogate)" : "") + ", columns=" + columns + "}";
    }
}
