package com.premwatch.ingest.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads and records table layouts. Column kinds chosen at first write are kept
 * in the {@code schema_columns} table so they are never inferred twice.
 */
final class SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    static final String CATALOG_TABLE = "schema_columns";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private SchemaCatalog() {
    }

    /**
     * Create the catalog table if it doesn't exist.
     */
    static void initialize(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_columns (
                    table_name TEXT NOT NULL,
                    column_name TEXT NOT NULL,
                    kind TEXT NOT NULL,
                    added_at INTEGER NOT NULL,
                    PRIMARY KEY (table_name, column_name)
                )
                """);
        }
    }

    /**
     * Reject names that can't be used as a resource table.
     */
    static void validateTableName(String table) throws SQLException {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new SQLException("Invalid table name: " + table);
        }
        String lower = table.toLowerCase(Locale.ROOT);
        if (lower.equals(CATALOG_TABLE) || lower.startsWith("sqlite_")) {
            throw new SQLException("Reserved table name: " + table);
        }
    }

    static void validateColumnName(String column) throws SQLException {
        if (column == null || column.isEmpty()) {
            throw new SQLException("Invalid column name: empty");
        }
    }

    /**
     * Quote an identifier for use in SQL, doubling embedded quotes.
     */
    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Load the current schema of a table from SQLite plus the recorded kinds.
     * Empty if the table does not exist.
     */
    static Optional<TableSchema> load(Connection conn, String table) throws SQLException {
        String createSql = null;
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                createSql = rs.getString(1);
            }
        }

        Map<String, ColumnKind> recorded = recordedKinds(conn, table);
        LinkedHashMap<String, ColumnKind> columns = new LinkedHashMap<>();
        String identityColumn = null;

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
            while (rs.next()) {
                String name = rs.getString("name");
                String declaredType = rs.getString("type");
                ColumnKind kind = recorded.get(name);
                if (kind == null) {
                    kind = ColumnKind.fromDeclaredType(declaredType);
                }
                columns.put(name, kind);
                if (rs.getInt("pk") > 0 && identityColumn == null) {
                    identityColumn = name;
                }
            }
        }

        boolean surrogate = createSql != null && createSql.toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");
        return Optional.of(new TableSchema(table, identityColumn != null ? identityColumn : DataRecord.ID,
            surrogate, columns));
    }

    /**
     * Remember the kind chosen for a newly created column.
     */
    static void recordColumn(Connection conn, String table, String column, ColumnKind kind) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR IGNORE INTO schema_columns (table_name, column_name, kind, added_at) VALUES (?, ?, ?, ?)")) {
            stmt.setString(1, table);
            stmt.setString(2, column);
            stmt.setString(3, kind.name());
            stmt.setLong(4, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static Map<String, ColumnKind> recordedKinds(Connection conn, String table) throws SQLException {
        Map<String, ColumnKind> kinds = new HashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT column_name, kind FROM schema_columns WHERE table_name = ?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    try {
                        kinds.put(rs.getString(1), ColumnKind.valueOf(rs.getString(2)));
                    } catch (IllegalArgumentException e) {
                        log.warn("Unknown column kind '{}' recorded for {}.{}, using declared type",
                            rs.getString(2), table, rs.getString(1));
                    }
                }
            }
        }
        return kinds;
    }
}
