package com.premwatch.ingest.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Schema-agnostic SQLite persistence for API records.
 *
 * Tables and columns are created on first sight of a record shape. Records with an
 * {@code id} are upserted (INSERT OR REPLACE, full-row overwrite); records without
 * one are appended. A schema change and the write that triggered it commit together.
 */
public class RecordStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    // Sorted keys so the same nested value always serializes to the same text
    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final SqliteConnection connection;

    // Committed schemas only; updated after each successful transaction
    private final Map<String, TableSchema> schemas = new ConcurrentHashMap<>();

    public RecordStore(SqliteConnection connection) throws SQLException {
        this.connection = connection;
        connection.executeInTransaction(SchemaCatalog::initialize);
    }

    /**
     * Open the database file and prepare the schema catalog.
     */
    public static RecordStore open(Path dbPath) throws SQLException {
        return new RecordStore(SqliteConnection.open(dbPath));
    }

    public SqliteConnection getConnection() {
        return connection;
    }

    // ==================== Schema ====================

    /**
     * Make sure {@code table} exists and has a column for every field of the sample.
     * Creates the table if needed, otherwise adds only the missing columns.
     * <p>
     * The identity column is fixed when the table is created. A sample without a
     * non-null {@code id} (including an empty one) gives an INTEGER surrogate key,
     * so later writes to that table must carry integer ids or none at all.
     */
    public TableSchema ensureSchema(String table, DataRecord sample) throws SQLException {
        SchemaCatalog.validateTableName(table);
        TableSchema schema = connection.executeInTransaction(c -> {
            return evolve(c, table, sample);
        });
        schemas.put(table, schema);
        return schema;
    }

    /**
     * Current schema of a table, empty if it has never been written.
     */
    public Optional<TableSchema> schema(String table) throws SQLException {
        SchemaCatalog.validateTableName(table);
        return committedSchema(connection.getConnection(), table);
    }

    private Optional<TableSchema> committedSchema(Connection c, String table) throws SQLException {
        TableSchema cached = schemas.get(table);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<TableSchema> loaded = SchemaCatalog.load(c, table);
        loaded.ifPresent(s -> schemas.put(table, s));
        return loaded;
    }

    private TableSchema evolve(Connection c, String table, DataRecord sample) throws SQLException {
        Optional<TableSchema> existing = committedSchema(c, table);
        if (existing.isEmpty()) {
            return createTable(c, table, sample);
        }

        TableSchema schema = existing.get();
        for (Map.Entry<String, Object> field : sample.fields().entrySet()) {
            String column = field.getKey();
            if (schema.hasColumn(column)) {
                continue;
            }
            SchemaCatalog.validateColumnName(column);
            ColumnKind kind = ColumnKind.of(field.getValue());
            try (Statement stmt = c.createStatement()) {
                stmt.execute("ALTER TABLE " + SchemaCatalog.quote(table)
                    + " ADD COLUMN " + SchemaCatalog.quote(column) + " " + kind.getStorageClass());
            }
            SchemaCatalog.recordColumn(c, table, column, kind);
            schema = schema.withColumn(column, kind);
            log.info("Column '{}' ({}) added to table '{}'", column, kind, table);
        }
        return schema;
    }

    private TableSchema createTable(Connection c, String table, DataRecord sample) throws SQLException {
        boolean naturalIdentity = sample.hasIdentity();
        ColumnKind identityKind = naturalIdentity ? ColumnKind.of(sample.identity()) : ColumnKind.INTEGER;

        LinkedHashMap<String, ColumnKind> columns = new LinkedHashMap<>();
        columns.put(DataRecord.ID, identityKind);
        TableSchema schema = new TableSchema(table, DataRecord.ID, !naturalIdentity, columns);
        for (Map.Entry<String, Object> field : sample.fields().entrySet()) {
            SchemaCatalog.validateColumnName(field.getKey());
            schema = schema.withColumn(field.getKey(), ColumnKind.of(field.getValue()));
        }

        List<String> definitions = new ArrayList<>();
        for (Map.Entry<String, ColumnKind> column : schema.getColumns().entrySet()) {
            String name = SchemaCatalog.quote(column.getKey());
            if (column.getKey().equals(DataRecord.ID)) {
                definitions.add(naturalIdentity
                    ? name + " " + identityKind.getStorageClass() + " PRIMARY KEY"
                    : name + " INTEGER PRIMARY KEY AUTOINCREMENT");
            } else {
                definitions.add(name + " " + column.getValue().getStorageClass());
            }
        }

        try (Statement stmt = c.createStatement()) {
            stmt.execute("CREATE TABLE " + SchemaCatalog.quote(table) + " (" + String.join(", ", definitions) + ")");
        }
        for (Map.Entry<String, ColumnKind> column : schema.getColumns().entrySet()) {
            SchemaCatalog.recordColumn(c, table, column.getKey(), column.getValue());
        }

        log.info("Table '{}' created with {} columns ({} identity)", table, schema.getColumns().size(),
            naturalIdentity ? "natural" : "surrogate");
        return schema;
    }

    // ==================== Writes ====================

    /**
     * Write one record. Evolves the schema first using the record as the sample.
     * With an {@code id} the existing row is replaced entirely; without one a new
     * row is appended.
     */
    public void upsert(String table, DataRecord record) throws SQLException {
        SchemaCatalog.validateTableName(table);
        TableSchema schema = connection.executeInTransaction(c -> {
            TableSchema evolved = evolve(c, table, record);
            write(c, evolved, record);
            return evolved;
        });
        schemas.put(table, schema);
    }

    /**
     * Write records in order. Each record is its own unit, so a failure leaves the
     * earlier records committed. Returns the number written.
     */
    public int upsertAll(String table, List<DataRecord> records) throws SQLException {
        int written = 0;
        for (DataRecord record : records) {
            upsert(table, record);
            written++;
        }
        return written;
    }

    private void write(Connection c, TableSchema schema, DataRecord record) throws SQLException {
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        // Column names are case-insensitive; the later of two colliding fields wins
        Map<String, Integer> positions = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            // A null identity means "let the store assign one"
            if (field.getValue() == null && field.getKey().equalsIgnoreCase(schema.getIdentityColumn())) {
                continue;
            }
            Integer position = positions.get(field.getKey());
            if (position != null) {
                log.warn("Field '{}' collides with '{}' in table '{}', keeping the later value",
                    field.getKey(), columns.get(position), schema.getTable());
                values.set(position, field.getValue());
                continue;
            }
            positions.put(field.getKey(), columns.size());
            columns.add(field.getKey());
            values.add(field.getValue());
        }

        String target = SchemaCatalog.quote(schema.getTable());
        if (columns.isEmpty()) {
            try (Statement stmt = c.createStatement()) {
                stmt.executeUpdate("INSERT INTO " + target + " DEFAULT VALUES");
            }
            return;
        }

        String sql = (record.hasIdentity() ? "INSERT OR REPLACE INTO " : "INSERT INTO ") + target
            + " (" + columns.stream().map(SchemaCatalog::quote).collect(Collectors.joining(", ")) + ")"
            + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            for (int i = 0; i < values.size(); i++) {
                bind(stmt, i + 1, values.get(i));
            }
            stmt.executeUpdate();
        }
    }

    private void bind(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.NULL);
        } else if (value instanceof Boolean b) {
            stmt.setInt(index, b ? 1 : 0);
        } else if (value instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                stmt.setLong(index, big.longValue());
            } else {
                stmt.setString(index, big.toString());
            }
        } else if (value instanceof BigDecimal decimal) {
            stmt.setDouble(index, decimal.doubleValue());
        } else if (value instanceof Double || value instanceof Float) {
            stmt.setDouble(index, ((Number) value).doubleValue());
        } else if (value instanceof Number number) {
            stmt.setLong(index, number.longValue());
        } else if (value instanceof String s) {
            stmt.setString(index, s);
        } else if (ColumnKind.of(value) == ColumnKind.STRUCTURED) {
            stmt.setString(index, toCanonicalJson(value));
        } else {
            stmt.setString(index, String.valueOf(value));
        }
    }

    /**
     * Canonical text form of a nested value: JSON with object keys sorted.
     */
    public static String toCanonicalJson(Object value) throws SQLException {
        try {
            return CANONICAL_JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot serialize nested value: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Reads ====================

    /**
     * Distinct non-null values of a column, in first-stored order.
     * A table (or column) that doesn't exist yet simply yields nothing.
     */
    public Set<Object> distinctIdentities(String table, String column) throws SQLException {
        SchemaCatalog.validateTableName(table);
        Connection c = connection.getConnection();

        Optional<TableSchema> schema = committedSchema(c, table);
        if (schema.isEmpty()) {
            log.debug("Table '{}' not found, no identities to return", table);
            return Collections.emptySet();
        }
        if (!schema.get().hasColumn(column)) {
            log.warn("Column '{}' not found in table '{}', no identities to return", column, table);
            return Collections.emptySet();
        }

        String col = SchemaCatalog.quote(column);
        String sql = "SELECT " + col + " FROM " + SchemaCatalog.quote(table)
            + " WHERE " + col + " IS NOT NULL GROUP BY " + col + " ORDER BY MIN(rowid)";

        Set<Object> values = new LinkedHashSet<>();
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                values.add(normalize(rs.getObject(1)));
            }
        }
        return Collections.unmodifiableSet(values);
    }

    /**
     * Number of rows in a table, 0 if it doesn't exist.
     */
    public long count(String table) throws SQLException {
        SchemaCatalog.validateTableName(table);
        Connection c = connection.getConnection();
        if (committedSchema(c, table).isEmpty()) {
            return 0;
        }
        try (Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + SchemaCatalog.quote(table))) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    /**
     * Read a row back by identity. Nested values come back as their JSON text.
     */
    public Optional<DataRecord> findById(String table, Object id) throws SQLException {
        SchemaCatalog.validateTableName(table);
        Connection c = connection.getConnection();
        Optional<TableSchema> schema = committedSchema(c, table);
        if (schema.isEmpty()) {
            return Optional.empty();
        }

        String sql = "SELECT * FROM " + SchemaCatalog.quote(table)
            + " WHERE " + SchemaCatalog.quote(schema.get().getIdentityColumn()) + " = ?";
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            bind(stmt, 1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ResultSetMetaData meta = rs.getMetaData();
                LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    fields.put(meta.getColumnName(i), normalize(rs.getObject(i)));
                }
                return Optional.of(DataRecord.of(fields));
            }
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return value;
    }

    /**
     * Release the connection. Safe to call more than once.
     */
    @Override
    public void close() {
        connection.close();
        schemas.clear();
    }

    public boolean isClosed() {
        return connection.isClosed();
    }
}
