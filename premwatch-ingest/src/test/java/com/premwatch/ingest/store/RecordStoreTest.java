package com.premwatch.ingest.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RecordStore against a real SQLite file.
 */
class RecordStoreTest {

    @TempDir
    Path tempDir;

    private RecordStore store;

    @BeforeEach
    void setUp() throws SQLException {
        store = RecordStore.open(tempDir.resolve("test.db"));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Schema Evolution")
    class SchemaEvolutionTests {

        @Test
        @DisplayName("Should create table with natural identity from sample id")
        void createsTableWithNaturalIdentity() throws SQLException {
            // When
            TableSchema schema = store.ensureSchema("countries", DataRecord.of("id", 1L, "name", "England"));

            // Then
            assertEquals(Set.of("id", "name"), Set.copyOf(schema.getColumnNames()));
            assertFalse(schema.isSurrogateIdentity());
            assertEquals(ColumnKind.INTEGER, schema.kindOf("id").orElseThrow());
            assertEquals(ColumnKind.TEXT, schema.kindOf("name").orElseThrow());
        }

        @Test
        @DisplayName("Should create surrogate identity when sample has no id")
        void createsSurrogateIdentity() throws SQLException {
            // When
            TableSchema schema = store.ensureSchema("btts_stats", DataRecord.of("title", "BTTS"));

            // Then
            assertTrue(schema.isSurrogateIdentity());
            assertTrue(schema.hasColumn("id"));
            assertTrue(schema.hasColumn("title"));
        }

        @Test
        @DisplayName("Should be idempotent for identical sample shapes")
        void ensureSchemaIsIdempotent() throws SQLException {
            // Given
            DataRecord sample = DataRecord.of("id", 1L, "name", "A", "rating", 1.5);

            // When
            TableSchema first = store.ensureSchema("teams", sample);
            TableSchema second = store.ensureSchema("teams", sample);

            // Then
            assertEquals(first.getColumns(), second.getColumns());
            assertEquals(3, second.getColumns().size());
        }

        @Test
        @DisplayName("Should grow columns to the union of all keys seen")
        void columnsOnlyGrow() throws SQLException {
            // Given
            store.upsert("teams", DataRecord.of("id", 1L, "name", "A"));
            store.upsert("teams", DataRecord.of("id", 2L, "founded", 1880L));
            store.upsert("teams", DataRecord.of("id", 3L));

            // When
            TableSchema schema = store.schema("teams").orElseThrow();

            // Then
            assertEquals(Set.of("id", "name", "founded"), Set.copyOf(schema.getColumnNames()));
        }

        @Test
        @DisplayName("Should match existing columns case-insensitively")
        void matchesColumnsCaseInsensitively() throws SQLException {
            // Given
            store.ensureSchema("teams", DataRecord.of("id", 1L, "Name", "A"));

            // When
            TableSchema schema = store.ensureSchema("teams", DataRecord.of("id", 1L, "name", "B"));

            // Then
            assertEquals(2, schema.getColumns().size());
        }

        @Test
        @DisplayName("Should create table from an empty sample")
        void emptySampleCreatesTable() throws SQLException {
            // When
            store.ensureSchema("league_stats", DataRecord.empty());

            // Then
            assertTrue(store.schema("league_stats").isPresent());
            assertEquals(0, store.count("league_stats"));
        }

        @Test
        @DisplayName("Should give an empty sample an integer surrogate identity")
        void emptySampleFixesIntegerIdentity() throws SQLException {
            // Given
            TableSchema schema = store.ensureSchema("league_stats", DataRecord.empty());

            // When
            store.upsert("league_stats", DataRecord.of("id", 7L, "name", "EPL"));

            // Then
            assertTrue(schema.isSurrogateIdentity());
            assertEquals(ColumnKind.INTEGER, schema.kindOf("id").orElseThrow());
            assertEquals("EPL", store.findById("league_stats", 7L).orElseThrow().get("name"));
            assertThrows(SQLException.class, () -> store.upsert("league_stats", DataRecord.of("id", "abc")));
        }

        @Test
        @DisplayName("Should drop a new column when the write that added it fails")
        void failedWriteRollsBackNewColumn() throws SQLException {
            // Given
            store.upsert("teams", DataRecord.of("id", 1L, "a", 1L));

            // When
            assertThrows(SQLException.class, () -> store.upsert("teams", DataRecord.of("id", "abc", "fresh", 1L)));

            // Then
            assertFalse(store.schema("teams").orElseThrow().hasColumn("fresh"));

            store.close();
            store = RecordStore.open(tempDir.resolve("test.db"));
            assertEquals(Set.of("id", "a"), Set.copyOf(store.schema("teams").orElseThrow().getColumnNames()));

            store.upsert("teams", DataRecord.of("id", 2L, "fresh", 5L));
            assertTrue(store.schema("teams").orElseThrow().hasColumn("fresh"));
            assertEquals(5L, store.findById("teams", 2L).orElseThrow().get("fresh"));
        }

        @Test
        @DisplayName("Should keep the later value of fields differing only in case")
        void mergesFieldsDifferingInCase() throws SQLException {
            // When
            store.upsert("teams", DataRecord.of("id", 1L, "Name", "a", "name", "b"));
            store.upsert("teams", DataRecord.of("id", 2L, "Short", "x", "short", "y"));

            // Then
            TableSchema schema = store.schema("teams").orElseThrow();
            assertEquals(Set.of("id", "Name", "Short"), Set.copyOf(schema.getColumnNames()));
            assertEquals("b", store.findById("teams", 1L).orElseThrow().get("Name"));
            assertEquals("y", store.findById("teams", 2L).orElseThrow().get("Short"));
        }

        @Test
        @DisplayName("Should keep the first storage class of a column")
        void storageClassDecidedOnce() throws SQLException {
            // Given
            store.upsert("players", DataRecord.of("id", 1L, "age", 25L));

            // When
            store.upsert("players", DataRecord.of("id", 2L, "age", "unknown"));

            // Then
            assertEquals(ColumnKind.INTEGER, store.schema("players").orElseThrow().kindOf("age").orElseThrow());
            assertEquals("unknown", store.findById("players", 2L).orElseThrow().get("age"));
        }

        @Test
        @DisplayName("Should reload recorded kinds after reopening the database")
        void recordedKindsSurviveReopen() throws SQLException {
            // Given
            store.upsert("teams", DataRecord.of("id", 1L, "stats", Map.of("wins", 3)));
            store.close();

            // When
            store = RecordStore.open(tempDir.resolve("test.db"));
            TableSchema schema = store.schema("teams").orElseThrow();

            // Then
            assertEquals(ColumnKind.STRUCTURED, schema.kindOf("stats").orElseThrow());
            assertFalse(schema.isSurrogateIdentity());
        }

        @Test
        @DisplayName("Should reject invalid and reserved table names")
        void rejectsInvalidTableNames() {
            assertThrows(SQLException.class, () -> store.upsert("bad name", DataRecord.of("id", 1L)));
            assertThrows(SQLException.class, () -> store.upsert("schema_columns", DataRecord.of("id", 1L)));
            assertThrows(SQLException.class, () -> store.upsert("sqlite_master", DataRecord.of("id", 1L)));
        }

        @Test
        @DisplayName("Should accept column names that need quoting")
        void quotesUnusualColumnNames() throws SQLException {
            // When
            store.upsert("matches", DataRecord.of("id", 7L, "team a\"name", "X", "2h goals", 3L));

            // Then
            DataRecord row = store.findById("matches", 7L).orElseThrow();
            assertEquals("X", row.get("team a\"name"));
            assertEquals(3L, row.get("2h goals"));
        }
    }

    @Nested
    @DisplayName("Upsert")
    class UpsertTests {

        @Test
        @DisplayName("Should replace an existing row with the same id")
        void upsertReplacesById() throws SQLException {
            // Given
            store.upsert("leagues", DataRecord.of("id", 5L, "name", "A"));

            // When
            store.upsert("leagues", DataRecord.of("id", 5L, "name", "B", "extra", 1L));

            // Then
            assertEquals(1, store.count("leagues"));
            DataRecord row = store.findById("leagues", 5L).orElseThrow();
            assertEquals("B", row.get("name"));
            assertEquals(1L, row.get("extra"));
        }

        @Test
        @DisplayName("Should null out fields omitted by a later write")
        void replaceIsNotPartial() throws SQLException {
            // Given
            store.upsert("leagues", DataRecord.of("id", 5L, "name", "A", "country", "England"));

            // When
            store.upsert("leagues", DataRecord.of("id", 5L, "name", "B"));

            // Then
            assertNull(store.findById("leagues", 5L).orElseThrow().get("country"));
        }

        @Test
        @DisplayName("Should append every record without id")
        void appendsWithoutIdentity() throws SQLException {
            // Given
            DataRecord row = DataRecord.of("title", "Over 2.5", "value", 0.61);

            // When
            int written = store.upsertAll("over_25_stats", List.of(row, row, row));

            // Then
            assertEquals(3, written);
            assertEquals(3, store.count("over_25_stats"));
        }

        @Test
        @DisplayName("Should treat a null id as no identity")
        void nullIdAppends() throws SQLException {
            // Given
            java.util.LinkedHashMap<String, Object> fields = new java.util.LinkedHashMap<>();
            fields.put("id", null);
            fields.put("name", "x");

            // When
            store.upsert("referees", DataRecord.of(fields));
            store.upsert("referees", DataRecord.of(fields));

            // Then
            assertEquals(2, store.count("referees"));
        }

        @Test
        @DisplayName("Should store nested values as canonical JSON")
        void storesNestedValuesAsCanonicalJson() throws SQLException {
            // Given
            Map<String, Object> stats = new java.util.LinkedHashMap<>();
            stats.put("wins", 3);
            stats.put("draws", 1);

            // When
            store.upsert("teams", DataRecord.of("id", 1L, "stats", stats, "form", List.of("W", "D")));

            // Then
            DataRecord row = store.findById("teams", 1L).orElseThrow();
            assertEquals("{\"draws\":1,\"wins\":3}", row.get("stats"));
            assertEquals("[\"W\",\"D\"]", row.get("form"));
        }

        @Test
        @DisplayName("Should store booleans as integers and doubles as reals")
        void bindsScalarTypes() throws SQLException {
            // When
            store.upsert("matches", DataRecord.of("id", 1L, "finished", true, "xg", 1.25));

            // Then
            DataRecord row = store.findById("matches", 1L).orElseThrow();
            assertEquals(1L, row.get("finished"));
            assertEquals(1.25, ((Number) row.get("xg")).doubleValue(), 1e-9);
        }

        @Test
        @DisplayName("Should fail after close")
        void failsAfterClose() {
            // Given
            store.close();

            // Then
            assertTrue(store.isClosed());
            assertThrows(SQLException.class, () -> store.upsert("teams", DataRecord.of("id", 1L)));
            store.close();
        }
    }

    @Nested
    @DisplayName("Identity Reads")
    class IdentityReadTests {

        @Test
        @DisplayName("Should return empty set for a table that was never created")
        void missingTableYieldsEmptySet() throws SQLException {
            assertTrue(store.distinctIdentities("players", "id").isEmpty());
            assertEquals(0, store.count("players"));
        }

        @Test
        @DisplayName("Should return empty set for a missing column")
        void missingColumnYieldsEmptySet() throws SQLException {
            // Given
            store.upsert("players", DataRecord.of("id", 1L));

            // Then
            assertTrue(store.distinctIdentities("players", "team_id").isEmpty());
        }

        @Test
        @DisplayName("Should return distinct non-null values")
        void returnsDistinctNonNullValues() throws SQLException {
            // Given
            store.upsert("team_form", DataRecord.of("team_id", 9L, "last_x", 5L));
            store.upsert("team_form", DataRecord.of("team_id", 4L, "last_x", 5L));
            store.upsert("team_form", DataRecord.of("team_id", 9L, "last_x", 10L));
            store.upsert("team_form", DataRecord.of("last_x", 6L));

            // When
            Set<Object> ids = store.distinctIdentities("team_form", "team_id");

            // Then
            assertEquals(List.of(9L, 4L), List.copyOf(ids));
        }
    }
}
