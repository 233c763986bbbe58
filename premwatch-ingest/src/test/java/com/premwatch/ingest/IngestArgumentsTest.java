package com.premwatch.ingest;

import com.premwatch.ingest.task.IngestionTask;
import com.premwatch.ingest.task.Params;
import com.premwatch.ingest.task.StandardTasks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IngestArgumentsTest {

    private static final List<IngestionTask> TASKS = StandardTasks.catalog();

    private static IngestArguments parse(String... args) throws UsageException {
        return IngestArguments.parse(args, TASKS);
    }

    @Nested
    @DisplayName("Selectors")
    class SelectorTests {

        @Test
        @DisplayName("Should parse cascade mode")
        void parsesAll() throws UsageException {
            IngestArguments arguments = parse("data/footy.db", "--all");

            assertEquals(Path.of("data/footy.db"), arguments.getDbPath());
            assertEquals(IngestArguments.Mode.ALL, arguments.getMode());
        }

        @Test
        @DisplayName("Should collect task names up to the next option")
        void parsesTaskNames() throws UsageException {
            // When
            IngestArguments arguments = parse("footy.db", "--task", "teams", "players", "--season_id", "2012");

            // Then
            assertEquals(IngestArguments.Mode.TASKS, arguments.getMode());
            assertEquals(List.of("teams", "players"), arguments.getTaskNames());
            assertEquals(2012L, arguments.getParameters().getLong(Params.SEASON_ID));
        }

        @Test
        @DisplayName("Should take the database path from after the task names")
        void acceptsDbPathAfterTaskNames() throws UsageException {
            // When
            IngestArguments arguments = parse("--task", "countries", "leagues", "footy.db", "--country_id", "44");

            // Then
            assertEquals(Path.of("footy.db"), arguments.getDbPath());
            assertEquals(List.of("countries", "leagues"), arguments.getTaskNames());
            assertEquals(44L, arguments.getParameters().getLong(Params.COUNTRY_ID));
        }

        @Test
        @DisplayName("Should keep unregistered task names once the database path is known")
        void keepsUnknownNamesAfterDbPath() throws UsageException {
            // When
            IngestArguments arguments = parse("footy.db", "--task", "countries", "nonsense");

            // Then
            assertEquals(List.of("countries", "nonsense"), arguments.getTaskNames());
        }

        @Test
        @DisplayName("Should require exactly one selector")
        void requiresOneSelector() {
            assertThrows(UsageException.class, () -> parse("footy.db"));
            assertThrows(UsageException.class, () -> parse("footy.db", "--all", "--general"));
            assertThrows(UsageException.class, () -> parse("footy.db", "--task"));
        }

        @Test
        @DisplayName("Should require a database path")
        void requiresDbPath() {
            assertThrows(UsageException.class, () -> parse("--general"));
        }

        @Test
        @DisplayName("Should return help mode without other arguments")
        void helpMode() throws UsageException {
            assertEquals(IngestArguments.Mode.HELP, parse("--help").getMode());
        }
    }

    @Nested
    @DisplayName("Parameters")
    class ParameterTests {

        @Test
        @DisplayName("Should type parameters from task declarations")
        void typesParameters() throws UsageException {
            // When
            IngestArguments arguments = parse("footy.db", "--general",
                "--country_id", "44", "--chosen_only", "--date", "2024-08-17");

            // Then
            assertEquals(44L, arguments.getParameters().get(Params.COUNTRY_ID));
            assertEquals(Boolean.TRUE, arguments.getParameters().get(Params.CHOSEN_ONLY));
            assertEquals("2024-08-17", arguments.getParameters().getString(Params.DATE));
            assertFalse(arguments.getParameters().getBoolean(Params.STATS));
        }

        @Test
        @DisplayName("Should reject unknown options and malformed numbers")
        void rejectsBadOptions() {
            assertThrows(UsageException.class, () -> parse("footy.db", "--all", "--season", "1"));
            assertThrows(UsageException.class, () -> parse("footy.db", "--all", "--season_id", "abc"));
            assertThrows(UsageException.class, () -> parse("footy.db", "--all", "--max_time"));
        }

        @Test
        @DisplayName("Should list every task in the usage text")
        void usageListsTasks() {
            String usage = IngestArguments.usage(TASKS);

            for (IngestionTask task : TASKS) {
                assertTrue(usage.contains(task.getName()), task.getName());
            }
            assertTrue(usage.contains("--season_id"));
        }
    }
}
