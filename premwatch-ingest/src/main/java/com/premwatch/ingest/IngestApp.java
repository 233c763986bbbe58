package com.premwatch.ingest;

import com.premwatch.ingest.config.IngestConfig;
import com.premwatch.ingest.orchestrator.CascadePlan;
import com.premwatch.ingest.orchestrator.Orchestrator;
import com.premwatch.ingest.orchestrator.RunSummary;
import com.premwatch.ingest.orchestrator.TaskRegistry;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.source.footystats.FootyStatsClient;
import com.premwatch.ingest.store.RecordStore;
import com.premwatch.ingest.task.IngestionTask;
import com.premwatch.ingest.task.StandardTasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * PremWatch ingest - loads FootyStats data into a local SQLite database.
 *
 * Exit status: 0 when the run completed (even with failed invocations),
 * 1 when configuration or the database is unusable, 2 on a bad command line.
 */
public class IngestApp {
    private static final Logger LOG = LoggerFactory.getLogger(IngestApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        List<IngestionTask> catalog = StandardTasks.catalog();

        IngestArguments arguments;
        try {
            arguments = IngestArguments.parse(args, catalog);
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.println();
            System.err.print(IngestArguments.usage(catalog));
            return EXIT_USAGE;
        }
        if (arguments.getMode() == IngestArguments.Mode.HELP) {
            System.out.print(IngestArguments.usage(catalog));
            return EXIT_OK;
        }

        IngestConfig config;
        try {
            config = IngestConfig.load();
            config.validate();
        } catch (IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FATAL;
        }
        LOG.info("Starting PremWatch ingest: {} into {}", arguments.getMode(), arguments.getDbPath());
        LOG.debug("Configuration: {}", config);

        RecordStore store;
        try {
            store = RecordStore.open(arguments.getDbPath());
        } catch (SQLException e) {
            LOG.error("Failed to open database {}", arguments.getDbPath(), e);
            return EXIT_FATAL;
        }

        try {
            RemoteDataSource source = new FootyStatsClient(config);
            TaskRegistry registry = TaskRegistry.standard(source, store);
            Orchestrator orchestrator = new Orchestrator(registry, CascadePlan.standard(), store);

            RunSummary summary = switch (arguments.getMode()) {
                case ALL -> orchestrator.runCascade(arguments.getParameters());
                case GENERAL -> orchestrator.runGeneral(arguments.getParameters());
                case TASKS -> orchestrator.runTasks(arguments.getTaskNames(), arguments.getParameters());
                case HELP -> throw new IllegalStateException("Help handled above");
            };
            logSummary(summary);
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.error("Ingest run aborted", e);
            return EXIT_FATAL;
        } finally {
            store.close();
        }
    }

    private static void logSummary(RunSummary summary) {
        for (RunSummary.TaskTally tally : summary.tasks()) {
            LOG.info("{}: {} runs, {} loaded, {} no data, {} skipped, {} failed, {} records",
                tally.task(), tally.invocations(), tally.loaded(), tally.noData(),
                tally.skipped(), tally.failed(), tally.recordsWritten());
        }
        if (!summary.unknownTasks().isEmpty()) {
            LOG.warn("Unknown tasks ignored: {}", summary.unknownTasks());
        }
        LOG.info("Finished in {}s: {} records written", summary.elapsed().getSeconds(), summary.totalRecords());
    }
}
