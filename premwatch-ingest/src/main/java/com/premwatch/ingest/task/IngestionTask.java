package com.premwatch.ingest.task;

import java.sql.SQLException;
import java.util.List;

/**
 * Fetches one resource type from the remote API and writes it to the record store.
 */
public interface IngestionTask {

    /**
     * Registry name, e.g. {@code "leagues"}.
     */
    String getName();

    /**
     * Table the task writes to.
     */
    String getTable();

    List<ParameterSpec> declareParameters();

    /**
     * Run the task once. Missing parameters and fetch failures are reported in the
     * outcome; storage failures propagate.
     *
     * @throws SQLException if a record could not be written
     */
    TaskOutcome execute(TaskParameters parameters) throws SQLException;
}
