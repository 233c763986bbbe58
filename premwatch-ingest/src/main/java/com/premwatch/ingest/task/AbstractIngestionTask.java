package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetch, normalize and persist. Subclasses supply the remote call and, where the
 * payload needs reshaping, the normalization step.
 */
public abstract class AbstractIngestionTask implements IngestionTask {

    private static final Logger log = LoggerFactory.getLogger(AbstractIngestionTask.class);

    static final String STATS_FIELD = "stats";
    static final String STATS_PREFIX = "stats_";

    protected final RemoteDataSource source;
    protected final RecordStore store;

    private final String name;
    private final String table;

    protected AbstractIngestionTask(String name, String table, RemoteDataSource source, RecordStore store) {
        this.name = name;
        this.table = table;
        this.source = source;
        this.store = store;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getTable() {
        return table;
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of();
    }

    @Override
    public final TaskOutcome execute(TaskParameters parameters) throws SQLException {
        ApiResponse response;
        try {
            checkRequired(parameters);
            log.info("Updating {} ({})", name, parameters);
            response = fetch(parameters);
        } catch (MissingParameterException e) {
            log.warn("Skipping {}: {}", name, e.getMessage());
            return TaskOutcome.skipped(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {}: {}", name, e.getMessage());
            return TaskOutcome.skipped(e.getMessage());
        } catch (IOException e) {
            log.warn("Could not fetch {} ({}): {}", name, parameters, e.getMessage());
            return TaskOutcome.noData("Fetch failed: " + e.getMessage());
        }

        List<DataRecord> records = normalize(response, parameters);
        if (records.isEmpty()) {
            log.warn("No {} data returned ({})", name, parameters);
            return TaskOutcome.noData("No data returned");
        }

        int written = store.upsertAll(table, records);
        log.info("{} update complete: {} records into {}", name, written, table);
        return TaskOutcome.loaded(written);
    }

    /**
     * Call the remote API for this resource.
     */
    protected abstract ApiResponse fetch(TaskParameters parameters) throws IOException;

    /**
     * Turn the response into the records to store. Default: one record per data object.
     */
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        return response.records();
    }

    private void checkRequired(TaskParameters parameters) {
        for (ParameterSpec spec : declareParameters()) {
            if (spec.required() && !parameters.has(spec.name())) {
                throw new MissingParameterException(name, spec.name());
            }
        }
    }

    protected long requireLong(TaskParameters parameters, String parameter) {
        Long value = parameters.getLong(parameter);
        if (value == null) {
            throw new MissingParameterException(name, parameter);
        }
        return value;
    }

    /**
     * Replace a nested {@code stats} object with flat {@code stats_<key>} fields.
     * Records without a stats object are returned unchanged.
     */
    static DataRecord hoistStats(DataRecord record) {
        if (!(record.get(STATS_FIELD) instanceof Map<?, ?> stats)) {
            return record;
        }
        Map<String, Object> fields = new LinkedHashMap<>(record.without(STATS_FIELD).fields());
        for (Map.Entry<?, ?> entry : stats.entrySet()) {
            fields.put(STATS_PREFIX + entry.getKey(), entry.getValue());
        }
        return DataRecord.of(fields);
    }
}
