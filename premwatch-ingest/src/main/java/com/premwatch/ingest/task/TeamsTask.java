package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Teams of a season. With {@code stats}, the nested stats object is flattened into
 * {@code stats_<key>} columns.
 */
class TeamsTask extends AbstractIngestionTask {

    TeamsTask(RemoteDataSource source, RecordStore store) {
        super("teams", "teams", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(
            Params.SEASON,
            ParameterSpec.optional(Params.STATS, ParameterType.BOOLEAN, "Include detailed team stats"),
            Params.MAX_TIME_FILTER
        );
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getLeagueTeams(requireLong(parameters, Params.SEASON_ID),
            parameters.getBoolean(Params.STATS), parameters.getLong(Params.MAX_TIME));
    }

    @Override
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        List<DataRecord> records = response.records();
        if (!parameters.getBoolean(Params.STATS)) {
            return records;
        }
        return records.stream().map(AbstractIngestionTask::hoistStats).toList();
    }
}
