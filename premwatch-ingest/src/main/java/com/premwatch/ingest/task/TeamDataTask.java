package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Single team lookup. Writes into the teams table with stats always flattened.
 */
class TeamDataTask extends AbstractIngestionTask {

    TeamDataTask(RemoteDataSource source, RecordStore store) {
        super("team_data", "teams", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.required(Params.TEAM_ID, ParameterType.INTEGER, "Team id"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getTeam(requireLong(parameters, Params.TEAM_ID));
    }

    @Override
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        return response.records().stream().map(AbstractIngestionTask::hoistStats).toList();
    }
}
