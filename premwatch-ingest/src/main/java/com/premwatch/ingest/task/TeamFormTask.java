package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Last 5/6/10 match form of a team.
 *
 * Every row of the response carries the team's id as {@code id}; it is stored as
 * {@code team_id} instead, so rows are appended rather than overwriting each other.
 */
class TeamFormTask extends AbstractIngestionTask {

    static final String TEAM_ID_FIELD = "team_id";

    TeamFormTask(RemoteDataSource source, RecordStore store) {
        super("team_form", "team_form", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.required(Params.TEAM_ID, ParameterType.INTEGER, "Team id"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getTeamRecentForm(requireLong(parameters, Params.TEAM_ID));
    }

    @Override
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        long teamId = requireLong(parameters, Params.TEAM_ID);
        return response.records().stream()
            .map(row -> {
                Object id = row.has(DataRecord.ID) ? row.get(DataRecord.ID) : teamId;
                return hoistStats(row.without(DataRecord.ID).with(TEAM_ID_FIELD, id));
            })
            .toList();
    }
}
