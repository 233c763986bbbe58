package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.HttpClientFactory;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Standings snapshot of a season: one row per season, replaced on every run.
 */
class LeagueTableTask extends AbstractIngestionTask {

    static final String TABLE_FIELD = "league_table";

    LeagueTableTask(RemoteDataSource source, RecordStore store) {
        super("league_table", "league_table", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(Params.SEASON, Params.MAX_TIME_FILTER);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getLeagueTable(requireLong(parameters, Params.SEASON_ID), parameters.getLong(Params.MAX_TIME));
    }

    @Override
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        long seasonId = requireLong(parameters, Params.SEASON_ID);
        if (response.data() != null && response.data().isArray()) {
            if (response.data().isEmpty()) {
                return List.of();
            }
            List<?> rows = HttpClientFactory.getMapper().convertValue(response.data(), List.class);
            return List.of(DataRecord.of(DataRecord.ID, seasonId, TABLE_FIELD, rows));
        }
        return response.records().stream()
            .map(snapshot -> snapshot.hasIdentity() ? snapshot : snapshot.with(DataRecord.ID, seasonId))
            .toList();
    }
}
