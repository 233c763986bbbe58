package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

class LeagueStatsTask extends AbstractIngestionTask {

    LeagueStatsTask(RemoteDataSource source, RecordStore store) {
        super("league_stats", "league_stats", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(Params.SEASON, Params.MAX_TIME_FILTER);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getLeagueStats(requireLong(parameters, Params.SEASON_ID), parameters.getLong(Params.MAX_TIME));
    }
}
