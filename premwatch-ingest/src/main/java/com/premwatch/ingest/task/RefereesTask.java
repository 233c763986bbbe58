package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

class RefereesTask extends AbstractIngestionTask {

    RefereesTask(RemoteDataSource source, RecordStore store) {
        super("referees", "referees", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(Params.SEASON, Params.MAX_TIME_FILTER);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getLeagueReferees(requireLong(parameters, Params.SEASON_ID), parameters.getLong(Params.MAX_TIME));
    }
}
