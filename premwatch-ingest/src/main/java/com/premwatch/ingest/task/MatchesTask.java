package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Matches on one day, today by default.
 */
class MatchesTask extends AbstractIngestionTask {

    MatchesTask(RemoteDataSource source, RecordStore store) {
        super("matches", "matches", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.optional(Params.DATE, ParameterType.STRING, "Day in YYYY-MM-DD format"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getMatches(parameters.getString(Params.DATE));
    }
}
