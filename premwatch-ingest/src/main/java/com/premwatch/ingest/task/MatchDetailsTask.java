package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

class MatchDetailsTask extends AbstractIngestionTask {

    MatchDetailsTask(RemoteDataSource source, RecordStore store) {
        super("match_details", "match_details", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.required(Params.MATCH_ID, ParameterType.INTEGER, "Match id"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getMatchDetails(requireLong(parameters, Params.MATCH_ID));
    }
}
