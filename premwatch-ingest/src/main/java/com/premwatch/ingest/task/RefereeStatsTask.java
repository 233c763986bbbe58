package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

class RefereeStatsTask extends AbstractIngestionTask {

    RefereeStatsTask(RemoteDataSource source, RecordStore store) {
        super("referee_stats", "referees", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.required(Params.REFEREE_ID, ParameterType.INTEGER, "Referee id"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getRefereeStats(requireLong(parameters, Params.REFEREE_ID));
    }
}
