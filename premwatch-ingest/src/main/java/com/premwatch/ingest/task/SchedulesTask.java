package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Full season fixture list, stored alongside the daily matches.
 */
class SchedulesTask extends AbstractIngestionTask {

    SchedulesTask(RemoteDataSource source, RecordStore store) {
        super("schedules", "matches", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(Params.SEASON, Params.MAX_TIME_FILTER);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getSchedule(requireLong(parameters, Params.SEASON_ID), parameters.getLong(Params.MAX_TIME));
    }
}
