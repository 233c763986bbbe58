package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;

/**
 * Over 2.5 goals rankings across leagues. The API returns a single object, stored as one row per run.
 */
class Over25StatsTask extends AbstractIngestionTask {

    Over25StatsTask(RemoteDataSource source, RecordStore store) {
        super("over_25_stats", "over_25_stats", source, store);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getOver25Stats();
    }
}
