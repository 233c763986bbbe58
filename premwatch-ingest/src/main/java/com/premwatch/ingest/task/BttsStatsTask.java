package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;

/**
 * Both-teams-to-score rankings across leagues. The API returns a single object, stored as one row per run.
 */
class BttsStatsTask extends AbstractIngestionTask {

    BttsStatsTask(RemoteDataSource source, RecordStore store) {
        super("btts_stats", "btts_stats", source, store);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getBttsStats();
    }
}
