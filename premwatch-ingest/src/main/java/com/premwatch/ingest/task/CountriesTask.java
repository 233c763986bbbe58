package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;

class CountriesTask extends AbstractIngestionTask {

    CountriesTask(RemoteDataSource source, RecordStore store) {
        super("countries", "countries", source, store);
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getCountries();
    }
}
