package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.DataRecord;
import com.premwatch.ingest.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * League list, flattened to one row per season.
 *
 * The API nests seasons as {@code season: [{id, year}, ...]} under each league. Each
 * season becomes a row carrying the league's own fields, keyed by the season id and
 * with {@code season} set to the season's year.
 */
class LeaguesTask extends AbstractIngestionTask {

    private static final Logger log = LoggerFactory.getLogger(LeaguesTask.class);

    static final String SEASON = "season";

    LeaguesTask(RemoteDataSource source, RecordStore store) {
        super("leagues", "leagues", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(
            ParameterSpec.optional(Params.COUNTRY_ID, ParameterType.INTEGER, "Only leagues of this country"),
            ParameterSpec.optional(Params.CHOSEN_ONLY, ParameterType.BOOLEAN, "Only leagues chosen on the account")
        );
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getLeagues(parameters.getLong(Params.COUNTRY_ID), parameters.getBoolean(Params.CHOSEN_ONLY));
    }

    @Override
    protected List<DataRecord> normalize(ApiResponse response, TaskParameters parameters) {
        List<DataRecord> rows = new ArrayList<>();
        for (DataRecord league : response.records()) {
            if (!(league.get(SEASON) instanceof List<?> seasons)) {
                log.debug("League without seasons skipped: {}", league.get("name"));
                continue;
            }
            DataRecord base = league.without(SEASON);
            for (Object season : seasons) {
                if (season instanceof Map<?, ?> entry) {
                    rows.add(base
                        .with(DataRecord.ID, entry.get("id"))
                        .with(SEASON, entry.get("year")));
                }
            }
        }
        return rows;
    }
}
