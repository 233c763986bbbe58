package com.premwatch.ingest.task;

import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.io.IOException;
import java.util.List;

/**
 * Career stats of one player, merged into the players table by player id.
 */
class PlayerStatsTask extends AbstractIngestionTask {

    PlayerStatsTask(RemoteDataSource source, RecordStore store) {
        super("player_stats", "players", source, store);
    }

    @Override
    public List<ParameterSpec> declareParameters() {
        return List.of(ParameterSpec.required(Params.PLAYER_ID, ParameterType.INTEGER, "Player id"));
    }

    @Override
    protected ApiResponse fetch(TaskParameters parameters) throws IOException {
        return source.getPlayerStats(requireLong(parameters, Params.PLAYER_ID));
    }
}
