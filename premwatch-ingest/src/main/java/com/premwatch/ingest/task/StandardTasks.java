package com.premwatch.ingest.task;

import com.premwatch.ingest.source.RemoteDataSource;
import com.premwatch.ingest.store.RecordStore;

import java.util.List;

/**
 * The full set of FootyStats tasks, in registration order.
 */
public final class StandardTasks {

    private StandardTasks() {
    }

    public static List<IngestionTask> create(RemoteDataSource source, RecordStore store) {
        return List.of(
            new LeaguesTask(source, store),
            new CountriesTask(source, store),
            new MatchesTask(source, store),
            new LeagueStatsTask(source, store),
            new SchedulesTask(source, store),
            new TeamsTask(source, store),
            new PlayersTask(source, store),
            new RefereesTask(source, store),
            new TeamDataTask(source, store),
            new TeamFormTask(source, store),
            new MatchDetailsTask(source, store),
            new LeagueTableTask(source, store),
            new PlayerStatsTask(source, store),
            new RefereeStatsTask(source, store),
            new BttsStatsTask(source, store),
            new Over25StatsTask(source, store)
        );
    }

    /**
     * Unbound task instances, for reading names and parameter declarations before
     * a store is opened. They must not be executed.
     */
    public static List<IngestionTask> catalog() {
        return create(null, null);
    }
}
