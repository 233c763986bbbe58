package com.premwatch.ingest.orchestrator;

import com.premwatch.ingest.task.Params;

import java.util.ArrayList;
import java.util.List;

/**
 * Dependency levels of a cascading update. Level N reads its identities from the
 * tables written by levels before it.
 */
public final class CascadePlan {

    private final List<List<CascadeStage>> levels;

    private CascadePlan(List<List<CascadeStage>> levels) {
        List<List<CascadeStage>> copy = new ArrayList<>();
        for (List<CascadeStage> level : levels) {
            copy.add(List.copyOf(level));
        }
        this.levels = List.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * countries, then leagues per country, then season resources per league season,
     * then team and match details, then player and referee stats.
     */
    public static CascadePlan standard() {
        return builder()
            .level(CascadeStage.root("countries"))
            .level(CascadeStage.perIdentity("leagues", "countries", Params.COUNTRY_ID)
                .withFixed(Params.CHOSEN_ONLY, false))
            .level(
                CascadeStage.perIdentity("league_stats", "leagues", Params.SEASON_ID),
                CascadeStage.perIdentity("schedules", "leagues", Params.SEASON_ID),
                CascadeStage.perIdentity("teams", "leagues", Params.SEASON_ID).withFixed(Params.STATS, true),
                CascadeStage.perIdentity("players", "leagues", Params.SEASON_ID),
                CascadeStage.perIdentity("referees", "leagues", Params.SEASON_ID),
                CascadeStage.perIdentity("league_table", "leagues", Params.SEASON_ID))
            .level(
                CascadeStage.perIdentity("team_data", "teams", Params.TEAM_ID),
                CascadeStage.perIdentity("team_form", "teams", Params.TEAM_ID),
                CascadeStage.perIdentity("match_details", "matches", Params.MATCH_ID))
            .level(
                CascadeStage.perIdentity("player_stats", "players", Params.PLAYER_ID),
                CascadeStage.perIdentity("referee_stats", "referees", Params.REFEREE_ID))
            .build();
    }

    public List<List<CascadeStage>> getLevels() {
        return levels;
    }

    public int depth() {
        return levels.size();
    }

    /**
     * Stages of every level, in run order.
     */
    public List<CascadeStage> stages() {
        return levels.stream().flatMap(List::stream).toList();
    }

    public static final class Builder {

        private final List<List<CascadeStage>> levels = new ArrayList<>();

        private Builder() {
        }

        public Builder level(CascadeStage... stages) {
            if (stages.length == 0) {
                throw new IllegalArgumentException("A cascade level needs at least one stage");
            }
            levels.add(List.of(stages));
            return this;
        }

        public CascadePlan build() {
            return new CascadePlan(levels);
        }
    }
}
