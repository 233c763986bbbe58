package com.premwatch.ingest.task;

/**
 * Parameter names shared by tasks, the cascade and the command line.
 */
public final class Params {

    public static final String SEASON_ID = "season_id";
    public static final String MAX_TIME = "max_time";
    public static final String TEAM_ID = "team_id";
    public static final String MATCH_ID = "match_id";
    public static final String PLAYER_ID = "player_id";
    public static final String REFEREE_ID = "referee_id";
    public static final String COUNTRY_ID = "country_id";
    public static final String CHOSEN_ONLY = "chosen_only";
    public static final String DATE = "date";
    public static final String STATS = "stats";

    static final ParameterSpec SEASON = ParameterSpec.required(SEASON_ID, ParameterType.INTEGER,
        "Season (competition) id");
    static final ParameterSpec MAX_TIME_FILTER = ParameterSpec.optional(MAX_TIME, ParameterType.INTEGER,
        "Only data up to this UNIX timestamp");

    private Params() {
    }
}
