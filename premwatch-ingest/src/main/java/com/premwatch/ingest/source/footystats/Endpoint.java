package com.premwatch.ingest.source.footystats;

/**
 * FootyStats API endpoints used by the ingest tasks.
 */
enum Endpoint {
    LEAGUE_LIST("league-list", false),
    COUNTRY_LIST("country-list", false),
    TODAYS_MATCHES("todays-matches", true),
    LEAGUE_STATISTICS("league-statistics", false),
    LEAGUE_MATCHES("league-matches", true),
    LEAGUE_TEAMS("league-teams", true),
    LEAGUE_PLAYERS("league-players", true),
    LEAGUE_REFEREES("league-referees", true),
    TEAM("team", false),
    LAST_X("lastx", false),
    MATCH("match", false),
    LEAGUE_TABLES("league-tables", false),
    PLAYER_STATS("player-stats", false),
    REFEREE("referee", false),
    BTTS_STATS("stats-data-btts", false),
    OVER_25_STATS("stats-data-over25", false);

    private final String path;
    private final boolean paged;

    Endpoint(String path, boolean paged) {
        this.path = path;
        this.paged = paged;
    }

    String getPath() {
        return path;
    }

    /**
     * Whether the endpoint accepts a {@code page} parameter.
     */
    boolean isPaged() {
        return paged;
    }
}
