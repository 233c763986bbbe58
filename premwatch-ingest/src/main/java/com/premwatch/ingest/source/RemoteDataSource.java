package com.premwatch.ingest.source;

import java.io.IOException;

/**
 * Typed access to the football statistics API, one method per resource.
 *
 * Implementations fetch and concatenate every page of a paginated resource before
 * returning. Transport and HTTP failures surface as {@link IOException}; a response
 * without usable {@code data} is returned as-is and reads as empty.
 *
 * Nullable {@code Long} filters are simply omitted from the request when null.
 */
public interface RemoteDataSource {

    /**
     * Leagues, each with its nested list of seasons.
     */
    ApiResponse getLeagues(Long countryId, boolean chosenOnly) throws IOException;

    ApiResponse getCountries() throws IOException;

    /**
     * Matches on a given day ({@code YYYY-MM-DD}); today when {@code date} is null.
     */
    ApiResponse getMatches(String date) throws IOException;

    ApiResponse getLeagueStats(long seasonId, Long maxTime) throws IOException;

    /**
     * Full fixture list of a season.
     */
    ApiResponse getSchedule(long seasonId, Long maxTime) throws IOException;

    ApiResponse getLeagueTeams(long seasonId, boolean includeStats, Long maxTime) throws IOException;

    ApiResponse getLeaguePlayers(long seasonId, Long maxTime) throws IOException;

    ApiResponse getLeagueReferees(long seasonId, Long maxTime) throws IOException;

    ApiResponse getTeam(long teamId) throws IOException;

    /**
     * Last 5, 6 and 10 match form for a team.
     */
    ApiResponse getTeamRecentForm(long teamId) throws IOException;

    ApiResponse getMatchDetails(long matchId) throws IOException;

    ApiResponse getLeagueTable(long seasonId, Long maxTime) throws IOException;

    ApiResponse getPlayerStats(long playerId) throws IOException;

    ApiResponse getRefereeStats(long refereeId) throws IOException;

    ApiResponse getBttsStats() throws IOException;

    ApiResponse getOver25Stats() throws IOException;
}
