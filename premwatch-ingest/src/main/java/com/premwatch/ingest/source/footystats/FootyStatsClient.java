package com.premwatch.ingest.source.footystats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premwatch.ingest.config.IngestConfig;
import com.premwatch.ingest.source.ApiResponse;
import com.premwatch.ingest.source.HttpClientFactory;
import com.premwatch.ingest.source.Pager;
import com.premwatch.ingest.source.RemoteDataSource;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FootyStats API client with rate limiting, retries and transparent pagination.
 *
 * Rate limiting: fixed minimum gap between requests (default 2s, i.e. 1800 req/hour)
 * Retry: exponential backoff on network errors and 5xx, Retry-After on 429
 */
public class FootyStatsClient implements RemoteDataSource {

    private static final Logger log = LoggerFactory.getLogger(FootyStatsClient.class);

    private static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    private static final int DEFAULT_RETRY_AFTER_SECONDS = 60;
    private static final int MAX_PER_PAGE = 1000;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final String timezone;
    private final long requestDelayMs;
    private final int maxRetries;
    private final long retryBackoffMs;

    // Rate limiting state
    private long lastRequestTime = 0;
    private final Object rateLimitLock = new Object();

    public FootyStatsClient(IngestConfig config) {
        this(config, HttpClientFactory.getClient(), DEFAULT_RETRY_BACKOFF);
    }

    FootyStatsClient(IngestConfig config, OkHttpClient client, Duration retryBackoff) {
        HttpUrl url = HttpUrl.parse(config.getBaseUrl());
        if (url == null) {
            throw new IllegalArgumentException("Invalid API base URL: " + config.getBaseUrl());
        }
        this.client = client;
        this.mapper = HttpClientFactory.getMapper();
        this.baseUrl = url;
        this.apiKey = config.getApiKey();
        this.timezone = config.getTimezone();
        this.requestDelayMs = config.getRequestDelay().toMillis();
        this.maxRetries = config.getMaxRetries();
        this.retryBackoffMs = retryBackoff.toMillis();
    }

    // ==================== Resources ====================

    @Override
    public ApiResponse getLeagues(Long countryId, boolean chosenOnly) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        if (chosenOnly) {
            params.put("chosen_leagues_only", "true");
        }
        putIfPresent(params, "country", countryId);
        return fetch(Endpoint.LEAGUE_LIST, params);
    }

    @Override
    public ApiResponse getCountries() throws IOException {
        return fetch(Endpoint.COUNTRY_LIST, new LinkedHashMap<>());
    }

    @Override
    public ApiResponse getMatches(String date) throws IOException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("timezone", timezone);
        if (date != null && !date.isBlank()) {
            params.put("date", date);
        }
        return fetch(Endpoint.TODAYS_MATCHES, params);
    }

    @Override
    public ApiResponse getLeagueStats(long seasonId, Long maxTime) throws IOException {
        return fetch(Endpoint.LEAGUE_STATISTICS, seasonParams(seasonId, maxTime));
    }

    @Override
    public ApiResponse getSchedule(long seasonId, Long maxTime) throws IOException {
        Map<String, String> params = seasonParams(seasonId, maxTime);
        params.put("max_per_page", String.valueOf(MAX_PER_PAGE));
        return fetch(Endpoint.LEAGUE_MATCHES, params);
    }

    @Override
    public ApiResponse getLeagueTeams(long seasonId, boolean includeStats, Long maxTime) throws IOException {
        Map<String, String> params = seasonParams(seasonId, maxTime);
        if (includeStats) {
            params.put("include", "stats");
        }
        return fetch(Endpoint.LEAGUE_TEAMS, params);
    }

    @Override
    public ApiResponse getLeaguePlayers(long seasonId, Long maxTime) throws IOException {
        return fetch(Endpoint.LEAGUE_PLAYERS, seasonParams(seasonId, maxTime));
    }

    @Override
    public ApiResponse getLeagueReferees(long seasonId, Long maxTime) throws IOException {
        return fetch(Endpoint.LEAGUE_REFEREES, seasonParams(seasonId, maxTime));
    }

    @Override
    public ApiResponse getTeam(long teamId) throws IOException {
        return fetch(Endpoint.TEAM, single("team_id", teamId));
    }

    @Override
    public ApiResponse getTeamRecentForm(long teamId) throws IOException {
        return fetch(Endpoint.LAST_X, single("team_id", teamId));
    }

    @Override
    public ApiResponse getMatchDetails(long matchId) throws IOException {
        return fetch(Endpoint.MATCH, single("match_id", matchId));
    }

    @Override
    public ApiResponse getLeagueTable(long seasonId, Long maxTime) throws IOException {
        return fetch(Endpoint.LEAGUE_TABLES, seasonParams(seasonId, maxTime));
    }

    @Override
    public ApiResponse getPlayerStats(long playerId) throws IOException {
        return fetch(Endpoint.PLAYER_STATS, single("player_id", playerId));
    }

    @Override
    public ApiResponse getRefereeStats(long refereeId) throws IOException {
        return fetch(Endpoint.REFEREE, single("referee_id", refereeId));
    }

    @Override
    public ApiResponse getBttsStats() throws IOException {
        return fetch(Endpoint.BTTS_STATS, new LinkedHashMap<>());
    }

    @Override
    public ApiResponse getOver25Stats() throws IOException {
        return fetch(Endpoint.OVER_25_STATS, new LinkedHashMap<>());
    }

    private static Map<String, String> seasonParams(long seasonId, Long maxTime) {
        Map<String, String> params = single("season_id", seasonId);
        putIfPresent(params, "max_time", maxTime);
        return params;
    }

    private static Map<String, String> single(String name, long value) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(name, String.valueOf(value));
        return params;
    }

    private static void putIfPresent(Map<String, String> params, String name, Long value) {
        if (value != null) {
            params.put(name, String.valueOf(value));
        }
    }

    // ==================== Transport ====================

    /**
     * Fetch an endpoint, following the pager on pageable endpoints.
     * Any failed page fails the whole fetch; partial results are never returned.
     */
    ApiResponse fetch(Endpoint endpoint, Map<String, String> params) throws IOException {
        ApiResponse response = ApiResponse.parse(executeRequest(endpoint, params));

        Pager pager = response.pager();
        if (endpoint.isPaged() && pager != null && pager.hasMorePages()) {
            for (int page = pager.currentPage() + 1; page <= pager.maxPage(); page++) {
                Map<String, String> pageParams = new LinkedHashMap<>(params);
                pageParams.put("page", String.valueOf(page));
                ApiResponse next = ApiResponse.parse(executeRequest(endpoint, pageParams));
                response = response.append(next);
                log.debug("Fetched page {}/{} of {}", page, pager.maxPage(), endpoint.getPath());
            }
        }
        return response;
    }

    /**
     * Execute a request with rate limiting and retries.
     */
    private JsonNode executeRequest(Endpoint endpoint, Map<String, String> params) throws IOException {
        HttpUrl.Builder urlBuilder = baseUrl.newBuilder()
            .addPathSegment(endpoint.getPath())
            .addQueryParameter("key", apiKey);
        params.forEach(urlBuilder::addQueryParameter);
        HttpUrl url = urlBuilder.build();

        IOException lastException = null;
        long retryDelayMs = retryBackoffMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                log.debug("Retry attempt {} for {}", attempt, endpoint.getPath());
                sleep(retryDelayMs);
                retryDelayMs *= 2;
            }

            waitForRateLimit();

            Request request = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .get()
                .build();

            try (Response response = client.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                if (response.isSuccessful()) {
                    return mapper.readTree(body);
                }

                if (response.code() == 429) {
                    String retryAfter = response.header("Retry-After");
                    long waitSeconds = parseRetryAfter(retryAfter);
                    log.warn("Rate limited by FootyStats on {}, waiting {}s", endpoint.getPath(), waitSeconds);
                    lastException = new IOException("FootyStats API rate limit exceeded on " + endpoint.getPath());
                    sleep(waitSeconds * 1000L);
                    continue;
                }

                lastException = new IOException(
                    "FootyStats API error: " + response.code() + " " + response.message()
                        + " on " + endpoint.getPath() + " - " + abbreviate(body));

                // Client errors won't improve on retry
                if (response.code() >= 400 && response.code() < 500) {
                    throw lastException;
                }
            } catch (JsonProcessingException e) {
                // A malformed body won't improve on retry either
                throw new IOException("FootyStats returned invalid JSON on " + endpoint.getPath()
                    + ": " + e.getOriginalMessage(), e);
            } catch (IOException e) {
                if (e == lastException) {
                    throw e;
                }
                lastException = e;
                log.debug("Request to {} failed: {}", endpoint.getPath(), e.getMessage());
            }
        }

        throw lastException != null ? lastException
            : new IOException("Request failed after retries: " + endpoint.getPath());
    }

    /**
     * Block until the minimum gap since the previous request has passed.
     */
    private void waitForRateLimit() throws IOException {
        synchronized (rateLimitLock) {
            long now = System.currentTimeMillis();
            long timeSinceLastRequest = now - lastRequestTime;

            if (timeSinceLastRequest < requestDelayMs) {
                long waitTime = requestDelayMs - timeSinceLastRequest;
                log.debug("Rate limiting: waiting {}ms", waitTime);
                sleep(waitTime);
            }

            lastRequestTime = System.currentTimeMillis();
        }
    }

    private static long parseRetryAfter(String retryAfter) {
        if (retryAfter == null) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            return Math.max(0, Long.parseLong(retryAfter.trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private static void sleep(long millis) throws IOException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to call FootyStats", e);
        }
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
