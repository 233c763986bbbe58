package com.premwatch.ingest.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and JSON mapper instances.
 * One connection pool is enough: requests are strictly sequential.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(2, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(60, TimeUnit.SECONDS) // league-matches with max_per_page=1000 can be slow
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        SHARED_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * Get the shared OkHttpClient instance.
     */
    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Get the shared ObjectMapper instance.
     * Configured with lenient unknown property handling.
     */
    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
