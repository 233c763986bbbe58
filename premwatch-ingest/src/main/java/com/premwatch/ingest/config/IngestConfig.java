package com.premwatch.ingest.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Settings for the ingest run.
 *
 * Resolution order: defaults, then ~/.premwatch/ingest.yaml (or the file named by the
 * {@code premwatch.config} system property), then system properties / environment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestConfig.class);

    public static final String DEFAULT_BASE_URL = "https://api.football-data-api.com";
    // 1800 requests/hour quota
    public static final Duration DEFAULT_REQUEST_DELAY = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final String DEFAULT_TIMEZONE = "Europe/London";

    private static final Path DEFAULT_CONFIG_FILE =
        Path.of(System.getProperty("user.home"), ".premwatch", "ingest.yaml");

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false);

    private String apiKey;
    private String baseUrl = DEFAULT_BASE_URL;
    private Duration requestDelay = DEFAULT_REQUEST_DELAY;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private String timezone = DEFAULT_TIMEZONE;

    public IngestConfig() {}

    /**
     * Load from the config file, system properties and environment.
     */
    public static IngestConfig load() {
        String override = System.getProperty("premwatch.config");
        Path file = override != null ? Path.of(override) : DEFAULT_CONFIG_FILE;
        return load(file, System.getProperties(), System.getenv());
    }

    static IngestConfig load(Path configFile, Properties props, Map<String, String> env) {
        IngestConfig config = readFile(configFile);

        String apiKey = setting(props, "premwatch.api.key", env, "API_KEY");
        if (apiKey != null) {
            config.setApiKey(apiKey);
        }
        String baseUrl = setting(props, "premwatch.api.url", env, "PREMWATCH_API_URL");
        if (baseUrl != null) {
            config.setBaseUrl(baseUrl);
        }
        String delayMs = setting(props, "premwatch.request.delay.ms", env, "PREMWATCH_REQUEST_DELAY_MS");
        if (delayMs != null) {
            config.setRequestDelay(Duration.ofMillis(parseLong("request delay", delayMs)));
        }
        String retries = setting(props, "premwatch.max.retries", env, "PREMWATCH_MAX_RETRIES");
        if (retries != null) {
            config.setMaxRetries((int) parseLong("max retries", retries));
        }
        return config;
    }

    private static IngestConfig readFile(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            return new IngestConfig();
        }
        try {
            IngestConfig config = YAML.readValue(configFile.toFile(), IngestConfig.class);
            log.debug("Loaded config from {}", configFile);
            return config != null ? config : new IngestConfig();
        } catch (IOException e) {
            log.warn("Failed to load config from {}: {}", configFile, e.getMessage());
            return new IngestConfig();
        }
    }

    private static String setting(Properties props, String property, Map<String, String> env, String variable) {
        String value = props.getProperty(property);
        if (value == null || value.isBlank()) {
            value = env.get(variable);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static long parseLong(String what, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid " + what + ": '" + value + "'", e);
        }
    }

    /**
     * Check the settings every run needs. Called once before any task runs.
     *
     * @throws IllegalStateException if the API key is missing or a value is out of range
     */
    public void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("API key not configured: set API_KEY or -Dpremwatch.api.key");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("API base URL is empty");
        }
        if (requestDelay == null || requestDelay.isNegative()) {
            throw new IllegalStateException("Request delay must not be negative: " + requestDelay);
        }
        if (maxRetries < 0) {
            throw new IllegalStateException("Max retries must not be negative: " + maxRetries);
        }
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getRequestDelay() {
        return requestDelay;
    }

    public void setRequestDelay(Duration requestDelay) {
        this.requestDelay = requestDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    @Override
    public String toString() {
        return "IngestConfig{baseUrl=" + baseUrl + ", requestDelay=" + requestDelay
            + ", maxRetries=" + maxRetries + ", timezone=" + timezone
            + ", apiKey=" + (apiKey == null ? "<unset>" : "****") + "}";
    }
}
