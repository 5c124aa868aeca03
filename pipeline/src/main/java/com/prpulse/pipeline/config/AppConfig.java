package com.prpulse.pipeline.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String SOURCE_MODE_GITHUB = "github";
    public static final String SOURCE_MODE_FIXTURE = "fixture";

    static final String DEFAULT_GITHUB_API_URL = "https://api.github.com";
    static final int DEFAULT_SYNC_CONCURRENCY = 4;
    static final int DEFAULT_SYNC_MAX_ATTEMPTS = 3;
    static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_METRICS_WINDOW_DAYS = 30;

    private final String databaseUrl;
    private final String databaseUsername;
    private final String databasePassword;
    private final String sourceMode;
    private final String fixtureDir;
    private final String githubApiUrl;
    private final String githubToken;
    private final String installationTokens;
    private final int syncConcurrency;
    private final int syncMaxAttempts;
    private final int httpTimeoutSeconds;
    private final int metricsWindowDays;

    public AppConfig() {
        this(dotenvLookup(Dotenv.configure().ignoreIfMissing().load()));
        logger.info("Configuration loaded: sourceMode={}, githubApiUrl={}, syncConcurrency={}",
                sourceMode, githubApiUrl, syncConcurrency);
    }

    /**
     * Constructor for testing: values are looked up in the given map only.
     */
    public AppConfig(Map<String, String> values) {
        this(values::get);
    }

    private AppConfig(Function<String, String> lookup) {
        List<String> problems = new ArrayList<>();

        this.databaseUrl = lookup.apply("DATABASE_URL");
        this.databaseUsername = lookup.apply("DATABASE_USERNAME");
        this.databasePassword = lookup.apply("DATABASE_PASSWORD");
        String mode = lookup.apply("SOURCE_MODE");
        this.sourceMode = isBlank(mode) ? SOURCE_MODE_GITHUB : mode.trim().toLowerCase(Locale.ROOT);
        this.fixtureDir = lookup.apply("FIXTURE_DIR");
        String apiUrl = lookup.apply("GITHUB_API_URL");
        this.githubApiUrl = isBlank(apiUrl) ? DEFAULT_GITHUB_API_URL : apiUrl;
        this.githubToken = lookup.apply("GITHUB_TOKEN");
        this.installationTokens = lookup.apply("GITHUB_INSTALLATION_TOKENS");
        this.syncConcurrency = positiveInt(lookup, "SYNC_CONCURRENCY", DEFAULT_SYNC_CONCURRENCY, problems);
        this.syncMaxAttempts = positiveInt(lookup, "SYNC_MAX_ATTEMPTS", DEFAULT_SYNC_MAX_ATTEMPTS, problems);
        this.httpTimeoutSeconds = positiveInt(lookup, "HTTP_TIMEOUT_SECONDS", DEFAULT_HTTP_TIMEOUT_SECONDS, problems);
        this.metricsWindowDays = positiveInt(lookup, "METRICS_WINDOW_DAYS", DEFAULT_METRICS_WINDOW_DAYS, problems);

        validate(problems);
    }

    private void validate(List<String> problems) {
        StringBuilder missing = new StringBuilder();
        if (isBlank(databaseUrl)) missing.append("DATABASE_URL ");
        if (SOURCE_MODE_FIXTURE.equals(sourceMode) && isBlank(fixtureDir)) missing.append("FIXTURE_DIR ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
        if (!SOURCE_MODE_GITHUB.equals(sourceMode) && !SOURCE_MODE_FIXTURE.equals(sourceMode)) {
            problems.add("SOURCE_MODE must be '" + SOURCE_MODE_GITHUB + "' or '" + SOURCE_MODE_FIXTURE
                    + "', got '" + sourceMode + "'");
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static Function<String, String> dotenvLookup(Dotenv dotenv) {
        return key -> resolve(dotenv, key);
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static int positiveInt(Function<String, String> lookup, String key, int defaultValue,
                                   List<String> problems) {
        String raw = lookup.apply(key);
        if (isBlank(raw)) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                problems.add(key + " must be at least 1, got " + value);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number, got '" + raw + "'");
            return defaultValue;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isFixtureMode() {
        return SOURCE_MODE_FIXTURE.equals(sourceMode);
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getDatabaseUsername() {
        return databaseUsername;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public String getSourceMode() {
        return sourceMode;
    }

    public String getFixtureDir() {
        return fixtureDir;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public String getInstallationTokens() {
        return installationTokens;
    }

    public int getSyncConcurrency() {
        return syncConcurrency;
    }

    public int getSyncMaxAttempts() {
        return syncMaxAttempts;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public int getMetricsWindowDays() {
        return metricsWindowDays;
    }
}
