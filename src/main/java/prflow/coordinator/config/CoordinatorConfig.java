package prflow.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/prflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private int defaultMaxRetries = 3;

    // Sweeps
    private Duration reclaimInterval = Duration.ofMinutes(5);
    private Duration maxProcessingTime = null; // null = 6 x reclaimInterval
    private Duration healthCheckInterval = Duration.ofHours(1);
    private Duration retentionInterval = Duration.ofDays(1);
    private int retentionDays = 30;

    // Auth settings (optional)
    private String apiKey = null; // If set, workers must provide X-Prflow-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("PRFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        config.databasePoolSize = intEnv("PRFLOW_DB_POOL_SIZE", config.databasePoolSize, 1);

        String host = System.getenv("PRFLOW_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        config.serverPort = intEnv("PRFLOW_PORT", config.serverPort, 0);

        String apiKey = System.getenv("PRFLOW_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        config.defaultMaxRetries = intEnv("PRFLOW_MAX_RETRIES", config.defaultMaxRetries, 0);

        config.reclaimInterval = Duration.ofMinutes(
                intEnv("PRFLOW_RECLAIM_INTERVAL_MINUTES", (int) config.reclaimInterval.toMinutes(), 1));

        String maxProcessing = System.getenv("PRFLOW_MAX_PROCESSING_MINUTES");
        if (maxProcessing != null && !maxProcessing.isBlank()) {
            config.maxProcessingTime = Duration.ofMinutes(parsePositive("PRFLOW_MAX_PROCESSING_MINUTES",
                    maxProcessing, 1));
        }

        config.healthCheckInterval = Duration.ofMinutes(
                intEnv("PRFLOW_HEALTH_INTERVAL_MINUTES", (int) config.healthCheckInterval.toMinutes(), 1));

        config.retentionDays = intEnv("PRFLOW_RETENTION_DAYS", config.retentionDays, 1);

        return config;
    }

    private static int intEnv(String name, int fallback, int min) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return parsePositive(name, value, min);
    }

    private static int parsePositive(String name, String value, int min) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
        if (parsed < min) {
            throw new IllegalArgumentException(name + " must be >= " + min + ", got: " + parsed);
        }
        return parsed;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration reclaimInterval() {
        return reclaimInterval;
    }

    /**
     * Age after which a PROCESSING claim is considered abandoned.
     * Defaults to six reclaim intervals.
     */
    public Duration maxProcessingTime() {
        return maxProcessingTime != null ? maxProcessingTime : reclaimInterval.multipliedBy(6);
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration retentionInterval() {
        return retentionInterval;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withReclaimInterval(Duration interval) {
        this.reclaimInterval = interval;
        return this;
    }

    public CoordinatorConfig withMaxProcessingTime(Duration maxProcessingTime) {
        this.maxProcessingTime = maxProcessingTime;
        return this;
    }

    public CoordinatorConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public CoordinatorConfig withRetentionInterval(Duration interval) {
        this.retentionInterval = interval;
        return this;
    }

    public CoordinatorConfig withRetentionDays(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("retentionDays must be >= 1");
        }
        this.retentionDays = days;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxRetries=" + defaultMaxRetries +
                ", reclaimInterval=" + reclaimInterval +
                ", maxProcessingTime=" + maxProcessingTime() +
                ", retentionDays=" + retentionDays +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
