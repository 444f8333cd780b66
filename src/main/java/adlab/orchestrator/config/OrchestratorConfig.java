package adlab.orchestrator.config;

import java.time.Duration;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * ADLAB_* environment variables.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/adlab;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // Worker settings
    private int workerCount = 4;
    private int maxAttempts = 3;
    private Duration retryInitialBackoff = Duration.ofSeconds(2);
    private Duration retryMaxBackoff = Duration.ofSeconds(60);
    private double retryMultiplier = 2.0;
    private boolean retryJitter = true;

    // Queue settings
    private Duration visibilityTimeout = Duration.ofMinutes(5);
    private Duration queuePollInterval = Duration.ofSeconds(1);

    // Stream settings
    private Duration streamPollInterval = Duration.ofMillis(500);
    private Duration streamMaxDuration = Duration.ofSeconds(60);
    private Duration streamHeartbeatInterval = Duration.ofSeconds(15);

    // Reaper settings
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration orphanThreshold = Duration.ofMinutes(1);
    private Duration recordRetention = Duration.ofHours(1);

    // Analysis backend
    private String analysisUrl = null;
    private Duration analysisTimeout = Duration.ofMinutes(2);

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig();

        String dbUrl = System.getenv("ADLAB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("ADLAB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workers = System.getenv("ADLAB_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerCount = Integer.parseInt(workers);
        }

        String maxAttempts = System.getenv("ADLAB_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxAttempts = Integer.parseInt(maxAttempts);
        }

        String visibility = System.getenv("ADLAB_VISIBILITY_TIMEOUT_SECONDS");
        if (visibility != null && !visibility.isBlank()) {
            config.visibilityTimeout = Duration.ofSeconds(Long.parseLong(visibility));
        }

        String streamMax = System.getenv("ADLAB_STREAM_MAX_SECONDS");
        if (streamMax != null && !streamMax.isBlank()) {
            config.streamMaxDuration = Duration.ofSeconds(Long.parseLong(streamMax));
        }

        String retention = System.getenv("ADLAB_RETENTION_MINUTES");
        if (retention != null && !retention.isBlank()) {
            config.recordRetention = Duration.ofMinutes(Long.parseLong(retention));
        }

        String analysisUrl = System.getenv("ADLAB_ANALYSIS_URL");
        if (analysisUrl != null && !analysisUrl.isBlank()) {
            config.analysisUrl = analysisUrl;
        }

        return config;
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

    public int workerCount() {
        return workerCount;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration retryInitialBackoff() {
        return retryInitialBackoff;
    }

    public Duration retryMaxBackoff() {
        return retryMaxBackoff;
    }

    public double retryMultiplier() {
        return retryMultiplier;
    }

    public boolean retryJitter() {
        return retryJitter;
    }

    public Duration visibilityTimeout() {
        return visibilityTimeout;
    }

    public Duration queuePollInterval() {
        return queuePollInterval;
    }

    public Duration streamPollInterval() {
        return streamPollInterval;
    }

    public Duration streamMaxDuration() {
        return streamMaxDuration;
    }

    public Duration streamHeartbeatInterval() {
        return streamHeartbeatInterval;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration orphanThreshold() {
        return orphanThreshold;
    }

    public Duration recordRetention() {
        return recordRetention;
    }

    public String analysisUrl() {
        return analysisUrl;
    }

    public boolean hasAnalysisUrl() {
        return analysisUrl != null && !analysisUrl.isBlank();
    }

    public Duration analysisTimeout() {
        return analysisTimeout;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withWorkerCount(int workerCount) {
        this.workerCount = workerCount;
        return this;
    }

    public OrchestratorConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public OrchestratorConfig withRetryBackoff(Duration initial, Duration max) {
        this.retryInitialBackoff = initial;
        this.retryMaxBackoff = max;
        return this;
    }

    public OrchestratorConfig withRetryJitter(boolean jitter) {
        this.retryJitter = jitter;
        return this;
    }

    public OrchestratorConfig withVisibilityTimeout(Duration timeout) {
        this.visibilityTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withQueuePollInterval(Duration interval) {
        this.queuePollInterval = interval;
        return this;
    }

    public OrchestratorConfig withStreamPollInterval(Duration interval) {
        this.streamPollInterval = interval;
        return this;
    }

    public OrchestratorConfig withStreamMaxDuration(Duration duration) {
        this.streamMaxDuration = duration;
        return this;
    }

    public OrchestratorConfig withStreamHeartbeatInterval(Duration interval) {
        this.streamHeartbeatInterval = interval;
        return this;
    }

    public OrchestratorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public OrchestratorConfig withOrphanThreshold(Duration threshold) {
        this.orphanThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withRecordRetention(Duration retention) {
        this.recordRetention = retention;
        return this;
    }

    public OrchestratorConfig withAnalysisUrl(String url) {
        this.analysisUrl = url;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workers=" + workerCount +
                ", maxAttempts=" + maxAttempts +
                ", visibilityTimeout=" + visibilityTimeout +
                ", streamMaxDuration=" + streamMaxDuration +
                ", analysisUrlSet=" + hasAnalysisUrl() +
                '}';
    }
}
