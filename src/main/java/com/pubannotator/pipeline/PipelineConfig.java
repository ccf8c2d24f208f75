package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Run configuration.
 * <p>
 * {@link #fromEnvironment()} resolves every key from the environment, then from JVM system
 * properties, then from the defaults below. Malformed numbers fall back to the default with a
 * warning. Tests build instances through {@link #builder()}.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public final class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    private final int concurrency;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final Duration jitter;
    private final Duration gracePeriod;
    private final int persistAttempts;
    private final boolean resetFailed;
    private final String idPrefix;
    private final String schema;
    private final String promptContext;
    private final String annotationEndpoint;
    private final String annotationModel;
    private final String annotationApiKey;
    private final Duration annotationTimeout;
    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int embeddedPort;
    private final String embeddedDataDir;
    private final String outputDir;

    private PipelineConfig(Builder b) {
        if (b.concurrency < 1) throw new IllegalArgumentException("concurrency must be at least 1");
        if (b.maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (b.persistAttempts < 1) throw new IllegalArgumentException("persistAttempts must be at least 1");
        this.concurrency = b.concurrency;
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.multiplier = b.multiplier;
        this.maxDelay = b.maxDelay;
        this.jitter = b.jitter;
        this.gracePeriod = b.gracePeriod;
        this.persistAttempts = b.persistAttempts;
        this.resetFailed = b.resetFailed;
        this.idPrefix = b.idPrefix;
        this.schema = b.schema;
        this.promptContext = b.promptContext;
        this.annotationEndpoint = b.annotationEndpoint;
        this.annotationModel = b.annotationModel;
        this.annotationApiKey = b.annotationApiKey;
        this.annotationTimeout = b.annotationTimeout;
        this.dbUrl = b.dbUrl;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword;
        this.embeddedPort = b.embeddedPort;
        this.embeddedDataDir = b.embeddedDataDir;
        this.outputDir = b.outputDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static PipelineConfig fromEnvironment() {
        Builder d = new Builder();
        return builder()
            .concurrency(intSetting("ANNOTATOR_CONCURRENCY", d.concurrency))
            .maxAttempts(intSetting("ANNOTATOR_MAX_ATTEMPTS", d.maxAttempts))
            .baseDelay(Duration.ofMillis(longSetting("ANNOTATOR_BASE_DELAY_MS", d.baseDelay.toMillis())))
            .multiplier(doubleSetting("ANNOTATOR_MULTIPLIER", d.multiplier))
            .maxDelay(Duration.ofMillis(longSetting("ANNOTATOR_MAX_DELAY_MS", d.maxDelay.toMillis())))
            .jitter(Duration.ofMillis(longSetting("ANNOTATOR_JITTER_MS", d.jitter.toMillis())))
            .gracePeriod(Duration.ofMillis(longSetting("ANNOTATOR_GRACE_PERIOD_MS", d.gracePeriod.toMillis())))
            .persistAttempts(intSetting("ANNOTATOR_PERSIST_ATTEMPTS", d.persistAttempts))
            .resetFailed(Boolean.parseBoolean(Utils.envOrProp("ANNOTATOR_RESET_FAILED", Boolean.toString(d.resetFailed))))
            .idPrefix(Utils.envOrProp("ANNOTATOR_ID_PREFIX", d.idPrefix))
            .schema(Utils.envOrProp("ANNOTATOR_SCHEMA", d.schema))
            .promptContext(Utils.envOrProp("ANNOTATOR_PROMPT_CONTEXT", d.promptContext))
            .annotationEndpoint(Utils.envOrProp("ANNOTATOR_ENDPOINT", d.annotationEndpoint))
            .annotationModel(Utils.envOrProp("ANNOTATOR_MODEL", d.annotationModel))
            .annotationApiKey(Utils.envOrProp("ANNOTATOR_API_KEY", d.annotationApiKey))
            .annotationTimeout(Duration.ofMillis(longSetting("ANNOTATOR_TIMEOUT_MS", d.annotationTimeout.toMillis())))
            .dbUrl(Utils.envOrProp("DB_URL", d.dbUrl))
            .dbUser(Utils.envOrProp("DB_USER", d.dbUser))
            .dbPassword(Utils.envOrProp("DB_PASS", d.dbPassword))
            .embeddedPort(intSetting("EMBEDDED_PG_PORT", d.embeddedPort))
            .embeddedDataDir(Utils.envOrProp("EMBEDDED_PG_DATA_DIR", d.embeddedDataDir))
            .outputDir(Utils.envOrProp("ANNOTATOR_OUTPUT_DIR", d.outputDir))
            .build();
    }

    private static int intSetting(String key, int defaultVal) {
        return (int) longSetting(key, defaultVal);
    }

    private static long longSetting(String key, long defaultVal) {
        String raw = Utils.envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number '{}' for {}; using default {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    private static double doubleSetting(String key, double defaultVal) {
        String raw = Utils.envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number '{}' for {}; using default {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    public int concurrency() { return concurrency; }
    public int maxAttempts() { return maxAttempts; }
    public Duration baseDelay() { return baseDelay; }
    public double multiplier() { return multiplier; }
    public Duration maxDelay() { return maxDelay; }
    public Duration jitter() { return jitter; }
    public Duration gracePeriod() { return gracePeriod; }
    public int persistAttempts() { return persistAttempts; }
    public boolean resetFailed() { return resetFailed; }
    public String idPrefix() { return idPrefix; }
    public String schema() { return schema; }
    public String promptContext() { return promptContext; }
    public String annotationEndpoint() { return annotationEndpoint; }
    public String annotationModel() { return annotationModel; }
    public String annotationApiKey() { return annotationApiKey; }
    public Duration annotationTimeout() { return annotationTimeout; }
    public String dbUrl() { return dbUrl; }
    public String dbUser() { return dbUser; }
    public String dbPassword() { return dbPassword; }
    public int embeddedPort() { return embeddedPort; }
    public String embeddedDataDir() { return embeddedDataDir; }
    public String outputDir() { return outputDir; }

    @Override
    public String toString() {
        return "PipelineConfig{concurrency=" + concurrency + ", maxAttempts=" + maxAttempts
            + ", baseDelay=" + baseDelay.toMillis() + "ms, multiplier=" + multiplier
            + ", maxDelay=" + maxDelay.toMillis() + "ms, jitter=" + jitter.toMillis() + "ms"
            + ", gracePeriod=" + gracePeriod.toMillis() + "ms, persistAttempts=" + persistAttempts
            + ", resetFailed=" + resetFailed + ", schema=" + schema + ", endpoint=" + annotationEndpoint
            + ", model=" + annotationModel + ", dbUrl=" + (dbUrl.isBlank() ? "<embedded>" : dbUrl) + "}";
    }

    public static final class Builder {
        private int concurrency = 4;
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(1000);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMillis(30_000);
        private Duration jitter = Duration.ofMillis(250);
        private Duration gracePeriod = Duration.ofMillis(10_000);
        private int persistAttempts = 3;
        private boolean resetFailed = false;
        private String idPrefix = "pub_";
        private String schema = AnnotationSchemas.PUBLICATION;
        private String promptContext = "Annotate the publication below. Reply with a single JSON object matching the schema.";
        private String annotationEndpoint = "http://localhost:8000/v1/chat/completions";
        private String annotationModel = "gpt-4o-mini";
        private String annotationApiKey = "";
        private Duration annotationTimeout = Duration.ofSeconds(60);
        private String dbUrl = "";
        private String dbUser = "postgres";
        private String dbPassword = "postgres";
        private int embeddedPort = 5432;
        private String embeddedDataDir = "annotator-data/pgdata";
        private String outputDir = "annotator-data";

        private Builder() {}

        public Builder concurrency(int v) { this.concurrency = v; return this; }
        public Builder maxAttempts(int v) { this.maxAttempts = v; return this; }
        public Builder baseDelay(Duration v) { this.baseDelay = v; return this; }
        public Builder multiplier(double v) { this.multiplier = v; return this; }
        public Builder maxDelay(Duration v) { this.maxDelay = v; return this; }
        public Builder jitter(Duration v) { this.jitter = v; return this; }
        public Builder gracePeriod(Duration v) { this.gracePeriod = v; return this; }
        public Builder persistAttempts(int v) { this.persistAttempts = v; return this; }
        public Builder resetFailed(boolean v) { this.resetFailed = v; return this; }
        public Builder idPrefix(String v) { this.idPrefix = v; return this; }
        public Builder schema(String v) { this.schema = v; return this; }
        public Builder promptContext(String v) { this.promptContext = v; return this; }
        public Builder annotationEndpoint(String v) { this.annotationEndpoint = v; return this; }
        public Builder annotationModel(String v) { this.annotationModel = v; return this; }
        public Builder annotationApiKey(String v) { this.annotationApiKey = v; return this; }
        public Builder annotationTimeout(Duration v) { this.annotationTimeout = v; return this; }
        public Builder dbUrl(String v) { this.dbUrl = v; return this; }
        public Builder dbUser(String v) { this.dbUser = v; return this; }
        public Builder dbPassword(String v) { this.dbPassword = v; return this; }
        public Builder embeddedPort(int v) { this.embeddedPort = v; return this; }
        public Builder embeddedDataDir(String v) { this.embeddedDataDir = v; return this; }
        public Builder outputDir(String v) { this.outputDir = v; return this; }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
