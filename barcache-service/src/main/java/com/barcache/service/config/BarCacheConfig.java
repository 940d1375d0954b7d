package com.barcache.service.config;

import com.barcache.core.model.Interval;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the bar cache and its acquisition jobs.
 * Every setting is read from a system property, then an environment variable, then a default.
 */
public class BarCacheConfig {
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.barcache";

    private final Path dataDir;
    private final String exchange;
    private final Interval interval;
    private final ZoneId marketZone;
    private final List<LocalDate> holidays;

    // Cache
    private final Duration cacheTtl;

    // Fetch executor
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final int maxRetries;
    private final Duration maxJitter;
    private final int breakerThreshold;
    private final Duration breakerCooldown;
    private final Duration callTimeout;
    private final Duration minRequestSpacing;

    // Jobs
    private final int backfillBatchSize;
    private final Duration backfillBatchPause;
    private final int updateLookbackDays;
    private final int freshnessThresholdDays;
    private final int gapThresholdDays;

    // Provider
    private final String apiBaseUrl;
    private final String apiKey;
    private final String accessToken;
    private final Path instrumentMasterFile;

    private BarCacheConfig(Builder b) {
        this.dataDir = b.dataDir;
        this.exchange = b.exchange;
        this.interval = b.interval;
        this.marketZone = b.marketZone;
        this.holidays = List.copyOf(b.holidays);
        this.cacheTtl = b.cacheTtl;
        this.retryBaseDelay = b.retryBaseDelay;
        this.retryMaxDelay = b.retryMaxDelay;
        this.maxRetries = b.maxRetries;
        this.maxJitter = b.maxJitter;
        this.breakerThreshold = b.breakerThreshold;
        this.breakerCooldown = b.breakerCooldown;
        this.callTimeout = b.callTimeout;
        this.minRequestSpacing = b.minRequestSpacing;
        this.backfillBatchSize = b.backfillBatchSize;
        this.backfillBatchPause = b.backfillBatchPause;
        this.updateLookbackDays = b.updateLookbackDays;
        this.freshnessThresholdDays = b.freshnessThresholdDays;
        this.gapThresholdDays = b.gapThresholdDays;
        this.apiBaseUrl = b.apiBaseUrl;
        this.apiKey = b.apiKey;
        this.accessToken = b.accessToken;
        this.instrumentMasterFile = b.instrumentMasterFile;
    }

    public static BarCacheConfig load() {
        return load(System.getenv());
    }

    static BarCacheConfig load(Map<String, String> env) {
        Path dataDir = Paths.get(setting(env, "barcache.data.dir", "BARCACHE_DATA_DIR", DEFAULT_DATA_DIR));

        Builder b = builder(dataDir)
            .exchange(setting(env, "barcache.exchange", "BARCACHE_EXCHANGE", "NSE"))
            .interval(Interval.fromString(setting(env, "barcache.interval", "BARCACHE_INTERVAL", "ONE_DAY")))
            .marketZone(ZoneId.of(setting(env, "barcache.market.zone", "BARCACHE_MARKET_ZONE", "Asia/Kolkata")))
            .holidays(parseDates(setting(env, "barcache.holidays", "BARCACHE_HOLIDAYS", "")))
            .cacheTtl(Duration.ofHours(intSetting(env, "barcache.cache.ttl_hours", "BARCACHE_CACHE_TTL_HOURS", 24)))
            .retryBaseDelay(Duration.ofMillis(intSetting(env, "barcache.retry.base_ms", "BARCACHE_RETRY_BASE_MS", 1000)))
            .retryMaxDelay(Duration.ofMillis(intSetting(env, "barcache.retry.max_ms", "BARCACHE_RETRY_MAX_MS", 32000)))
            .maxRetries(intSetting(env, "barcache.retry.max_retries", "BARCACHE_MAX_RETRIES", 5))
            .maxJitter(Duration.ofMillis(intSetting(env, "barcache.retry.jitter_ms", "BARCACHE_RETRY_JITTER_MS", 250)))
            .breakerThreshold(intSetting(env, "barcache.breaker.threshold", "BARCACHE_BREAKER_THRESHOLD", 5))
            .breakerCooldown(Duration.ofSeconds(intSetting(env, "barcache.breaker.cooldown_s", "BARCACHE_BREAKER_COOLDOWN_S", 60)))
            .callTimeout(Duration.ofSeconds(intSetting(env, "barcache.call.timeout_s", "BARCACHE_CALL_TIMEOUT_S", 30)))
            .minRequestSpacing(Duration.ofMillis(intSetting(env, "barcache.rate.spacing_ms", "BARCACHE_RATE_SPACING_MS", 350)))
            .backfillBatchSize(intSetting(env, "barcache.backfill.batch_size", "BARCACHE_BACKFILL_BATCH_SIZE", 10))
            .backfillBatchPause(Duration.ofSeconds(intSetting(env, "barcache.backfill.batch_pause_s", "BARCACHE_BACKFILL_BATCH_PAUSE_S", 0)))
            .updateLookbackDays(intSetting(env, "barcache.update.lookback_days", "BARCACHE_UPDATE_LOOKBACK_DAYS", 7))
            .freshnessThresholdDays(intSetting(env, "barcache.health.freshness_days", "BARCACHE_HEALTH_FRESHNESS_DAYS", 2))
            .gapThresholdDays(intSetting(env, "barcache.health.gap_days", "BARCACHE_HEALTH_GAP_DAYS", 3))
            .apiBaseUrl(setting(env, "barcache.api.url", "BARCACHE_API_URL", "https://apiconnect.angelbroking.com"))
            .apiKey(setting(env, "barcache.api.key", "BARCACHE_API_KEY", ""))
            .accessToken(setting(env, "barcache.api.token", "BARCACHE_API_TOKEN", ""));

        String masterFile = setting(env, "barcache.instruments", "BARCACHE_INSTRUMENTS", "");
        b.instrumentMasterFile(masterFile.isBlank()
            ? dataDir.resolve("instruments.json")
            : Paths.get(masterFile));
        return b.build();
    }

    private static String setting(Map<String, String> env, String property, String envVar, String defaultValue) {
        return System.getProperty(property, env.getOrDefault(envVar, defaultValue));
    }

    private static int intSetting(Map<String, String> env, String property, String envVar, int defaultValue) {
        String value = setting(env, property, envVar, String.valueOf(defaultValue)).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + property + ": " + value, e);
        }
    }

    static List<LocalDate> parseDates(String csv) {
        List<LocalDate> dates = new ArrayList<>();
        if (csv == null || csv.isBlank()) {
            return dates;
        }
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) continue;
            try {
                dates.add(LocalDate.parse(trimmed));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid holiday date: " + trimmed, e);
            }
        }
        return dates;
    }

    public static Builder builder(Path dataDir) {
        return new Builder(dataDir);
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getDatabasePath() {
        return dataDir.resolve("data").resolve("bars.db");
    }

    public Path getCheckpointPath() {
        return dataDir.resolve("backfill_checkpoint.json");
    }

    public Path getLogDir() {
        return dataDir.resolve("logs");
    }

    public String getExchange() {
        return exchange;
    }

    public Interval getInterval() {
        return interval;
    }

    public ZoneId getMarketZone() {
        return marketZone;
    }

    public List<LocalDate> getHolidays() {
        return holidays;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getMaxJitter() {
        return maxJitter;
    }

    public int getBreakerThreshold() {
        return breakerThreshold;
    }

    public Duration getBreakerCooldown() {
        return breakerCooldown;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public Duration getMinRequestSpacing() {
        return minRequestSpacing;
    }

    public int getBackfillBatchSize() {
        return backfillBatchSize;
    }

    public Duration getBackfillBatchPause() {
        return backfillBatchPause;
    }

    public int getUpdateLookbackDays() {
        return updateLookbackDays;
    }

    public int getFreshnessThresholdDays() {
        return freshnessThresholdDays;
    }

    public int getGapThresholdDays() {
        return gapThresholdDays;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public Path getInstrumentMasterFile() {
        return instrumentMasterFile;
    }

    /**
     * Builder with the production defaults; tests override what they need.
     */
    public static final class Builder {
        private final Path dataDir;
        private String exchange = "NSE";
        private Interval interval = Interval.ONE_DAY;
        private ZoneId marketZone = ZoneId.of("Asia/Kolkata");
        private List<LocalDate> holidays = List.of();
        private Duration cacheTtl = Duration.ofHours(24);
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofSeconds(32);
        private int maxRetries = 5;
        private Duration maxJitter = Duration.ofMillis(250);
        private int breakerThreshold = 5;
        private Duration breakerCooldown = Duration.ofSeconds(60);
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration minRequestSpacing = Duration.ofMillis(350);
        private int backfillBatchSize = 10;
        private Duration backfillBatchPause = Duration.ZERO;
        private int updateLookbackDays = 7;
        private int freshnessThresholdDays = 2;
        private int gapThresholdDays = 3;
        private String apiBaseUrl = "https://apiconnect.angelbroking.com";
        private String apiKey = "";
        private String accessToken = "";
        private Path instrumentMasterFile;

        private Builder(Path dataDir) {
            this.dataDir = dataDir;
            this.instrumentMasterFile = dataDir.resolve("instruments.json");
        }

        public Builder exchange(String exchange) { this.exchange = exchange.trim().toUpperCase(); return this; }
        public Builder interval(Interval interval) { this.interval = interval; return this; }
        public Builder marketZone(ZoneId marketZone) { this.marketZone = marketZone; return this; }
        public Builder holidays(List<LocalDate> holidays) { this.holidays = holidays; return this; }
        public Builder cacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; return this; }
        public Builder retryBaseDelay(Duration d) { this.retryBaseDelay = d; return this; }
        public Builder retryMaxDelay(Duration d) { this.retryMaxDelay = d; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder maxJitter(Duration d) { this.maxJitter = d; return this; }
        public Builder breakerThreshold(int threshold) { this.breakerThreshold = threshold; return this; }
        public Builder breakerCooldown(Duration d) { this.breakerCooldown = d; return this; }
        public Builder callTimeout(Duration d) { this.callTimeout = d; return this; }
        public Builder minRequestSpacing(Duration d) { this.minRequestSpacing = d; return this; }
        public Builder backfillBatchSize(int size) { this.backfillBatchSize = size; return this; }
        public Builder backfillBatchPause(Duration d) { this.backfillBatchPause = d; return this; }
        public Builder updateLookbackDays(int days) { this.updateLookbackDays = days; return this; }
        public Builder freshnessThresholdDays(int days) { this.freshnessThresholdDays = days; return this; }
        public Builder gapThresholdDays(int days) { this.gapThresholdDays = days; return this; }
        public Builder apiBaseUrl(String url) { this.apiBaseUrl = url; return this; }
        public Builder apiKey(String key) { this.apiKey = key; return this; }
        public Builder accessToken(String token) { this.accessToken = token; return this; }
        public Builder instrumentMasterFile(Path file) { this.instrumentMasterFile = file; return this; }

        public BarCacheConfig build() {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            if (breakerThreshold < 1) throw new IllegalArgumentException("breakerThreshold must be >= 1");
            if (backfillBatchSize < 1) throw new IllegalArgumentException("backfillBatchSize must be >= 1");
            return new BarCacheConfig(this);
        }
    }
}
