package com.barcache.service.config;

import com.barcache.core.model.Interval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BarCacheConfigTest {

    @Test
    @DisplayName("Defaults match the production settings")
    void defaults() {
        BarCacheConfig config = BarCacheConfig.load(Map.of("BARCACHE_DATA_DIR", "/tmp/barcache-test"));

        assertEquals(Paths.get("/tmp/barcache-test"), config.getDataDir());
        assertEquals(Paths.get("/tmp/barcache-test", "data", "bars.db"), config.getDatabasePath());
        assertEquals(Paths.get("/tmp/barcache-test", "backfill_checkpoint.json"), config.getCheckpointPath());
        assertEquals("NSE", config.getExchange());
        assertEquals(Interval.ONE_DAY, config.getInterval());
        assertEquals(ZoneId.of("Asia/Kolkata"), config.getMarketZone());
        assertEquals(Duration.ofHours(24), config.getCacheTtl());
        assertEquals(5, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(1), config.getRetryBaseDelay());
        assertEquals(Duration.ofSeconds(32), config.getRetryMaxDelay());
        assertEquals(5, config.getBreakerThreshold());
        assertEquals(Duration.ofSeconds(60), config.getBreakerCooldown());
        assertEquals(10, config.getBackfillBatchSize());
        assertEquals(Paths.get("/tmp/barcache-test", "instruments.json"), config.getInstrumentMasterFile());
        assertTrue(config.getHolidays().isEmpty());
    }

    @Test
    @DisplayName("Environment variables override the defaults")
    void environment() {
        BarCacheConfig config = BarCacheConfig.load(Map.of(
            "BARCACHE_DATA_DIR", "/srv/cache",
            "BARCACHE_EXCHANGE", "bse",
            "BARCACHE_INTERVAL", "five_minute",
            "BARCACHE_CACHE_TTL_HOURS", "6",
            "BARCACHE_MAX_RETRIES", "2",
            "BARCACHE_HOLIDAYS", "2024-01-26, 2024-03-08",
            "BARCACHE_INSTRUMENTS", "/srv/scrip.json"));

        assertEquals("BSE", config.getExchange());
        assertEquals(Interval.FIVE_MINUTE, config.getInterval());
        assertEquals(Duration.ofHours(6), config.getCacheTtl());
        assertEquals(2, config.getMaxRetries());
        assertEquals(List.of(LocalDate.of(2024, 1, 26), LocalDate.of(2024, 3, 8)), config.getHolidays());
        assertEquals(Paths.get("/srv/scrip.json"), config.getInstrumentMasterFile());
    }

    @Test
    @DisplayName("Malformed numbers and dates are rejected with the setting name")
    void invalidValues() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> BarCacheConfig.load(Map.of("BARCACHE_MAX_RETRIES", "many")));
        assertTrue(e.getMessage().contains("barcache.retry.max_retries"));

        assertThrows(IllegalArgumentException.class, () -> BarCacheConfig.parseDates("2024-13-01"));
    }

    @Test
    @DisplayName("Builder refuses impossible values")
    void builderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> BarCacheConfig.builder(Paths.get("/tmp")).breakerThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> BarCacheConfig.builder(Paths.get("/tmp")).maxRetries(-1).build());
    }
}
