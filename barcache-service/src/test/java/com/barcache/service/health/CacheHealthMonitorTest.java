package com.barcache.service.health;

import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.backfill.BackfillCheckpoint;
import com.barcache.service.backfill.CheckpointStore;
import com.barcache.service.calendar.TradingCalendar;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.data.sqlite.SqliteBarCache;
import com.barcache.service.support.FakeMarketDataClient;
import com.barcache.service.support.MutableClock;
import com.barcache.service.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheHealthMonitorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);
    private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private BarCacheConfig config;
    private SqliteBarCache cache;
    private CheckpointStore checkpoints;
    private CacheHealthMonitor monitor;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-01-10T12:00:00Z"));
        config = TestFixtures.config(tempDir);
        cache = new SqliteBarCache(config.getDatabasePath(), config.getCacheTtl(), clock);
        checkpoints = new CheckpointStore(config.getCheckpointPath());
        monitor = new CacheHealthMonitor(cache, checkpoints, TradingCalendar.weekdaysOnly(), config, clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private void seed(String symbol, LocalDate from, LocalDate to) throws Exception {
        SeriesKey key = SeriesKey.of(symbol, "NSE", Interval.ONE_DAY);
        cache.put(FakeMarketDataClient.dailyBars(key, from, to, 0));
    }

    @Nested
    @DisplayName("Report")
    class ReportTests {

        @Test
        @DisplayName("Empty cache is critical")
        void emptyIsCritical() throws Exception {
            HealthReport report = monitor.report();

            assertEquals(HealthStatus.CRITICAL, report.status());
            assertEquals(0, report.seriesChecked());
            assertEquals(1, report.exitCode());
            assertFalse(report.issues().isEmpty());
            assertFalse(report.recommendations().isEmpty());
        }

        @Test
        @DisplayName("Fresh, gap-free cache is healthy")
        void healthy() throws Exception {
            seed("RELIANCE", JAN_1, JAN_10);
            seed("TCS", JAN_1, JAN_10);

            HealthReport report = monitor.report();

            assertEquals(HealthStatus.HEALTHY, report.status());
            assertEquals(JAN_10, report.lastTradingDay());
            assertEquals(100.0, report.coveragePct(), 1e-9);
            assertEquals(100.0, report.freshnessPct(), 1e-9);
            assertEquals(16, report.totalRows());
            assertTrue(report.integrityOk());
            assertEquals(0, report.exitCode());
        }

        @Test
        @DisplayName("A few stale series is a warning, many is critical")
        void staleness() throws Exception {
            for (int i = 0; i < 8; i++) {
                seed("FRESH" + i, JAN_1, JAN_10);
            }
            seed("OLD1", JAN_1, JAN_3);
            seed("OLD2", JAN_1, JAN_3);

            HealthReport warning = monitor.report();
            assertEquals(HealthStatus.WARNING, warning.status());
            assertEquals(80.0, warning.freshnessPct(), 1e-9);

            seed("OLD3", JAN_1, JAN_3);
            seed("OLD4", JAN_1, JAN_3);
            seed("OLD5", JAN_1, JAN_3);
            HealthReport critical = monitor.report();
            assertEquals(HealthStatus.CRITICAL, critical.status());
        }

        @Test
        @DisplayName("Runs of missing trading days are reported as gaps")
        void gaps() throws Exception {
            seed("RELIANCE", JAN_1, LocalDate.of(2024, 1, 2));
            seed("RELIANCE", LocalDate.of(2024, 1, 8), JAN_10);

            HealthReport report = monitor.report();

            assertEquals(HealthStatus.WARNING, report.status());
            assertEquals(List.of(new DateGap("RELIANCE", JAN_3, LocalDate.of(2024, 1, 5), 3)), report.gaps());
            assertEquals(1, report.detectedGaps());
        }

        @Test
        @DisplayName("Short holes below the threshold are not gaps")
        void shortHole() {
            List<DateGap> gaps = monitor.findGaps("TCS",
                List.of(JAN_1, LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 8)));

            assertTrue(gaps.isEmpty());
        }

        @Test
        @DisplayName("Expected symbols come from the backfill checkpoint")
        void universeFromCheckpoint() throws Exception {
            seed("RELIANCE", JAN_1, JAN_10);
            checkpoints.save(BackfillCheckpoint.start("NSE", Interval.ONE_DAY, DateRange.of(JAN_1, JAN_10),
                    List.of("RELIANCE", "TCS", "INFY"), clock.instant())
                .withCompleted("RELIANCE", clock.instant()));

            HealthReport report = monitor.report();

            assertEquals(3, report.expectedSymbols());
            assertEquals(1, report.cachedSymbols());
            assertEquals(100.0 / 3, report.coveragePct(), 1e-9);
            assertEquals(BackfillCheckpoint.Status.IN_PROGRESS, report.backfill().status());
            assertTrue(report.issues().stream().anyMatch(i -> i.startsWith("Backfill unfinished")));
        }

        @Test
        @DisplayName("An explicit universe overrides the checkpoint")
        void explicitUniverse() throws Exception {
            seed("RELIANCE", JAN_1, JAN_10);
            monitor.setExpectedUniverse(List.of("reliance", "tcs"));

            HealthReport report = monitor.report();

            assertEquals(2, report.expectedSymbols());
            assertEquals(50.0, report.coveragePct(), 1e-9);
        }

        @Test
        @DisplayName("Holidays move the expected last trading day")
        void holidayCalendar() throws Exception {
            seed("RELIANCE", JAN_1, LocalDate.of(2024, 1, 9));
            CacheHealthMonitor withHoliday = new CacheHealthMonitor(cache, null,
                new TradingCalendar(List.of(JAN_10)), config, clock);

            HealthReport report = withHoliday.report();

            assertEquals(LocalDate.of(2024, 1, 9), report.lastTradingDay());
            assertEquals(HealthStatus.HEALTHY, report.status());
        }

        @Test
        @DisplayName("Report serializes to JSON with ISO dates")
        void json() throws Exception {
            seed("RELIANCE", JAN_1, JAN_10);

            String json = CacheHealthMonitor.toJson(monitor.report());

            assertTrue(json.contains("\"status\" : \"HEALTHY\""));
            assertTrue(json.contains("\"lastTradingDay\" : \"2024-01-10\""));
            assertTrue(json.contains("\"generatedAt\" : \"2024-01-10T12:00:00Z\""));
        }
    }

    @Nested
    @DisplayName("Single symbol")
    class SymbolTests {

        @Test
        @DisplayName("Unknown symbol has no data")
        void noData() throws Exception {
            assertEquals(SymbolHealth.Status.NO_DATA, monitor.checkSymbol("NOPE").status());
        }

        @Test
        @DisplayName("Symbol more than the threshold behind is stale")
        void stale() throws Exception {
            seed("TCS", JAN_1, JAN_3);

            SymbolHealth health = monitor.checkSymbol("tcs");

            assertEquals(SymbolHealth.Status.STALE, health.status());
            assertFalse(health.fresh());
            assertEquals(JAN_3, health.lastDate());
        }

        @Test
        @DisplayName("Fresh symbol with a hole has gaps")
        void hasGaps() throws Exception {
            seed("INFY", JAN_1, LocalDate.of(2024, 1, 2));
            seed("INFY", LocalDate.of(2024, 1, 8), JAN_10);

            SymbolHealth health = monitor.checkSymbol("INFY");

            assertEquals(SymbolHealth.Status.HAS_GAPS, health.status());
            assertTrue(health.hasGaps());
            assertEquals(1, health.gaps().size());
        }

        @Test
        @DisplayName("Fresh complete symbol is healthy")
        void healthy() throws Exception {
            seed("RELIANCE", JAN_1, JAN_10);

            SymbolHealth health = monitor.checkSymbol("RELIANCE");

            assertEquals(SymbolHealth.Status.HEALTHY, health.status());
            assertEquals(8, health.rowCount());
        }
    }
}
