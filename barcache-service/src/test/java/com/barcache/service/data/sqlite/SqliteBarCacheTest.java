package com.barcache.service.data.sqlite;

import com.barcache.core.model.BarRecord;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.data.CacheLookup;
import com.barcache.service.data.CacheStats;
import com.barcache.service.support.FakeMarketDataClient;
import com.barcache.service.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteBarCacheTest {

    private static final SeriesKey RELIANCE = SeriesKey.of("RELIANCE", "NSE", Interval.ONE_DAY);
    private static final SeriesKey TCS = SeriesKey.of("TCS", "NSE", Interval.ONE_DAY);
    private static final Duration TTL = Duration.ofHours(24);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteBarCache cache;
    private Path dbFile;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-01-10T12:00:00Z"));
        dbFile = tempDir.resolve("data").resolve("bars.db");
        cache = new SqliteBarCache(dbFile, TTL, clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private static LocalDate d(String iso) {
        return LocalDate.parse(iso);
    }

    private static List<BarRecord> bars(SeriesKey key, String from, String to) {
        return FakeMarketDataClient.dailyBars(key, d(from), d(to), 0);
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("Upserting the same bar twice keeps one row with the later value")
        void upsertIsIdempotent() throws Exception {
            BarRecord first = bars(RELIANCE, "2024-01-08", "2024-01-08").get(0);
            cache.put(List.of(first));
            Instant firstWrite = clock.instant();

            clock.advance(Duration.ofMinutes(5));
            BarRecord second = new BarRecord(first.symbol(), first.exchange(), first.interval(), first.timestamp(),
                first.tradeDate(), 1, 2, 0.5, 1.5, 42, null);
            cache.put(List.of(second));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-08"), d("2024-01-08"));
            assertEquals(1, lookup.rows().size());
            BarRecord stored = lookup.rows().get(0);
            assertEquals(1.5, stored.close());
            assertEquals(42, stored.volume());
            assertTrue(stored.cachedAt().isAfter(firstWrite));
            assertEquals(1, cache.stats().totalRows());
        }

        @Test
        @DisplayName("Bulk insert spanning several statement batches")
        void bulkInsert() throws Exception {
            List<BarRecord> rows = new ArrayList<>();
            LocalDate start = d("2010-01-01");
            for (int i = 0; i < 2500; i++) {
                LocalDate day = start.plusDays(i);
                rows.add(BarRecord.of(RELIANCE, day.atStartOfDay(FakeMarketDataClient.MARKET_ZONE).toInstant(),
                    FakeMarketDataClient.MARKET_ZONE, 10, 11, 9, 10.5, i));
            }

            assertEquals(2500, cache.put(rows));

            CoverageSummary summary = cache.coverage(RELIANCE);
            assertEquals(2500, summary.rowCount());
            assertEquals(start, summary.minDate());
            assertEquals(start.plusDays(2499), summary.maxDate());
        }

        @Test
        @DisplayName("Rows survive closing and reopening the database")
        void durableAcrossReopen() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-05")), bars(RELIANCE, "2024-01-01", "2024-01-05"));
            cache.close();

            cache = new SqliteBarCache(dbFile, TTL, clock);
            assertEquals(5, cache.coverage(RELIANCE).rowCount());
        }

        @Test
        @DisplayName("Schema has indexes for series lookups and purges")
        void schemaHasIndexes() throws Exception {
            int indexes = 0;
            try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
                 Statement stmt = c.createStatement();
                 ResultSet rs = stmt.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = 'bars' AND name LIKE 'idx_%'")) {
                while (rs.next()) {
                    indexes++;
                }
            }
            assertTrue(indexes >= 2, "expected at least two explicit indexes on bars");
        }
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Fetched range inside the TTL is fully fresh")
        void freshRangeIsHit() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-10"));

            assertTrue(lookup.fullyFresh());
            assertEquals(8, lookup.rows().size());
        }

        @Test
        @DisplayName("Only the uncovered tail is reported missing")
        void uncoveredTailIsMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-15"));

            assertFalse(lookup.fullyFresh());
            assertEquals(List.of(DateRange.of(d("2024-01-11"), d("2024-01-15"))), lookup.missingRanges());
            assertEquals(8, lookup.rows().size());
        }

        @Test
        @DisplayName("Holes between fetched ranges are reported")
        void holesAreMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-03")), bars(RELIANCE, "2024-01-01", "2024-01-03"));
            cache.put(RELIANCE, DateRange.of(d("2024-01-08"), d("2024-01-10")), bars(RELIANCE, "2024-01-08", "2024-01-10"));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-10"));

            assertEquals(List.of(DateRange.of(d("2024-01-04"), d("2024-01-07"))), lookup.missingRanges());
        }

        @Test
        @DisplayName("A weekend between cached bars counts as covered")
        void weekendInsideCoverageIsHit() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-06"), d("2024-01-07"));

            assertTrue(lookup.fullyFresh());
            assertTrue(lookup.rows().isEmpty());
        }

        @Test
        @DisplayName("Fetched days with no bars after the newest bar are asked for again")
        void emptyTrailingCoverageIsMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-09")), bars(RELIANCE, "2024-01-01", "2024-01-09"));
            cache.put(RELIANCE, DateRange.singleDay(d("2024-01-10")), List.of());
            clock.advance(Duration.ofHours(2));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-11"));

            assertEquals(d("2024-01-10"), cache.coverage(RELIANCE).coveredThrough());
            assertEquals(List.of(DateRange.of(d("2024-01-10"), d("2024-01-11"))), lookup.missingRanges());
            assertEquals(7, lookup.rows().size());
        }

        @Test
        @DisplayName("A range holding only empty fetches is never fresh")
        void emptyOnlyCoverageIsMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-06"), d("2024-01-07")), List.of());

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-06"), d("2024-01-07"));

            assertFalse(lookup.fullyFresh());
            assertEquals(List.of(DateRange.of(d("2024-01-06"), d("2024-01-07"))), lookup.missingRanges());
            assertEquals(d("2024-01-07"), cache.coverage(RELIANCE).coveredThrough());
        }

        @Test
        @DisplayName("After the TTL the whole requested range is stale")
        void staleSeriesIsMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));
            clock.advance(Duration.ofHours(25));

            CacheLookup tail = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-10"));

            assertEquals(List.of(DateRange.of(d("2024-01-01"), d("2024-01-10"))), tail.missingRanges());
            assertEquals(8, tail.rows().size());
        }

        @Test
        @DisplayName("A stale series is not a hit for a range ending before its newest bar")
        void staleHistoryIsMissing() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));
            assertTrue(cache.get(RELIANCE, d("2024-01-01"), d("2024-01-05")).fullyFresh());

            clock.advance(Duration.ofHours(48));
            CacheLookup history = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-05"));

            assertFalse(history.fullyFresh());
            assertEquals(List.of(DateRange.of(d("2024-01-01"), d("2024-01-05"))), history.missingRanges());
            assertEquals(5, history.rows().size());
        }

        @Test
        @DisplayName("Filling an old hole does not refresh a stale series")
        void backfillDoesNotRefreshTail() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));
            clock.advance(Duration.ofHours(25));
            cache.put(RELIANCE, DateRange.of(d("2023-12-20"), d("2023-12-31")), bars(RELIANCE, "2023-12-20", "2023-12-31"));

            CacheLookup lookup = cache.get(RELIANCE, d("2023-12-20"), d("2023-12-29"));

            assertEquals(List.of(DateRange.of(d("2023-12-20"), d("2023-12-29"))), lookup.missingRanges());
        }

        @Test
        @DisplayName("Refetching the newest bar makes the series fresh again")
        void refetchedTailIsFresh() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));
            clock.advance(Duration.ofHours(25));
            cache.put(RELIANCE, DateRange.singleDay(d("2024-01-10")), bars(RELIANCE, "2024-01-10", "2024-01-10"));

            assertTrue(cache.get(RELIANCE, d("2024-01-01"), d("2024-01-05")).fullyFresh());
        }

        @Test
        @DisplayName("Unknown series is an empty lookup, not an error")
        void unknownSeries() throws Exception {
            CacheLookup lookup = cache.get(TCS, d("2024-01-01"), d("2024-01-10"));

            assertTrue(lookup.rows().isEmpty());
            assertEquals(List.of(DateRange.of(d("2024-01-01"), d("2024-01-10"))), lookup.missingRanges());
            assertTrue(cache.coverage(TCS).isEmpty());
        }

        @Test
        @DisplayName("Series listing and trade dates")
        void listing() throws Exception {
            cache.put(bars(RELIANCE, "2024-01-01", "2024-01-03"));
            cache.put(bars(TCS, "2024-01-04", "2024-01-05"));
            cache.put(bars(SeriesKey.of("INFY", "BSE", Interval.ONE_DAY), "2024-01-04", "2024-01-05"));

            assertEquals(List.of(RELIANCE, TCS), cache.listSeries("NSE", Interval.ONE_DAY));
            assertEquals(3, cache.listSeries(null, null).size());
            assertEquals(List.of(d("2024-01-04"), d("2024-01-05")), cache.tradingDates(TCS));
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Purge removes old rows and shrinks coverage to what remains")
        void purgeStale() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-05")), bars(RELIANCE, "2024-01-01", "2024-01-05"));
            cache.put(TCS, DateRange.of(d("2024-01-01"), d("2024-01-05")), bars(TCS, "2024-01-01", "2024-01-05"));
            clock.advance(Duration.ofDays(10));
            cache.put(RELIANCE, DateRange.of(d("2024-01-08"), d("2024-01-10")), bars(RELIANCE, "2024-01-08", "2024-01-10"));

            int deleted = cache.purgeStale(Duration.ofDays(5));

            assertEquals(10, deleted);
            assertTrue(cache.coverage(TCS).isEmpty());
            CoverageSummary reliance = cache.coverage(RELIANCE);
            assertEquals(3, reliance.rowCount());
            assertEquals(d("2024-01-08"), reliance.minDate());
            assertEquals(List.of(DateRange.of(d("2024-01-01"), d("2024-01-07"))),
                cache.get(RELIANCE, d("2024-01-01"), d("2024-01-10")).missingRanges());
        }

        @Test
        @DisplayName("Invalidating a symbol drops its rows and coverage")
        void invalidateSymbol() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-05")), bars(RELIANCE, "2024-01-01", "2024-01-05"));
            cache.put(TCS, DateRange.of(d("2024-01-01"), d("2024-01-05")), bars(TCS, "2024-01-01", "2024-01-05"));

            assertEquals(5, cache.invalidate("reliance"));

            assertTrue(cache.coverage(RELIANCE).isEmpty());
            assertEquals(5, cache.coverage(TCS).rowCount());
        }

        @Test
        @DisplayName("Invalidating before a date trims rows and coverage")
        void invalidateBefore() throws Exception {
            cache.put(RELIANCE, DateRange.of(d("2024-01-01"), d("2024-01-10")), bars(RELIANCE, "2024-01-01", "2024-01-10"));

            assertEquals(3, cache.invalidateBefore(d("2024-01-04")));

            CacheLookup lookup = cache.get(RELIANCE, d("2024-01-01"), d("2024-01-10"));
            assertEquals(List.of(DateRange.of(d("2024-01-01"), d("2024-01-03"))), lookup.missingRanges());
            assertEquals(d("2024-01-04"), cache.coverage(RELIANCE).minDate());
        }

        @Test
        @DisplayName("Invalidate all empties the cache")
        void invalidateAll() throws Exception {
            cache.put(bars(RELIANCE, "2024-01-01", "2024-01-05"));
            cache.put(bars(TCS, "2024-01-01", "2024-01-02"));

            assertEquals(7, cache.invalidateAll());
            assertEquals(0, cache.stats().totalRows());
            assertTrue(cache.listSeries(null, null).isEmpty());
        }

        @Test
        @DisplayName("Stats count rows, symbols and series")
        void stats() throws Exception {
            cache.put(bars(RELIANCE, "2024-01-01", "2024-01-05"));
            cache.put(bars(TCS, "2024-01-01", "2024-01-02"));
            cache.put(bars(SeriesKey.of("TCS", "BSE", Interval.ONE_DAY), "2024-01-01", "2024-01-02"));

            CacheStats stats = cache.stats();

            assertEquals(9, stats.totalRows());
            assertEquals(2, stats.uniqueSymbols());
            assertEquals(3, stats.seriesCount());
            assertTrue(stats.dbSizeBytes() > 0);
            assertTrue(cache.checkIntegrity());
        }
    }
}
