package com.barcache.service.health;

import com.barcache.core.exception.CacheException;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.backfill.BackfillCheckpoint;
import com.barcache.service.backfill.BackfillProgress;
import com.barcache.service.backfill.CheckpointStore;
import com.barcache.service.calendar.TradingCalendar;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.data.BarCache;
import com.barcache.service.data.CacheStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only checks over the cache: symbol coverage, freshness, gaps and database integrity.
 */
public class CacheHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(CacheHealthMonitor.class);

    static final double CRITICAL_FRESHNESS_PCT = 70.0;
    static final double WARNING_FRESHNESS_PCT = 90.0;
    static final long LARGE_DB_BYTES = 1024L * 1024 * 1024;

    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final BarCache cache;
    private final CheckpointStore checkpoints;
    private final TradingCalendar calendar;
    private final String exchange;
    private final Interval interval;
    private final ZoneId marketZone;
    private final int freshnessThresholdDays;
    private final int gapThresholdDays;
    private final Clock clock;
    private List<String> expectedUniverse = List.of();

    /**
     * @param checkpoints backfill checkpoint to report on, may be null
     */
    public CacheHealthMonitor(BarCache cache, CheckpointStore checkpoints, TradingCalendar calendar,
                              BarCacheConfig config, Clock clock) {
        this.cache = cache;
        this.checkpoints = checkpoints;
        this.calendar = calendar;
        this.exchange = config.getExchange();
        this.interval = config.getInterval();
        this.marketZone = config.getMarketZone();
        this.freshnessThresholdDays = config.getFreshnessThresholdDays();
        this.gapThresholdDays = config.getGapThresholdDays();
        this.clock = clock;
    }

    /**
     * Symbols the cache is expected to hold. When unset, the backfill checkpoint's symbols
     * are used, and failing that the cached symbols themselves.
     */
    public void setExpectedUniverse(List<String> symbols) {
        List<String> normalized = new ArrayList<>();
        for (String s : symbols) {
            normalized.add(s.trim().toUpperCase());
        }
        this.expectedUniverse = normalized;
    }

    public HealthReport report() throws CacheException {
        LocalDate lastTradingDay = calendar.lastTradingDayOnOrBefore(LocalDate.ofInstant(clock.instant(), marketZone));

        List<SeriesKey> series = cache.listSeries(exchange, interval);
        Set<String> cachedSymbols = new LinkedHashSet<>();
        for (SeriesKey key : series) {
            cachedSymbols.add(key.symbol());
        }

        BackfillCheckpoint checkpoint = loadCheckpoint();
        Set<String> universe = resolveUniverse(checkpoint, cachedSymbols);
        int present = 0;
        for (String symbol : universe) {
            if (cachedSymbols.contains(symbol)) present++;
        }
        double coveragePct = universe.isEmpty() ? 0.0 : present * 100.0 / universe.size();

        int fresh = 0;
        List<String> staleSymbols = new ArrayList<>();
        List<DateGap> gaps = new ArrayList<>();
        for (SeriesKey key : series) {
            List<LocalDate> dates = cache.tradingDates(key);
            if (dates.isEmpty()) {
                staleSymbols.add(key.symbol());
                continue;
            }
            if (isFresh(dates.get(dates.size() - 1), lastTradingDay)) {
                fresh++;
            } else {
                staleSymbols.add(key.symbol());
            }
            gaps.addAll(findGaps(key.symbol(), dates));
        }
        double freshnessPct = series.isEmpty() ? 0.0 : fresh * 100.0 / series.size();

        CacheStats stats = cache.stats();
        boolean integrityOk = cache.checkIntegrity();

        HealthStatus status;
        if (freshnessPct < CRITICAL_FRESHNESS_PCT || !integrityOk) {
            status = HealthStatus.CRITICAL;
        } else if (!gaps.isEmpty() || freshnessPct < WARNING_FRESHNESS_PCT) {
            status = HealthStatus.WARNING;
        } else {
            status = HealthStatus.HEALTHY;
        }

        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (series.isEmpty()) {
            issues.add("Cache holds no " + exchange + " " + interval + " series");
            recommendations.add("Run a historical backfill to populate the cache");
        }
        if (!integrityOk) {
            issues.add("SQLite integrity check failed");
            recommendations.add("Restore the database from backup or rebuild it with a full backfill");
        }
        if (!staleSymbols.isEmpty()) {
            issues.add(staleSymbols.size() + " of " + series.size() + " series are stale (more than "
                + freshnessThresholdDays + " trading days behind " + lastTradingDay + ")");
            recommendations.add("Run the incremental update");
        }
        if (!gaps.isEmpty()) {
            issues.add(gaps.size() + " gaps of " + gapThresholdDays + "+ missing trading days detected");
            recommendations.add("Re-run the backfill for the affected symbols");
        }
        if (universe.size() > present) {
            issues.add((universe.size() - present) + " expected symbols are not cached");
        }
        if (stats.dbSizeBytes() > LARGE_DB_BYTES) {
            issues.add(String.format("Database is large (%.0f MB)", stats.dbSizeMb()));
            recommendations.add("Purge stale rows with the cleanup job");
        }

        BackfillProgress backfill = checkpoint == null ? BackfillProgress.none() : BackfillProgress.of(checkpoint);
        if (checkpoint != null && checkpoint.isInProgress()) {
            issues.add("Backfill unfinished: " + checkpoint.remaining().size() + " symbols remaining");
            recommendations.add("Resume the backfill");
        }
        if (checkpoint != null && !checkpoint.failed().isEmpty()) {
            issues.add(checkpoint.failed().size() + " symbols failed in the last backfill");
            recommendations.add("Investigate the failed backfill symbols");
        }

        HealthReport report = new HealthReport(status, clock.instant(), lastTradingDay,
            universe.size(), cachedSymbols.size(), coveragePct,
            series.size(), fresh, freshnessPct, gaps,
            stats.totalRows(), stats.dbSizeBytes(), integrityOk, backfill, issues, recommendations);

        log.info("Cache health {}: coverage {}%, freshness {}%, {} gaps",
            status, Math.round(coveragePct), Math.round(freshnessPct), gaps.size());
        return report;
    }

    public SymbolHealth checkSymbol(String symbol) throws CacheException {
        SeriesKey key = SeriesKey.of(symbol, exchange, interval);
        CoverageSummary summary = cache.coverage(key);
        if (!summary.hasRows()) {
            return new SymbolHealth(key.symbol(), SymbolHealth.Status.NO_DATA, false, false, 0, null, List.of());
        }

        LocalDate lastTradingDay = calendar.lastTradingDayOnOrBefore(LocalDate.ofInstant(clock.instant(), marketZone));
        boolean fresh = isFresh(summary.maxDate(), lastTradingDay);
        List<DateGap> gaps = findGaps(key.symbol(), cache.tradingDates(key));

        SymbolHealth.Status status;
        if (!fresh) {
            status = SymbolHealth.Status.STALE;
        } else if (!gaps.isEmpty()) {
            status = SymbolHealth.Status.HAS_GAPS;
        } else {
            status = SymbolHealth.Status.HEALTHY;
        }
        return new SymbolHealth(key.symbol(), status, fresh, !gaps.isEmpty(), summary.rowCount(),
            summary.maxDate(), gaps);
    }

    private boolean isFresh(LocalDate lastDate, LocalDate lastTradingDay) {
        return calendar.tradingDaysBetween(lastDate, lastTradingDay) <= freshnessThresholdDays;
    }

    /**
     * Runs of at least the gap threshold of trading days with no bar, between the first and last cached date.
     */
    List<DateGap> findGaps(String symbol, List<LocalDate> dates) {
        List<DateGap> gaps = new ArrayList<>();
        for (int i = 1; i < dates.size(); i++) {
            LocalDate previous = dates.get(i - 1);
            LocalDate next = dates.get(i);
            LocalDate firstMissing = null;
            LocalDate lastMissing = null;
            int missing = 0;
            for (LocalDate d = previous.plusDays(1); d.isBefore(next); d = d.plusDays(1)) {
                if (calendar.isTradingDay(d)) {
                    if (firstMissing == null) firstMissing = d;
                    lastMissing = d;
                    missing++;
                }
            }
            if (missing >= gapThresholdDays) {
                gaps.add(new DateGap(symbol, firstMissing, lastMissing, missing));
            }
        }
        return gaps;
    }

    private Set<String> resolveUniverse(BackfillCheckpoint checkpoint, Set<String> cachedSymbols) {
        if (!expectedUniverse.isEmpty()) {
            return new LinkedHashSet<>(expectedUniverse);
        }
        if (checkpoint != null && checkpoint.total() > 0) {
            return new LinkedHashSet<>(checkpoint.allSymbols());
        }
        return cachedSymbols;
    }

    private BackfillCheckpoint loadCheckpoint() {
        if (checkpoints == null) {
            return null;
        }
        try {
            return checkpoints.load();
        } catch (IOException e) {
            log.warn("Ignoring unreadable backfill checkpoint: {}", e.getMessage());
            return null;
        }
    }

    public static String toJson(HealthReport report) throws JsonProcessingException {
        return JSON.writeValueAsString(report);
    }
}
