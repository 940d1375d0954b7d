package com.barcache.service.update;

import com.barcache.core.exception.CacheException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.calendar.TradingCalendar;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.data.BarCache;
import com.barcache.service.fetch.FetchCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings cached series up to today by requesting only the days after the newest cached bar.
 */
public class IncrementalUpdater {

    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

    private final FetchCoordinator coordinator;
    private final BarCache cache;
    private final TradingCalendar calendar;
    private final String exchange;
    private final Interval interval;
    private final ZoneId marketZone;
    private final int lookbackDays;
    private final Clock clock;

    public IncrementalUpdater(FetchCoordinator coordinator, BarCache cache, TradingCalendar calendar,
                              BarCacheConfig config, Clock clock) {
        this.coordinator = coordinator;
        this.cache = cache;
        this.calendar = calendar;
        this.exchange = config.getExchange();
        this.interval = config.getInterval();
        this.marketZone = config.getMarketZone();
        this.lookbackDays = config.getUpdateLookbackDays();
        this.clock = clock;
    }

    public UpdateResult run(List<String> symbols) {
        LocalDate today = today();
        int updated = 0;
        int upToDate = 0;
        long bars = 0;
        Map<String, String> failures = new LinkedHashMap<>();

        log.info("Incremental update of {} symbols through {}", symbols.size(), today);
        for (String symbol : symbols) {
            try {
                SeriesKey key = SeriesKey.of(symbol, exchange, interval);
                CoverageSummary summary = cache.coverage(key);
                LocalDate from = summary.maxDate() != null
                    ? summary.maxDate().plusDays(1)
                    : today.minusDays(lookbackDays);

                if (from.isAfter(today)) {
                    upToDate++;
                    log.debug("{} already has {}, skipping", key, summary.maxDate());
                    continue;
                }

                List<BarRecord> received = coordinator.fetchWithCache(key.symbol(), exchange, interval, from, today);
                bars += received.size();
                updated++;
                log.debug("Updated {} {} .. {}: {} bars", key, from, today, received.size());
            } catch (CacheException | MarketDataException | RuntimeException e) {
                failures.put(symbol, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.warn("Incremental update failed for {}: {}", symbol, e.getMessage());
            }
        }

        UpdateResult result = new UpdateResult(symbols.size(), updated, upToDate, bars, failures);
        log.info("Incremental update done: {} updated, {} up to date, {} failed, {} bars",
            result.updated(), result.upToDate(), result.failed(), result.barsReceived());
        return result;
    }

    /**
     * Update every series of the configured exchange and interval that is already cached.
     */
    public UpdateResult runAll() throws CacheException {
        List<String> symbols = new ArrayList<>();
        for (SeriesKey key : cache.listSeries(exchange, interval)) {
            symbols.add(key.symbol());
        }
        return run(symbols);
    }

    public UpdateStatus getUpdateStatus(String symbol) throws CacheException {
        SeriesKey key = SeriesKey.of(symbol, exchange, interval);
        CoverageSummary summary = cache.coverage(key);
        if (summary.maxDate() == null) {
            return new UpdateStatus(key.symbol(), false, null, -1, true);
        }
        LocalDate lastTradingDay = calendar.lastTradingDayOnOrBefore(today());
        int daysStale = calendar.tradingDaysBetween(summary.maxDate(), lastTradingDay);
        return new UpdateStatus(key.symbol(), true, summary.maxDate(), daysStale, daysStale > 0);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), marketZone);
    }
}
