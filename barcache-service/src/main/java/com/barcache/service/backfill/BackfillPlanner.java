package com.barcache.service.backfill;

import com.barcache.core.exception.CacheException;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.calendar.TradingCalendar;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.data.BarCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dry run of a backfill: reports the trading days each symbol is missing without
 * calling the provider or writing anything.
 */
public class BackfillPlanner {

    private static final Logger log = LoggerFactory.getLogger(BackfillPlanner.class);

    private final BarCache cache;
    private final TradingCalendar calendar;
    private final String exchange;
    private final Interval interval;
    private final ZoneId marketZone;
    private final Clock clock;

    public BackfillPlanner(BarCache cache, TradingCalendar calendar, BarCacheConfig config, Clock clock) {
        this.cache = cache;
        this.calendar = calendar;
        this.exchange = config.getExchange();
        this.interval = config.getInterval();
        this.marketZone = config.getMarketZone();
        this.clock = clock;
    }

    /**
     * Trading days in [from, to] with no cached bar for {@code symbol}.
     */
    public List<LocalDate> detectGaps(String symbol, LocalDate from, LocalDate to) throws CacheException {
        SeriesKey key = SeriesKey.of(symbol, exchange, interval);
        Set<LocalDate> cached = new HashSet<>(cache.tradingDates(key));
        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate day : calendar.tradingDays(DateRange.of(from, to))) {
            if (!cached.contains(day)) {
                missing.add(day);
            }
        }
        return missing;
    }

    /**
     * The plan for backfilling [today - years, today], same range as a fresh run would use.
     */
    public BackfillPlan plan(List<String> symbols, int years) throws CacheException {
        if (years < 1) {
            throw new IllegalArgumentException("years must be >= 1");
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), marketZone);
        DateRange range = DateRange.of(today.minusYears(years), today);
        int tradingDays = calendar.tradingDays(range).size();

        List<BackfillPlan.SymbolPlan> plans = new ArrayList<>();
        for (String symbol : HistoricalBackfillManager.normalize(symbols)) {
            List<LocalDate> missing = detectGaps(symbol, range.from(), range.to());
            plans.add(new BackfillPlan.SymbolPlan(symbol, tradingDays, missing));
            log.debug("Dry run {}: {} of {} trading days missing", symbol, missing.size(), tradingDays);
        }

        BackfillPlan plan = new BackfillPlan(range, plans);
        log.info("Dry run {} {} {}: {} of {} symbols need fetching, {} trading days missing",
            exchange, interval, range, plan.symbolsToFetch().size(), plans.size(), plan.totalMissingDays());
        return plan;
    }
}
