package com.barcache.service.fetch;

import com.barcache.core.exception.CacheException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.client.MarketDataClient;
import com.barcache.service.data.BarCache;
import com.barcache.service.data.CacheLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache-first access to historical bars.
 * <p>
 * Fresh cached ranges are served without contacting the provider. Missing or stale
 * sub-ranges are fetched through the resilient executor in provider-sized chunks and
 * written back before the merged result is returned.
 */
public class FetchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FetchCoordinator.class);

    private final BarCache cache;
    private final MarketDataClient client;
    private final ResilientFetchExecutor executor;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong apiCalls = new AtomicLong();
    private final AtomicLong failedApiCalls = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public FetchCoordinator(BarCache cache, MarketDataClient client, ResilientFetchExecutor executor) {
        this.cache = cache;
        this.client = client;
        this.executor = executor;
    }

    public List<BarRecord> fetchWithCache(String symbol, String exchange, Interval interval,
                                          LocalDate from, LocalDate to) throws MarketDataException {
        return fetchWithCache(symbol, exchange, interval, from, to, false);
    }

    /**
     * Bars for [from, to], ordered by timestamp.
     *
     * @param forceRefresh skip the cache lookup and fetch the whole range
     */
    public List<BarRecord> fetchWithCache(String symbol, String exchange, Interval interval,
                                          LocalDate from, LocalDate to, boolean forceRefresh)
            throws MarketDataException {
        SeriesKey key = SeriesKey.of(symbol, exchange, interval);
        DateRange requested = DateRange.of(from, to);
        totalRequests.incrementAndGet();

        List<BarRecord> cached = List.of();
        List<DateRange> toFetch = List.of(requested);

        if (!forceRefresh) {
            CacheLookup lookup = lookup(key, requested);
            if (lookup != null) {
                if (lookup.fullyFresh()) {
                    cacheHits.incrementAndGet();
                    log.debug("Cache hit {} {} ({} bars)", key, requested, lookup.rows().size());
                    return lookup.rows();
                }
                cached = lookup.rows();
                toFetch = lookup.missingRanges();
            }
        }
        cacheMisses.incrementAndGet();

        Map<Instant, BarRecord> merged = new TreeMap<>();
        for (BarRecord bar : cached) {
            merged.put(bar.timestamp(), bar);
        }

        try {
            for (DateRange gap : toFetch) {
                for (DateRange chunk : gap.splitByDays(interval.getMaxDaysPerRequest())) {
                    List<BarRecord> fetched = fetchChunk(key, chunk);
                    store(key, chunk, fetched);
                    for (BarRecord bar : fetched) {
                        merged.put(bar.timestamp(), bar);
                    }
                }
            }
        } catch (MarketDataException e) {
            errors.incrementAndGet();
            throw e;
        }

        List<BarRecord> result = new ArrayList<>(merged.size());
        for (BarRecord bar : merged.values()) {
            if (requested.contains(bar.tradeDate())) {
                result.add(bar);
            }
        }
        log.debug("Cache miss {} {}: fetched {}, returning {} bars", key, requested, toFetch, result.size());
        return result;
    }

    private CacheLookup lookup(SeriesKey key, DateRange requested) {
        try {
            return cache.get(key, requested.from(), requested.to());
        } catch (CacheException e) {
            log.warn("Cache read failed for {}, fetching full range: {}", key, e.getMessage());
            return null;
        }
    }

    private List<BarRecord> fetchChunk(SeriesKey key, DateRange chunk) throws MarketDataException {
        return executor.execute("fetch " + key + " " + chunk, () -> {
            apiCalls.incrementAndGet();
            try {
                return client.fetchOhlcv(key.symbol(), key.exchange(), key.interval(), chunk.from(), chunk.to());
            } catch (MarketDataException | RuntimeException e) {
                failedApiCalls.incrementAndGet();
                throw e;
            }
        });
    }

    private void store(SeriesKey key, DateRange chunk, List<BarRecord> fetched) {
        try {
            cache.put(key, chunk, fetched);
        } catch (CacheException e) {
            errors.incrementAndGet();
            log.warn("Cache write failed for {} {}, returning fetched data anyway: {}", key, chunk, e.getMessage());
        }
    }

    /**
     * Fetch several symbols one after another. A failing symbol becomes a failed outcome
     * and does not stop the batch. Results keep the input order.
     */
    public Map<String, FetchOutcome> fetchBatch(List<String> symbols, String exchange, Interval interval,
                                                LocalDate from, LocalDate to) {
        Map<String, FetchOutcome> outcomes = new LinkedHashMap<>();
        for (String symbol : symbols) {
            outcomes.put(symbol, fetchOne(symbol, exchange, interval, from, to));
        }
        logBatch(outcomes);
        return outcomes;
    }

    /**
     * Fetch several symbols on a bounded pool. Every worker shares this coordinator's
     * executor, so the circuit breaker and the request spacing apply across all of them.
     */
    public Map<String, FetchOutcome> fetchBatch(List<String> symbols, String exchange, Interval interval,
                                                LocalDate from, LocalDate to, int parallelism)
            throws InterruptedException {
        if (parallelism <= 1) {
            return fetchBatch(symbols, exchange, interval, from, to);
        }

        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try {
            Map<String, Future<FetchOutcome>> futures = new LinkedHashMap<>();
            for (String symbol : symbols) {
                futures.put(symbol, pool.submit(() -> fetchOne(symbol, exchange, interval, from, to)));
            }

            Map<String, FetchOutcome> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, Future<FetchOutcome>> entry : futures.entrySet()) {
                try {
                    outcomes.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    outcomes.put(entry.getKey(), FetchOutcome.failure(entry.getKey(), String.valueOf(e.getCause())));
                }
            }
            logBatch(outcomes);
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private FetchOutcome fetchOne(String symbol, String exchange, Interval interval, LocalDate from, LocalDate to) {
        try {
            return FetchOutcome.success(symbol, fetchWithCache(symbol, exchange, interval, from, to));
        } catch (MarketDataException | RuntimeException e) {
            log.warn("Fetch failed for {}: {}", symbol, e.getMessage());
            return FetchOutcome.failure(symbol, e.getMessage());
        }
    }

    private void logBatch(Map<String, FetchOutcome> outcomes) {
        long ok = outcomes.values().stream().filter(FetchOutcome::isSuccess).count();
        log.info("Batch fetch finished: {}/{} symbols succeeded", ok, outcomes.size());
    }

    /**
     * Populate the cache for a symbol list ahead of use.
     */
    public WarmupSummary warmCache(List<String> symbols, String exchange, Interval interval,
                                   LocalDate from, LocalDate to) {
        log.info("Warming cache for {} symbols {} .. {}", symbols.size(), from, to);
        Map<String, FetchOutcome> outcomes = fetchBatch(symbols, exchange, interval, from, to);

        List<String> failed = new ArrayList<>();
        for (FetchOutcome outcome : outcomes.values()) {
            if (!outcome.isSuccess()) {
                failed.add(outcome.symbol());
            }
        }
        WarmupSummary summary = new WarmupSummary(outcomes.size(), outcomes.size() - failed.size(),
            failed.size(), failed);
        log.info("Cache warm-up done: {} ok, {} failed", summary.successful(), summary.failed());
        return summary;
    }

    public FetchStatistics getStatistics() {
        return new FetchStatistics(
            totalRequests.get(),
            cacheHits.get(),
            cacheMisses.get(),
            apiCalls.get(),
            failedApiCalls.get(),
            errors.get()
        );
    }

    public void resetStatistics() {
        totalRequests.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        apiCalls.set(0);
        failedApiCalls.set(0);
        errors.set(0);
    }

    public BarCache getCache() {
        return cache;
    }
}
