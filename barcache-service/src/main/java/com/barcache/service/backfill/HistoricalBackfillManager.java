package com.barcache.service.backfill;

import com.barcache.core.exception.MarketDataException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.barcache.service.config.BarCacheConfig;
import com.barcache.service.fetch.FetchCoordinator;
import com.barcache.service.fetch.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Populates multi-year history for a symbol list, one symbol at a time.
 * <p>
 * The checkpoint is rewritten after every symbol, so the process can be killed at any
 * point and a later run with {@code resume=true} continues with the symbols not yet attempted.
 * Symbols that failed stay failed for the rest of the run and are not retried on resume.
 */
public class HistoricalBackfillManager {

    private static final Logger log = LoggerFactory.getLogger(HistoricalBackfillManager.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    private final FetchCoordinator coordinator;
    private final CheckpointStore checkpoints;
    private final String exchange;
    private final Interval interval;
    private final ZoneId marketZone;
    private final Duration batchPause;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile BackfillCheckpoint current;
    private BackfillListener listener = BackfillListener.NONE;
    private boolean clearOnCompletion;

    public HistoricalBackfillManager(FetchCoordinator coordinator, CheckpointStore checkpoints,
                                     BarCacheConfig config, Clock clock, Sleeper sleeper) {
        this.coordinator = coordinator;
        this.checkpoints = checkpoints;
        this.exchange = config.getExchange();
        this.interval = config.getInterval();
        this.marketZone = config.getMarketZone();
        this.batchPause = config.getBackfillBatchPause();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void setListener(BackfillListener listener) {
        this.listener = listener != null ? listener : BackfillListener.NONE;
    }

    public void setClearOnCompletion(boolean clearOnCompletion) {
        this.clearOnCompletion = clearOnCompletion;
    }

    public BackfillResult run(List<String> symbols, int years) throws IOException, InterruptedException {
        return run(symbols, years, DEFAULT_BATCH_SIZE, true);
    }

    /**
     * Backfill [today - years, today] for every symbol.
     *
     * @param batchSize symbols between optional pauses
     * @param resume    continue an unfinished run instead of starting over
     * @throws IOException          the checkpoint could not be read or written
     * @throws InterruptedException interrupted during a pause between batches
     */
    public BackfillResult run(List<String> symbols, int years, int batchSize, boolean resume)
            throws IOException, InterruptedException {
        if (years < 1) {
            throw new IllegalArgumentException("years must be >= 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }

        long startNanos = System.nanoTime();
        BackfillCheckpoint checkpoint = resume ? checkpoints.load() : null;
        boolean resumed = checkpoint != null && checkpoint.isInProgress();

        if (resumed) {
            log.info("Resuming backfill {} for {} remaining of {} symbols ({} done, {} failed)",
                checkpoint.dateRange(), checkpoint.remaining().size(), checkpoint.total(),
                checkpoint.completed().size(), checkpoint.failed().size());
        } else {
            LocalDate today = LocalDate.ofInstant(clock.instant(), marketZone);
            DateRange range = DateRange.of(today.minusYears(years), today);
            checkpoint = BackfillCheckpoint.start(exchange, interval, range, normalize(symbols), clock.instant());
            checkpoints.save(checkpoint);
            log.info("Starting backfill {} {} {} for {} symbols",
                exchange, interval, range, checkpoint.remaining().size());
        }
        current = checkpoint;

        List<String> queue = new ArrayList<>(checkpoint.remaining());
        int processed = 0;
        for (String symbol : queue) {
            checkpoint = processSymbol(checkpoint, symbol);
            processed++;

            if (processed % batchSize == 0 && processed < queue.size() && !batchPause.isZero()) {
                log.info("Backfill batch done ({}/{}), pausing {}s", processed, queue.size(), batchPause.toSeconds());
                sleeper.sleep(batchPause);
            }
        }

        checkpoint = checkpoint.complete(clock.instant());
        checkpoints.save(checkpoint);
        current = checkpoint;
        if (clearOnCompletion) {
            checkpoints.clear();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        BackfillResult result = new BackfillResult(checkpoint.dateRange(), checkpoint.total(),
            checkpoint.completed().size(), checkpoint.failed(), resumed, processed, elapsed);
        log.info("Backfill finished: {}/{} completed, {} failed in {}s",
            result.completed(), result.total(), result.failed().size(), elapsed.toSeconds());
        return result;
    }

    private BackfillCheckpoint processSymbol(BackfillCheckpoint checkpoint, String symbol) throws IOException {
        Instant now;
        BackfillCheckpoint next;
        int barCount = -1;
        String reason = null;
        try {
            List<BarRecord> bars = coordinator.fetchWithCache(symbol, checkpoint.exchange(), checkpoint.interval(),
                checkpoint.fromDate(), checkpoint.toDate());
            barCount = bars.size();
            now = clock.instant();
            next = checkpoint.withCompleted(symbol, now);
            log.debug("Backfilled {}: {} bars", symbol, barCount);
        } catch (MarketDataException | RuntimeException e) {
            reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            now = clock.instant();
            next = checkpoint.withFailed(symbol, reason, now);
            log.warn("Backfill failed for {}: {}", symbol, reason);
        }

        checkpoints.save(next);
        current = next;

        BackfillProgress progress = BackfillProgress.of(next);
        if (reason == null) {
            listener.onSymbolCompleted(symbol, barCount, progress);
        } else {
            listener.onSymbolFailed(symbol, reason, progress);
        }
        return next;
    }

    static List<String> normalize(List<String> symbols) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                unique.add(symbol.trim().toUpperCase());
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * Progress of the running or most recent backfill.
     */
    public BackfillProgress getProgress() throws IOException {
        BackfillCheckpoint checkpoint = current;
        if (checkpoint == null) {
            checkpoint = checkpoints.load();
        }
        return checkpoint == null ? BackfillProgress.none() : BackfillProgress.of(checkpoint);
    }
}
