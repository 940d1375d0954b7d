package com.barcache.service.backfill;

import com.barcache.core.model.DateRange;
import com.barcache.core.model.Interval;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted state of a backfill run. Rewritten after every symbol.
 *
 * @param remaining symbols not yet attempted, in processing order
 * @param failed    symbols that failed in this run, with the reason
 */
public record BackfillCheckpoint(
    Status status,
    String exchange,
    Interval interval,
    LocalDate fromDate,
    LocalDate toDate,
    List<String> remaining,
    List<String> completed,
    List<FailedSymbol> failed,
    Instant startedAt,
    Instant updatedAt
) {

    public enum Status {
        IN_PROGRESS,
        COMPLETE
    }

    public record FailedSymbol(String symbol, String reason) {
    }

    public BackfillCheckpoint {
        remaining = remaining == null ? List.of() : List.copyOf(remaining);
        completed = completed == null ? List.of() : List.copyOf(completed);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }

    public static BackfillCheckpoint start(String exchange, Interval interval, DateRange range,
                                           List<String> symbols, Instant now) {
        return new BackfillCheckpoint(Status.IN_PROGRESS, exchange, interval, range.from(), range.to(),
            symbols, List.of(), List.of(), now, now);
    }

    public BackfillCheckpoint withCompleted(String symbol, Instant now) {
        List<String> done = new ArrayList<>(completed);
        done.add(symbol);
        return new BackfillCheckpoint(status, exchange, interval, fromDate, toDate,
            without(symbol), done, failed, startedAt, now);
    }

    public BackfillCheckpoint withFailed(String symbol, String reason, Instant now) {
        List<FailedSymbol> failures = new ArrayList<>(failed);
        failures.add(new FailedSymbol(symbol, reason));
        return new BackfillCheckpoint(status, exchange, interval, fromDate, toDate,
            without(symbol), completed, failures, startedAt, now);
    }

    public BackfillCheckpoint complete(Instant now) {
        return new BackfillCheckpoint(Status.COMPLETE, exchange, interval, fromDate, toDate,
            List.of(), completed, failed, startedAt, now);
    }

    private List<String> without(String symbol) {
        List<String> rest = new ArrayList<>(remaining);
        rest.remove(symbol);
        return rest;
    }

    @JsonIgnore
    public boolean isInProgress() {
        return status == Status.IN_PROGRESS;
    }

    public DateRange dateRange() {
        return DateRange.of(fromDate, toDate);
    }

    public int total() {
        return remaining.size() + completed.size() + failed.size();
    }

    /**
     * Every symbol of the run, whatever its state.
     */
    public List<String> allSymbols() {
        List<String> all = new ArrayList<>(completed);
        for (FailedSymbol f : failed) {
            all.add(f.symbol());
        }
        all.addAll(remaining);
        return all;
    }
}
