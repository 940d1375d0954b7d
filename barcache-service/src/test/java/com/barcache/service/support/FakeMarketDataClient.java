package com.barcache.service.support;

import com.barcache.core.exception.InvalidSymbolException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.barcache.service.client.MarketDataClient;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider returning one daily bar per weekday, with scriptable failures.
 */
public class FakeMarketDataClient implements MarketDataClient {

    public static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Kolkata");

    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> unknownSymbols = Collections.synchronizedSet(new HashSet<>());
    private final Set<String> brokenSymbols = Collections.synchronizedSet(new HashSet<>());
    private final AtomicInteger failuresBeforeSuccess = new AtomicInteger();
    private volatile double priceOffset;
    private volatile LocalDate publishedThrough;

    public record Call(String symbol, LocalDate from, LocalDate to) {
    }

    public void unknownSymbol(String symbol) {
        unknownSymbols.add(symbol.toUpperCase());
    }

    /**
     * Every call for this symbol fails with a provider error.
     */
    public void alwaysFail(String symbol) {
        brokenSymbols.add(symbol.toUpperCase());
    }

    /**
     * The next {@code n} calls fail, whatever the symbol.
     */
    public void failNext(int n) {
        failuresBeforeSuccess.set(n);
    }

    /**
     * Shift generated prices, to tell refetched bars from cached ones.
     */
    public void setPriceOffset(double offset) {
        this.priceOffset = offset;
    }

    /**
     * Bars after {@code date} are not out yet and are left out of responses.
     */
    public void publishThrough(LocalDate date) {
        this.publishedThrough = date;
    }

    @Override
    public List<BarRecord> fetchOhlcv(String symbol, String exchange, Interval interval,
                                      LocalDate from, LocalDate to) throws MarketDataException {
        String sym = symbol.toUpperCase();
        calls.add(new Call(sym, from, to));

        if (unknownSymbols.contains(sym)) {
            throw new InvalidSymbolException(sym, "Unknown symbol " + sym);
        }
        if (brokenSymbols.contains(sym)) {
            throw new MarketDataException("Provider error for " + sym);
        }
        if (failuresBeforeSuccess.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new MarketDataException("Transient provider error");
        }
        LocalDate last = publishedThrough != null && publishedThrough.isBefore(to) ? publishedThrough : to;
        if (last.isBefore(from)) {
            return List.of();
        }
        return dailyBars(SeriesKey.of(sym, exchange, interval), from, last, priceOffset);
    }

    public static List<BarRecord> dailyBars(SeriesKey key, LocalDate from, LocalDate to, double offset) {
        List<BarRecord> bars = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (d.getDayOfWeek() == DayOfWeek.SATURDAY || d.getDayOfWeek() == DayOfWeek.SUNDAY) {
                continue;
            }
            double base = 100 + (d.toEpochDay() % 50) + offset;
            bars.add(BarRecord.of(key, d.atStartOfDay(MARKET_ZONE).toInstant(), MARKET_ZONE,
                base, base + 2, base - 1, base + 1, 1_000 + d.getDayOfMonth()));
        }
        return bars;
    }

    public List<Call> getCalls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public int callCount() {
        return calls.size();
    }

    public long callsFor(String symbol) {
        return getCalls().stream().filter(c -> c.symbol().equalsIgnoreCase(symbol)).count();
    }

    public void clearCalls() {
        calls.clear();
    }
}
