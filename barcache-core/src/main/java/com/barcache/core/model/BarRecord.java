package com.barcache.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * One OHLCV observation for a series.
 * Unique by (symbol, exchange, interval, timestamp); for daily bars the
 * timestamp and trade date are one-to-one.
 *
 * @param cachedAt when the row was written to the cache, null before it is stored
 */
public record BarRecord(
    String symbol,
    String exchange,
    Interval interval,
    Instant timestamp,
    LocalDate tradeDate,
    double open,
    double high,
    double low,
    double close,
    long volume,
    Instant cachedAt
) {

    public BarRecord {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(tradeDate, "tradeDate");
        symbol = symbol.trim().toUpperCase();
        exchange = exchange.trim().toUpperCase();
    }

    /**
     * Create a bar whose trade date is the timestamp's date in the market time zone.
     */
    public static BarRecord of(SeriesKey key, Instant timestamp, ZoneId marketZone,
                               double open, double high, double low, double close, long volume) {
        return new BarRecord(key.symbol(), key.exchange(), key.interval(), timestamp,
            timestamp.atZone(marketZone).toLocalDate(), open, high, low, close, volume, null);
    }

    public SeriesKey key() {
        return new SeriesKey(symbol, exchange, interval);
    }

    public BarRecord withCachedAt(Instant when) {
        return new BarRecord(symbol, exchange, interval, timestamp, tradeDate,
            open, high, low, close, volume, when);
    }
}
