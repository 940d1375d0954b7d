package com.barcache.core.model;

import java.util.Objects;

/**
 * Identifies one cached time series: a symbol on an exchange at a bar size.
 */
public record SeriesKey(String symbol, String exchange, Interval interval) {

    public SeriesKey {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(interval, "interval");
        symbol = symbol.trim().toUpperCase();
        exchange = exchange.trim().toUpperCase();
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
    }

    public static SeriesKey of(String symbol, String exchange, Interval interval) {
        return new SeriesKey(symbol, exchange, interval);
    }

    @Override
    public String toString() {
        return symbol + ":" + exchange + ":" + interval;
    }
}
