package com.barcache.service.fetch;

import com.barcache.core.model.BarRecord;

import java.util.List;

/**
 * Per-symbol result of a batch fetch.
 *
 * @param error failure message, null on success
 */
public record FetchOutcome(String symbol, List<BarRecord> bars, String error) {

    public FetchOutcome {
        bars = List.copyOf(bars);
    }

    public static FetchOutcome success(String symbol, List<BarRecord> bars) {
        return new FetchOutcome(symbol, bars, null);
    }

    public static FetchOutcome failure(String symbol, String error) {
        return new FetchOutcome(symbol, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
