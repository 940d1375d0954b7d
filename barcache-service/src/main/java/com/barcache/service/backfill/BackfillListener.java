package com.barcache.service.backfill;

/**
 * Progress callback, invoked after the checkpoint for a symbol has been written.
 */
public interface BackfillListener {

    BackfillListener NONE = new BackfillListener() {
    };

    default void onSymbolCompleted(String symbol, int barCount, BackfillProgress progress) {
    }

    default void onSymbolFailed(String symbol, String reason, BackfillProgress progress) {
    }
}
