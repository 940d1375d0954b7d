package com.barcache.service.backfill;

import com.barcache.core.model.DateRange;

import java.time.LocalDate;
import java.util.List;

/**
 * What a backfill would fetch, worked out from the cache alone.
 */
public record BackfillPlan(DateRange range, List<SymbolPlan> symbols) {

    public BackfillPlan {
        symbols = List.copyOf(symbols);
    }

    /**
     * Trading days in the range that have no cached bar for one symbol.
     */
    public record SymbolPlan(String symbol, int tradingDays, List<LocalDate> missingDates) {

        public SymbolPlan {
            missingDates = List.copyOf(missingDates);
        }

        public boolean needsFetch() {
            return !missingDates.isEmpty();
        }
    }

    public List<String> symbolsToFetch() {
        return symbols.stream().filter(SymbolPlan::needsFetch).map(SymbolPlan::symbol).toList();
    }

    public long totalMissingDays() {
        return symbols.stream().mapToLong(s -> s.missingDates().size()).sum();
    }
}
