package com.barcache.service.health;

import java.time.LocalDate;
import java.util.List;

public record SymbolHealth(
    String symbol,
    Status status,
    boolean fresh,
    boolean hasGaps,
    long rowCount,
    LocalDate lastDate,
    List<DateGap> gaps
) {

    public enum Status {
        HEALTHY,
        STALE,
        HAS_GAPS,
        NO_DATA
    }

    public SymbolHealth {
        gaps = List.copyOf(gaps);
    }
}
