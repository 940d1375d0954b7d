package com.barcache.service.data;

import com.barcache.core.model.BarRecord;
import com.barcache.core.model.CoverageSummary;
import com.barcache.core.model.DateRange;

import java.util.List;

/**
 * Result of a cache read: the rows held for the range and what still has to be fetched.
 */
public record CacheLookup(List<BarRecord> rows, List<DateRange> missingRanges, CoverageSummary coverage) {

    public CacheLookup {
        rows = List.copyOf(rows);
        missingRanges = List.copyOf(missingRanges);
    }

    public boolean fullyFresh() {
        return missingRanges.isEmpty();
    }
}
