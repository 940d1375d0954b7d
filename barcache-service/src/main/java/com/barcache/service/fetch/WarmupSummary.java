package com.barcache.service.fetch;

import java.util.List;

public record WarmupSummary(int total, int successful, int failed, List<String> failedSymbols) {

    public WarmupSummary {
        failedSymbols = List.copyOf(failedSymbols);
    }
}
