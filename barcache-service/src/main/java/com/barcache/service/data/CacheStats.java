package com.barcache.service.data;

public record CacheStats(long totalRows, long uniqueSymbols, long seriesCount, long dbSizeBytes) {

    public double dbSizeMb() {
        return dbSizeBytes / (1024.0 * 1024.0);
    }
}
