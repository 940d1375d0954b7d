package com.barcache.service.fetch;

/**
 * Counters of one fetch coordinator.
 *
 * @param totalRequests  fetch requests received
 * @param cacheHits      requests served entirely from cache
 * @param cacheMisses    requests that needed at least one remote call
 * @param apiCalls       remote call attempts, retries included
 * @param failedApiCalls remote call attempts that failed
 * @param errors         requests that failed plus cache writes that failed
 */
public record FetchStatistics(
    long totalRequests,
    long cacheHits,
    long cacheMisses,
    long apiCalls,
    long failedApiCalls,
    long errors
) {

    /**
     * Hits over hits plus misses, 0 when nothing was requested.
     */
    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0 : (double) cacheHits / lookups;
    }
}
