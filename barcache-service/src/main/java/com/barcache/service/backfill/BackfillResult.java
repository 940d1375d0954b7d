package com.barcache.service.backfill;

import com.barcache.core.model.DateRange;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one backfill run. Counts cover the whole checkpointed run,
 * including symbols finished before a resume.
 */
public record BackfillResult(
    DateRange range,
    int total,
    int completed,
    List<BackfillCheckpoint.FailedSymbol> failed,
    boolean resumed,
    int processedThisRun,
    Duration elapsed
) {

    public BackfillResult {
        failed = List.copyOf(failed);
    }

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    /**
     * Process exit code: 0 when every symbol succeeded, 1 otherwise.
     */
    public int exitCode() {
        return failed.isEmpty() ? 0 : 1;
    }
}
