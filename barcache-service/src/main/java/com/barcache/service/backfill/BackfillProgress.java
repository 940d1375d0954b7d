package com.barcache.service.backfill;

/**
 * @param progressPct share of symbols attempted (completed or failed), 0 to 100
 */
public record BackfillProgress(
    BackfillCheckpoint.Status status,
    int total,
    int completed,
    int failed,
    int remaining,
    double progressPct
) {

    public static BackfillProgress none() {
        return new BackfillProgress(null, 0, 0, 0, 0, 0.0);
    }

    public static BackfillProgress of(BackfillCheckpoint checkpoint) {
        int total = checkpoint.total();
        int completed = checkpoint.completed().size();
        int failed = checkpoint.failed().size();
        double pct = total == 0 ? 100.0 : (completed + failed) * 100.0 / total;
        return new BackfillProgress(checkpoint.status(), total, completed, failed,
            checkpoint.remaining().size(), pct);
    }
}
