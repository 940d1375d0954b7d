package com.barcache.service.health;

import com.barcache.service.backfill.BackfillProgress;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of cache coverage, freshness and data quality.
 *
 * @param coveragePct   share of the expected symbol universe present in the cache
 * @param freshnessPct  share of cached series within the freshness threshold
 * @param backfill      progress of the last backfill, or {@link BackfillProgress#none()}
 */
public record HealthReport(
    HealthStatus status,
    Instant generatedAt,
    LocalDate lastTradingDay,
    int expectedSymbols,
    int cachedSymbols,
    double coveragePct,
    int seriesChecked,
    int freshSeries,
    double freshnessPct,
    List<DateGap> gaps,
    long totalRows,
    long dbSizeBytes,
    boolean integrityOk,
    BackfillProgress backfill,
    List<String> issues,
    List<String> recommendations
) {

    public HealthReport {
        gaps = List.copyOf(gaps);
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public int detectedGaps() {
        return gaps.size();
    }

    public int exitCode() {
        return status == HealthStatus.HEALTHY ? 0 : 1;
    }
}
