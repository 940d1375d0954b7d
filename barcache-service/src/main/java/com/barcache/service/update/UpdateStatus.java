package com.barcache.service.update;

import java.time.LocalDate;

/**
 * @param lastDate  newest cached trade date, null without data
 * @param daysStale trading days between lastDate and the last trading day, -1 without data
 */
public record UpdateStatus(String symbol, boolean hasData, LocalDate lastDate, int daysStale, boolean needsUpdate) {
}
