package com.barcache.service.health;

import java.time.LocalDate;

/**
 * Run of consecutive trading days with no cached bar.
 *
 * @param from first missing trading day
 * @param to   last missing trading day
 */
public record DateGap(String symbol, LocalDate from, LocalDate to, int missingTradingDays) {
}
