package com.barcache.service.client;

import com.barcache.core.exception.InvalidSymbolException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.exception.RateLimitException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.Interval;

import java.time.LocalDate;
import java.util.List;

/**
 * Remote source of historical OHLCV bars.
 */
public interface MarketDataClient {

    /**
     * Bars of {@code symbol} whose trade date lies in [from, to], ordered by timestamp.
     * An empty list means the provider has no bars for the range (holidays, not yet listed).
     *
     * @throws InvalidSymbolException the provider does not know the symbol
     * @throws RateLimitException     the provider throttled the request
     * @throws MarketDataException    any other provider or transport failure
     */
    List<BarRecord> fetchOhlcv(String symbol, String exchange, Interval interval,
                               LocalDate from, LocalDate to) throws MarketDataException;
}
