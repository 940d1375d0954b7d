package com.barcache.service.fetch;

import com.barcache.core.exception.MarketDataException;

/**
 * One attempt at a remote operation.
 */
@FunctionalInterface
public interface RemoteCall<T> {
    T call() throws MarketDataException;
}
