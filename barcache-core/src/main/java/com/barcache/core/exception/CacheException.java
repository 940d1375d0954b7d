package com.barcache.core.exception;

import java.io.IOException;

/**
 * Storage-layer failure in the bar cache.
 * Distinct from an empty result, which is not an error.
 */
public class CacheException extends IOException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
