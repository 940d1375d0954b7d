package com.barcache.service.update;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param updated  symbols for which a range was requested and served
 * @param upToDate symbols skipped because nothing newer can exist yet
 * @param failures symbol to failure reason, in processing order
 */
public record UpdateResult(int total, int updated, int upToDate, long barsReceived, Map<String, String> failures) {

    public UpdateResult {
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public int failed() {
        return failures.size();
    }

    public int exitCode() {
        return failures.isEmpty() ? 0 : 1;
    }
}
