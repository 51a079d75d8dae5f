package com.poolradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rolling windows the API reports per-interval trading metrics for.
 */
public enum TimeInterval {
    H24("24h"),
    H6("6h"),
    H1("1h"),
    M30("30m"),
    M15("15m"),
    M5("5m"),
    /** Token summaries only. */
    M1("1m");

    private final String apiName;

    TimeInterval(String apiName) {
        this.apiName = apiName;
    }

    public String apiName() {
        return apiName;
    }

    public static Optional<TimeInterval> fromApiName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(i -> i.apiName.equals(normalized))
                .findFirst();
    }
}
