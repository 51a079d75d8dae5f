package com.poolradar.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Decoded payload stored under a fingerprint. Never leaves this package.
 */
record CacheEntry(String key, Object value, Instant capturedAt) {

    boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(capturedAt, now).compareTo(ttl) < 0;
    }
}
