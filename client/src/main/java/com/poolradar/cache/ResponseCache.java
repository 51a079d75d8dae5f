package com.poolradar.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-process TTL cache of decoded API responses keyed by {@link RequestFingerprint}.
 * <p>
 * Backed by Caffeine: reads are lock-free and a write only contends with writers of the same key.
 * An entry is a hit while {@code now - capturedAt < ttl}; older entries are ignored and replaced by the
 * next {@link #put}, never swept eagerly by this class. Time comes from the injected {@link Clock},
 * which also drives Caffeine's ticker so tests can move time forward.
 */
@Slf4j
public class ResponseCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;
    private final Clock clock;

    public ResponseCache() {
        this(DEFAULT_TTL, DEFAULT_MAXIMUM_SIZE, Clock.systemUTC());
    }

    public ResponseCache(Duration ttl, long maximumSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Value stored under the fingerprint if it is younger than the TTL.
     */
    public Optional<Object> get(String fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.getIfPresent(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFresh(clock.instant(), ttl)) {
            log.debug("Stale cache entry {} captured at {}", fingerprint, entry.capturedAt());
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Stores (or overwrites) the value with capture time now.
     */
    public void put(String fingerprint, Object value) {
        store(fingerprint, value, clock.instant());
    }

    /**
     * Re-seeds an entry read back from a {@link CacheMirror}, keeping its original capture time so it
     * expires when it would have without a restart. Entries already past the TTL are not stored.
     */
    public void restore(String fingerprint, Object value, Instant capturedAt) {
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (!new CacheEntry(fingerprint, value, capturedAt).isFresh(clock.instant(), ttl)) {
            return;
        }
        store(fingerprint, value, capturedAt);
    }

    private void store(String fingerprint, Object value, Instant capturedAt) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(value, "value");
        entries.put(fingerprint, new CacheEntry(fingerprint, value, capturedAt));
    }

    public void invalidate(String fingerprint) {
        entries.invalidate(fingerprint);
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    /**
     * Approximate number of stored entries, stale ones included until Caffeine drops them.
     */
    public long size() {
        return entries.estimatedSize();
    }

    public Duration getTtl() {
        return ttl;
    }
}
