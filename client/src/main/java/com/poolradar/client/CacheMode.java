package com.poolradar.client;

/**
 * Whether a request may be answered from the response cache.
 */
public enum CacheMode {
    /** Serve a fresh cached value when present. */
    USE_CACHE,
    /** Always go to the API; the result still refreshes the cache. */
    REFRESH
}
