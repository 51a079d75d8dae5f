package com.poolradar.domain;

/**
 * GET /stats: counts of indexed chains, factories, pools and tokens.
 */
public record SystemStats(
        int chains,
        int factories,
        int pools,
        int tokens
) {
}
