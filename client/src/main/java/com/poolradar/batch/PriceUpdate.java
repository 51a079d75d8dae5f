package com.poolradar.batch;

import java.time.Instant;

/**
 * Price observation for one monitored pool.
 */
public record PriceUpdate(
        String network,
        String poolAddress,
        double priceUsd,
        double lastPriceChangeUsd24h,
        double volumeUsd24h,
        Instant timestamp
) {
}
