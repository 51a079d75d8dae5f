package com.poolradar.domain;

/**
 * Per-pool activity summary. {@code volumePerTransaction} is null when the pool reports no transactions.
 */
public record PoolActivity(
        String poolId,
        String dexName,
        String chain,
        double volumeUsd,
        int transactions,
        double priceUsd,
        Double volumePerTransaction,
        double priceChange24h,
        double priceChange1h,
        double priceChange5m,
        double activityScore,
        String tokenPair
) {
}
