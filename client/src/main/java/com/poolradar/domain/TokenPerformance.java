package com.poolradar.domain;

/**
 * Token-level ratios derived from the token summary. Ratios are null when their denominator is missing or 0.
 */
public record TokenPerformance(
        String tokenId,
        String name,
        String symbol,
        String chain,
        double fdv,
        Double priceUsd,
        Double liquidityUsd,
        Integer poolsCount,
        Double avgLiquidityPerPool,
        Double fdvToLiquidityRatio,
        Double volume24h,
        Double priceChange24h,
        Integer transactions24h,
        Double volumeToLiquidityRatio
) {
}
