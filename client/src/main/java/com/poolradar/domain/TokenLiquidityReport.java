package com.poolradar.domain;

/**
 * Token details together with the liquidity and DEX spread of its pools. Analysis fields are null when
 * the token has no pools.
 */
public record TokenLiquidityReport(
        Token token,
        int poolsCount,
        LiquidityAnalysis liquidityAnalysis,
        Pool largestPool,
        DexDistribution dexDistribution
) {
}
