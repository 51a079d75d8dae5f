package com.poolradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Volume distribution snapshot over a pool collection. {@code distribution} maps bucket label to the
 * fraction of pools falling in it.
 */
public record LiquidityAnalysis(
        double totalLiquidity,
        int poolCount,
        double averageLiquidity,
        double medianLiquidity,
        double giniCoefficient,
        double topPoolsShare,
        Map<String, Double> distribution
) {

    public static final LiquidityAnalysis EMPTY = new LiquidityAnalysis(0, 0, 0, 0, 0, 0, Map.of());

    public LiquidityAnalysis {
        distribution = distribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
    }
}
