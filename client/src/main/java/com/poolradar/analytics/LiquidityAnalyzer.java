package com.poolradar.analytics;

import com.poolradar.domain.DexDistribution;
import com.poolradar.domain.LiquidityAnalysis;
import com.poolradar.domain.Pool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How volume spreads over pools and over DEXes. Pool USD volume stands in for liquidity, as the list
 * endpoints do not report reserves.
 */
public final class LiquidityAnalyzer {

    static final String UNKNOWN_DEX = "Unknown";

    private static final double ONE_MILLION = 1_000_000;

    private LiquidityAnalyzer() {
    }

    /**
     * Totals, median, Gini, top-decile share and a four-bucket histogram ({@code < 1M}, {@code 1M-10M},
     * {@code 10M-100M}, {@code > 100M}) of pool volume. Bucket values are fractions of the pool count.
     */
    public static LiquidityAnalysis analyzeLiquidity(List<Pool> pools) {
        if (pools == null || pools.isEmpty()) {
            return LiquidityAnalysis.EMPTY;
        }
        double[] volumes = pools.stream().mapToDouble(PoolField.VOLUME_USD::extract).toArray();
        double total = Arrays.stream(volumes).sum();
        int n = volumes.length;

        double[] sorted = volumes.clone();
        Arrays.sort(sorted);
        int topCount = Math.max(1, (n + 9) / 10);
        double topVolume = 0;
        for (int i = 0; i < topCount; i++) {
            topVolume += sorted[n - 1 - i];
        }

        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("< 1M", fraction(volumes, 0, ONE_MILLION));
        distribution.put("1M-10M", fraction(volumes, ONE_MILLION, 10 * ONE_MILLION));
        distribution.put("10M-100M", fraction(volumes, 10 * ONE_MILLION, 100 * ONE_MILLION));
        distribution.put("> 100M", fraction(volumes, 100 * ONE_MILLION, Double.POSITIVE_INFINITY));

        return new LiquidityAnalysis(
                total,
                n,
                total / n,
                Statistics.median(volumes),
                Statistics.gini(volumes),
                total > 0 ? topVolume / total : 0,
                distribution);
    }

    /**
     * Volume share per DEX name, DEX names by volume (largest first) and the Herfindahl-Hirschman index
     * of the shares. Pools without a DEX name count as "Unknown".
     */
    public static DexDistribution analyzeDexDistribution(List<Pool> pools) {
        if (pools == null || pools.isEmpty()) {
            return DexDistribution.EMPTY;
        }
        Map<String, Double> volumeByDex = new LinkedHashMap<>();
        double total = 0;
        for (Pool pool : pools) {
            String dex = pool.dexName() == null || pool.dexName().isBlank() ? UNKNOWN_DEX : pool.dexName();
            double volume = PoolField.VOLUME_USD.extract(pool);
            volumeByDex.merge(dex, volume, Double::sum);
            total += volume;
        }

        Map<String, Double> shares = new LinkedHashMap<>();
        double hhi = 0;
        if (total > 0) {
            for (Map.Entry<String, Double> entry : volumeByDex.entrySet()) {
                double share = entry.getValue() / total;
                shares.put(entry.getKey(), share);
                hhi += share * share;
            }
        }

        List<String> topDexes = new ArrayList<>(volumeByDex.keySet());
        topDexes.sort(Comparator.comparingDouble((String dex) -> volumeByDex.get(dex)).reversed());

        return new DexDistribution(total, volumeByDex.size(), shares, topDexes, hhi);
    }

    private static double fraction(double[] volumes, double fromInclusive, double toExclusive) {
        long count = Arrays.stream(volumes).filter(v -> v >= fromInclusive && v < toExclusive).count();
        return (double) count / volumes.length;
    }
}
