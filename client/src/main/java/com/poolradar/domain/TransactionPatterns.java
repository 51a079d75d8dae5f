package com.poolradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over a batch of transactions: value totals, busiest UTC hour and pair mix.
 */
public record TransactionPatterns(
        int totalTransactions,
        double totalValueUsd,
        double avgValuePerTx,
        int peakHour,
        int peakHourCount,
        Map<Integer, Integer> hourlyDistribution,
        int uniquePairs,
        Map<String, Integer> pairDistribution
) {

    public static final TransactionPatterns EMPTY = new TransactionPatterns(0, 0, 0, 0, 0, Map.of(), 0, Map.of());

    public TransactionPatterns {
        hourlyDistribution = hourlyDistribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hourlyDistribution));
        pairDistribution = pairDistribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pairDistribution));
    }
}
