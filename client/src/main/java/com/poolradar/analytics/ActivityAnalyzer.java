package com.poolradar.analytics;

import com.poolradar.domain.Pool;
import com.poolradar.domain.PoolActivity;
import com.poolradar.domain.TimeInterval;
import com.poolradar.domain.TimeIntervalMetrics;
import com.poolradar.domain.Timestamps;
import com.poolradar.domain.Token;
import com.poolradar.domain.TokenPerformance;
import com.poolradar.domain.TokenSummary;
import com.poolradar.domain.Transaction;
import com.poolradar.domain.TransactionPatterns;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derived activity figures for single pools and tokens and for transaction batches.
 */
public final class ActivityAnalyzer {

    private ActivityAnalyzer() {
    }

    /**
     * Activity score is log10(volume + 1) * log10(transactions + 1), so a pool needs both volume and
     * trades to score well.
     */
    public static PoolActivity poolActivity(Pool pool) {
        double volume = Math.max(0, PoolField.VOLUME_USD.extract(pool));
        int transactions = Math.max(0, pool.transactions());
        Double volumePerTransaction = transactions > 0 ? volume / transactions : null;
        double activityScore = Math.log10(volume + 1) * Math.log10(transactions + 1.0);
        return new PoolActivity(
                pool.id(),
                pool.dexName(),
                pool.chain(),
                volume,
                transactions,
                PoolField.PRICE_USD.extract(pool),
                volumePerTransaction,
                finite(pool.lastPriceChangeUsd24h()),
                finite(pool.lastPriceChangeUsd1h()),
                finite(pool.lastPriceChangeUsd5m()),
                activityScore,
                pool.tokenPair().orElse(null));
    }

    public static TokenPerformance tokenPerformance(Token token) {
        TokenSummary summary = token.summary();
        if (summary == null) {
            return new TokenPerformance(token.id(), token.name(), token.symbol(), token.chain(), token.fdv(),
                    null, null, null, null, null, null, null, null, null);
        }
        double liquidity = summary.liquidityUsd();
        Double avgLiquidityPerPool = summary.pools() > 0 ? liquidity / summary.pools() : null;
        Double fdvToLiquidity = liquidity > 0 ? token.fdv() / liquidity : null;

        TimeIntervalMetrics day = summary.metrics(TimeInterval.H24).orElse(null);
        Double volume24h = day != null ? day.volumeUsd() : null;
        Double priceChange24h = day != null ? day.lastPriceUsdChange() : null;
        Integer transactions24h = day != null ? day.txns() : null;
        Double volumeToLiquidity = day != null && liquidity > 0 ? day.volumeUsd() / liquidity : null;

        return new TokenPerformance(token.id(), token.name(), token.symbol(), token.chain(), token.fdv(),
                summary.priceUsd(), liquidity, summary.pools(), avgLiquidityPerPool, fdvToLiquidity,
                volume24h, priceChange24h, transactions24h, volumeToLiquidity);
    }

    /**
     * Totals plus an hour-of-day (UTC) histogram and a token-pair histogram. The peak hour is the busiest
     * hour, the earliest one on ties; transactions with an unparseable timestamp are left out of the
     * hourly histogram only.
     */
    public static TransactionPatterns transactionPatterns(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return TransactionPatterns.EMPTY;
        }
        double totalUsd = 0;
        Map<Integer, Integer> hourly = new TreeMap<>();
        Map<String, Integer> pairs = new TreeMap<>();
        for (Transaction tx : transactions) {
            totalUsd += finite(tx.totalUsd());
            Timestamps.parse(tx.createdAt())
                    .map(t -> t.atOffset(ZoneOffset.UTC).getHour())
                    .ifPresent(hour -> hourly.merge(hour, 1, Integer::sum));
            pairs.merge(tx.tokenPair(), 1, Integer::sum);
        }
        int peakHour = 0;
        int peakCount = 0;
        for (Map.Entry<Integer, Integer> entry : hourly.entrySet()) {
            if (entry.getValue() > peakCount) {
                peakHour = entry.getKey();
                peakCount = entry.getValue();
            }
        }
        return new TransactionPatterns(transactions.size(), totalUsd, totalUsd / transactions.size(),
                peakHour, peakCount, hourly, pairs.size(), pairs);
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
