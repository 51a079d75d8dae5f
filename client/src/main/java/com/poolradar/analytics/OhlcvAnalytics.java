package com.poolradar.analytics;

import com.poolradar.domain.OhlcvBar;
import com.poolradar.domain.OhlcvSummary;
import com.poolradar.domain.Timestamps;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Price statistics over OHLCV slices. Bars are expected in ascending time order.
 */
public final class OhlcvAnalytics {

    private OhlcvAnalytics() {
    }

    /**
     * Bars opened strictly between {@code start} and {@code end} (now when {@code end} is null or
     * unparseable). An unparseable {@code start} returns the input unchanged; bars with an unparseable
     * open time are dropped.
     */
    public static List<OhlcvBar> filterByTimeframe(List<OhlcvBar> bars, String start, String end, Clock clock) {
        Optional<Instant> from = Timestamps.parse(start);
        if (from.isEmpty()) {
            return List.copyOf(bars);
        }
        Instant to = Timestamps.parse(end).orElseGet(clock::instant);
        return bars.stream()
                .filter(bar -> Timestamps.parse(bar.timeOpen())
                        .map(t -> t.isAfter(from.get()) && t.isBefore(to))
                        .orElse(false))
                .toList();
    }

    /** Percentage change from {@code previous} to {@code current}; 0 when {@code previous} is 0. */
    public static double priceChange(double current, double previous) {
        if (previous == 0) {
            return 0;
        }
        return (current - previous) / previous * 100;
    }

    /**
     * Typical price (high + low + close) / 3 weighted by volume. 0 when there is no volume.
     */
    public static double volumeWeightedPrice(List<OhlcvBar> bars) {
        double weighted = 0;
        long volume = 0;
        for (OhlcvBar bar : bars) {
            weighted += bar.typicalPrice() * bar.volume();
            volume += bar.volume();
        }
        return volume == 0 ? 0 : weighted / volume;
    }

    /**
     * Population standard deviation of simple close-to-close returns, skipping pairs whose earlier close
     * is not positive. 0 with fewer than two returns.
     */
    public static double volatility(List<OhlcvBar> bars) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < bars.size(); i++) {
            double previous = bars.get(i - 1).close();
            if (previous > 0) {
                returns.add((bars.get(i).close() - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return 0;
        }
        return Statistics.populationStdDev(returns.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public static OhlcvSummary summarize(List<OhlcvBar> bars) {
        if (bars == null || bars.isEmpty()) {
            return OhlcvSummary.EMPTY;
        }
        double open = bars.get(0).open();
        double close = bars.get(bars.size() - 1).close();
        double high = bars.stream().mapToDouble(OhlcvBar::high).max().orElse(0);
        double low = bars.stream().mapToDouble(OhlcvBar::low).min().orElse(0);
        long volume = bars.stream().mapToLong(OhlcvBar::volume).sum();
        return new OhlcvSummary(bars.size(), open, close, high, low, volume,
                priceChange(close, open), volumeWeightedPrice(bars), volatility(bars));
    }
}
