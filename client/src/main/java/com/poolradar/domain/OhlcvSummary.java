package com.poolradar.domain;

/**
 * Range statistics over an OHLCV slice: first open to last close, extremes, total volume.
 */
public record OhlcvSummary(
        int bars,
        double open,
        double close,
        double high,
        double low,
        long totalVolume,
        double priceChangePct,
        double volumeWeightedPrice,
        double volatility
) {

    public static final OhlcvSummary EMPTY = new OhlcvSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);
}
