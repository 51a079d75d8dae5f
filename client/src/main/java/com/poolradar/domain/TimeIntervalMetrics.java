package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Volume and trade counts for one rolling window (24h, 6h, ...).
 */
public record TimeIntervalMetrics(
        double volume,
        @JsonProperty("volume_usd") double volumeUsd,
        @JsonProperty("buy_usd") double buyUsd,
        @JsonProperty("sell_usd") double sellUsd,
        int sells,
        int buys,
        int txns,
        @JsonProperty("last_price_usd_change") double lastPriceUsdChange
) {

    /**
     * Buy volume over total buy+sell volume; 0 when nothing traded.
     */
    public double buyPressure() {
        double total = buyUsd + sellUsd;
        return total > 0 ? buyUsd / total : 0;
    }
}
