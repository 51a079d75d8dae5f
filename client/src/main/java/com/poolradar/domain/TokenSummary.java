package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Aggregated market figures for a token across all of its pools. Interval metrics are null when the
 * API omits the window.
 */
public record TokenSummary(
        @JsonProperty("price_usd") double priceUsd,
        double fdv,
        @JsonProperty("liquidity_usd") double liquidityUsd,
        int pools,
        @JsonProperty("24h") TimeIntervalMetrics h24,
        @JsonProperty("6h") TimeIntervalMetrics h6,
        @JsonProperty("1h") TimeIntervalMetrics h1,
        @JsonProperty("30m") TimeIntervalMetrics m30,
        @JsonProperty("15m") TimeIntervalMetrics m15,
        @JsonProperty("5m") TimeIntervalMetrics m5,
        @JsonProperty("1m") TimeIntervalMetrics m1
) {

    public Optional<TimeIntervalMetrics> metrics(TimeInterval interval) {
        if (interval == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(switch (interval) {
            case H24 -> h24;
            case H6 -> h6;
            case H1 -> h1;
            case M30 -> m30;
            case M15 -> m15;
            case M5 -> m5;
            case M1 -> m1;
        });
    }
}
