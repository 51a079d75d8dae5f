package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Liquidity pool on a DEX. Numeric fields the API omits decode as 0; interval metrics and the
 * optional pricing fields stay null.
 */
public record Pool(
        String id,
        @JsonProperty("dex_id") String dexId,
        @JsonProperty("dex_name") String dexName,
        String chain,
        @JsonProperty("volume_usd") double volumeUsd,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("created_at_block_number") long createdAtBlockNumber,
        int transactions,
        @JsonProperty("price_usd") double priceUsd,
        @JsonProperty("last_price_change_usd_5m") double lastPriceChangeUsd5m,
        @JsonProperty("last_price_change_usd_1h") double lastPriceChangeUsd1h,
        @JsonProperty("last_price_change_usd_24h") double lastPriceChangeUsd24h,
        Double fee,
        List<Token> tokens,
        @JsonProperty("last_price") Double lastPrice,
        @JsonProperty("last_price_usd") Double lastPriceUsd,
        @JsonProperty("price_time") String priceTime,
        @JsonProperty("24h") TimeIntervalMetrics h24,
        @JsonProperty("6h") TimeIntervalMetrics h6,
        @JsonProperty("1h") TimeIntervalMetrics h1,
        @JsonProperty("30m") TimeIntervalMetrics m30,
        @JsonProperty("15m") TimeIntervalMetrics m15,
        @JsonProperty("5m") TimeIntervalMetrics m5
) {

    public Pool {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

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
            case M1 -> null;
        });
    }

    /**
     * "SYM0/SYM1" for the first two tokens, empty when the pool lists fewer than two.
     */
    public Optional<String> tokenPair() {
        if (tokens.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(0).symbol() + "/" + tokens.get(1).symbol());
    }
}
