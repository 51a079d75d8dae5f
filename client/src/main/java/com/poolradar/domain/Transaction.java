package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Swap recorded on a pool. Amounts are decimal strings as sent by the API; USD prices are per side.
 */
public record Transaction(
        String id,
        @JsonProperty("log_index") Double logIndex,
        @JsonProperty("transaction_index") Double transactionIndex,
        @JsonProperty("pool_id") String poolId,
        String sender,
        String recipient,
        @JsonProperty("token_0") String token0,
        @JsonProperty("token_0_symbol") String token0Symbol,
        @JsonProperty("token_1") String token1,
        @JsonProperty("token_1_symbol") String token1Symbol,
        @JsonProperty("amount_0") String amount0,
        @JsonProperty("amount_1") String amount1,
        @JsonProperty("price_0") double price0,
        @JsonProperty("price_1") double price1,
        @JsonProperty("price_0_usd") double price0Usd,
        @JsonProperty("price_1_usd") double price1Usd,
        @JsonProperty("created_at_block_number") long createdAtBlockNumber,
        @JsonProperty("created_at") String createdAt
) {

    /**
     * Sum of both sides' USD prices, the figure the large-trade filter works on.
     */
    public double totalUsd() {
        return price0Usd + price1Usd;
    }

    public String tokenPair() {
        return token0Symbol + "/" + token1Symbol;
    }
}
