package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Token metadata from GET /networks/{network}/tokens/{token}; also embedded in pools and search results,
 * where most fields besides id/symbol/chain are usually absent.
 */
public record Token(
        String id,
        String name,
        String symbol,
        String chain,
        String type,
        String status,
        int decimals,
        @JsonProperty("total_supply") double totalSupply,
        String description,
        String website,
        String explorer,
        @JsonProperty("added_at") String addedAt,
        double fdv,
        @JsonProperty("last_updated") String lastUpdated,
        TokenSummary summary
) {

    public Optional<TokenSummary> summaryOptional() {
        return Optional.ofNullable(summary);
    }

    public Optional<TimeIntervalMetrics> metrics(TimeInterval interval) {
        return summaryOptional().flatMap(s -> s.metrics(interval));
    }
}
