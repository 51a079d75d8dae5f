package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decentralized exchange deployment on a network.
 */
public record Dex(
        String id,
        @JsonProperty("dex_id") String dexId,
        @JsonProperty("dex_name") String dexName,
        String chain,
        String protocol,
        @JsonProperty("volume_usd_24h") Double volumeUsd24h,
        @JsonProperty("txns_24h") Integer txns24h,
        @JsonProperty("pools_count") Integer poolsCount,
        @JsonProperty("created_at") String createdAt
) {
}
