package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One page of pools: network pools, DEX pools and token pools share this shape.
 */
public record PoolPage(
        List<Pool> pools,
        @JsonProperty("page_info") PageInfo pageInfo
) {

    public PoolPage {
        pools = List.copyOf(Objects.requireNonNull(pools, "pools must be present"));
    }
}
