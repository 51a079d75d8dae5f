package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One page of DEXes for a network.
 */
public record DexPage(
        List<Dex> dexes,
        @JsonProperty("page_info") PageInfo pageInfo
) {

    public DexPage {
        dexes = List.copyOf(Objects.requireNonNull(dexes, "dexes must be present"));
    }
}
