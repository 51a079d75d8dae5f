package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Blockchain network as listed by GET /networks.
 */
public record Network(
        String id,
        @JsonProperty("display_name") String displayName
) {
}
