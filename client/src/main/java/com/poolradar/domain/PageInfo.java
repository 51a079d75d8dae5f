package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numbered pagination block returned with list endpoints.
 */
public record PageInfo(
        int limit,
        int page,
        @JsonProperty("total_items") int totalItems,
        @JsonProperty("total_pages") int totalPages
) {

    public boolean hasNext() {
        return page + 1 < totalPages;
    }
}
