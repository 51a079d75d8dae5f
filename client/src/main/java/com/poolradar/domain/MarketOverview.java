package com.poolradar.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * System statistics plus per-network volume for the leading networks.
 */
public record MarketOverview(
        SystemStats systemStats,
        Map<String, NetworkSnapshot> networkOverview,
        Instant timestamp
) {

    public MarketOverview {
        networkOverview = networkOverview == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(networkOverview));
    }
}
