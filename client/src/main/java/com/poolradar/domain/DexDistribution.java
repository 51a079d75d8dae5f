package com.poolradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Volume share per DEX and the Herfindahl-Hirschman concentration of those shares.
 */
public record DexDistribution(
        double totalVolume,
        int dexCount,
        Map<String, Double> distribution,
        List<String> topDexes,
        double concentration
) {

    public static final DexDistribution EMPTY = new DexDistribution(0, 0, Map.of(), List.of(), 0);

    public DexDistribution {
        distribution = distribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
        topDexes = topDexes == null ? List.of() : List.copyOf(topDexes);
    }
}
