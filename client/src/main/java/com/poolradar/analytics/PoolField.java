package com.poolradar.analytics;

import com.poolradar.domain.Pool;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Numeric pool fields that filters, sorts and anomaly detection can key on.
 */
public enum PoolField {
    VOLUME_USD("volume_usd", Pool::volumeUsd),
    PRICE_USD("price_usd", Pool::priceUsd),
    TRANSACTIONS("transactions", Pool::transactions),
    LAST_PRICE_CHANGE_USD_24H("last_price_change_usd_24h", Pool::lastPriceChangeUsd24h);

    private final String apiName;
    private final ToDoubleFunction<Pool> extractor;

    PoolField(String apiName, ToDoubleFunction<Pool> extractor) {
        this.apiName = apiName;
        this.extractor = extractor;
    }

    public String apiName() {
        return apiName;
    }

    /**
     * Field value of {@code pool}; 0 for a null pool or a non-finite value.
     */
    public double extract(Pool pool) {
        if (pool == null) {
            return 0;
        }
        double value = extractor.applyAsDouble(pool);
        return Double.isFinite(value) ? value : 0;
    }

    /** Lookup by API name, case-insensitive. */
    public static Optional<PoolField> from(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(f -> f.apiName.equals(normalized))
                .findFirst();
    }

    /**
     * Value of the named field, 0 when the name is unknown.
     */
    public static double extract(Pool pool, String fieldName) {
        return from(fieldName).map(f -> f.extract(pool)).orElse(0.0);
    }
}
