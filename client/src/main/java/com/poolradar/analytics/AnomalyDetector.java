package com.poolradar.analytics;

import com.poolradar.domain.AnomalyResult;
import com.poolradar.domain.Pool;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Z-score outlier detection over one numeric field of a collection.
 */
public final class AnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 2.0;

    private static final int MIN_VALUES = 3;

    // z-scores landing on the threshold up to rounding count as exceeding it
    private static final double TOLERANCE = 1e-9;

    private AnomalyDetector() {
    }

    /**
     * Items whose |value - mean| / stddev exceeds {@code threshold}, using population statistics.
     * Empty for fewer than three items or when every value is the same.
     */
    public static <T> List<AnomalyResult<T>> detect(List<T> items, ToDoubleFunction<T> extractor, double threshold) {
        if (items == null || items.size() < MIN_VALUES) {
            return List.of();
        }
        double[] values = new double[items.size()];
        for (int i = 0; i < values.length; i++) {
            double v = extractor.applyAsDouble(items.get(i));
            values[i] = Double.isFinite(v) ? v : 0;
        }
        double mean = Statistics.mean(values);
        double stdDev = Statistics.populationStdDev(values);
        if (stdDev == 0) {
            return List.of();
        }
        List<AnomalyResult<T>> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / stdDev;
            if (z > threshold - TOLERANCE) {
                anomalies.add(new AnomalyResult<>(i, values[i], z, items.get(i)));
            }
        }
        return anomalies;
    }

    public static List<AnomalyResult<Pool>> detectPools(List<Pool> pools, PoolField field, double threshold) {
        return detect(pools, field::extract, threshold);
    }
}
