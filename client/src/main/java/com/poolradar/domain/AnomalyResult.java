package com.poolradar.domain;

/**
 * A value flagged by z-score detection. {@code item} points back at the source record for reporting.
 *
 * @param index  position in the source collection
 * @param value  extracted field value
 * @param zScore |value - mean| / stddev
 * @param item   originating record
 */
public record AnomalyResult<T>(int index, double value, double zScore, T item) {
}
