package com.poolradar.analytics;

import java.util.Arrays;

/**
 * Descriptive statistics used by the analyzers. Degenerate inputs (empty, too short, zero variance)
 * yield 0 instead of an exception.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Standard deviation with divisor n. */
    public static double populationStdDev(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    /**
     * Pearson correlation. 0 when lengths differ, fewer than two points, or either series is constant.
     */
    public static double correlation(double[] xs, double[] ys) {
        if (xs == null || ys == null || xs.length != ys.length || xs.length < 2) {
            return 0;
        }
        double meanX = mean(xs);
        double meanY = mean(ys);
        double covariance = 0;
        double varX = 0;
        double varY = 0;
        for (int i = 0; i < xs.length; i++) {
            double dx = xs[i] - meanX;
            double dy = ys[i] - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) {
            return 0;
        }
        return covariance / Math.sqrt(varX * varY);
    }

    /**
     * Gini coefficient of {@code values}: sum of s[i]*(2i+1-n) over n^2*mean, with s sorted ascending.
     * 0 for fewer than two values or a zero mean.
     */
    public static double gini(double[] values) {
        if (values == null || values.length < 2) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double mean = mean(sorted);
        if (mean == 0) {
            return 0;
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += sorted[i] * (2.0 * i + 1 - n);
        }
        return sum / ((double) n * n * mean);
    }

    public static double median(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
    }

    /**
     * Parses a decimal string as sent by the API (transaction amounts); null, blank, non-numeric and
     * non-finite input gives 0.
     */
    public static double parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(value.strip());
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
