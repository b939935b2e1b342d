package com.shutterprobe.core.stats;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics over a finite brightness sample set.
 *
 * <p>
 * Every function returns {@code 0.0} for an empty input instead of failing:
 * calibration windows can legitimately be short, and callers guard against
 * the degenerate thresholds that result.
 * </p>
 *
 * <h3>Percentiles</h3>
 * <p>
 * {@link #percentile(List, double)} uses the linear-index method without
 * interpolation: the result is always one of the input values, at sorted
 * index {@code floor(p / 100 * (n - 1))}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStatistics {

    private BaselineStatistics() {
        // utility class — not instantiable
    }

    /**
     * @param values sample values; must not be {@code null}
     * @return the median (mean of the two middle values for even sizes)
     */
    public static double median(List<Double> values) {
        double[] sorted = sorted(values);
        int n = sorted.length;
        if (n == 0) {
            return 0.0;
        }
        int middle = n / 2;
        if (n % 2 == 0) {
            return (sorted[middle - 1] + sorted[middle]) / 2.0;
        }
        return sorted[middle];
    }

    /**
     * @param values     sample values; must not be {@code null}
     * @param percentile percentile in {@code [0, 100]}
     * @return the sample at sorted index {@code floor(p / 100 * (n - 1))}
     * @throws IllegalArgumentException if {@code percentile} is outside
     *                                  {@code [0, 100]}
     */
    public static double percentile(List<Double> values, double percentile) {
        if (Double.isNaN(percentile) || percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException(
                    "Percentile must be between 0 and 100, got: " + percentile);
        }
        double[] sorted = sorted(values);
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = (int) Math.floor(percentile / 100.0 * (sorted.length - 1));
        return sorted[index];
    }

    public static double mean(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * @param values sample values; must not be {@code null}
     * @return the population standard deviation (divides by {@code n})
     */
    public static double stdDev(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    public static double min(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return 0.0;
        }
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    public static double max(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return 0.0;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    private static double[] sorted(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] copy = new double[values.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = values.get(i);
        }
        Arrays.sort(copy);
        return copy;
    }
}
