package com.pfesentinel.core.baseline;

import java.util.Arrays;

/**
 * Descriptive statistics over primitive value arrays.
 *
 * <p>
 * All methods return {@code 0.0} for empty input instead of throwing, so
 * callers can treat "no data" as a defined zero-state.
 * </p>
 *
 * @since 1.0.0
 */
public final class SampleStatistics {

    private SampleStatistics() {
        // utility class
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of {@code values[from, to)}.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Sample standard deviation (divides by {@code n - 1}); {@code 0.0} when
     * {@code n <= 1}.
     */
    public static double sampleStd(double[] values) {
        int n = values.length;
        if (n <= 1) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    /**
     * Population standard deviation of {@code values[from, to)}.
     */
    public static double populationStd(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            return 0.0;
        }
        double mean = mean(values, from, to);
        double sumSq = 0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / n);
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Nearest-rank percentile: {@code sorted[min(floor(n * p), n - 1)]}.
     *
     * @param p fraction in [0, 1]
     */
    public static double nearestRankPercentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        int index = (int) Math.floor(sorted.length * p);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param p fraction in [0, 1]
     */
    public static double interpolatedPercentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (position - lower) * (sorted[upper] - sorted[lower]);
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).min().getAsDouble();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : Arrays.stream(values).max().getAsDouble();
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}
