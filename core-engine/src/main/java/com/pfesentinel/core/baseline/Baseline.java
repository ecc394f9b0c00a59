package com.pfesentinel.core.baseline;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable statistical snapshot of a finite sample set.
 *
 * <p>
 * {@link #EMPTY} (all statistics zero, {@code sampleCount == 0}) is the
 * canonical "no data" baseline. Consumers check {@link #isEmpty()} or
 * {@link #getSampleCount()} before acting on it.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Baseline EMPTY = new Baseline(0, 0, 0, 0, 0, 0, 0);

    private final double mean;
    private final double median;
    private final double std;
    private final double min;
    private final double max;
    private final double p95;
    private final int sampleCount;

    public Baseline(double mean, double median, double std, double min, double max,
            double p95, int sampleCount) {
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0, got: " + sampleCount);
        }
        this.mean = mean;
        this.median = median;
        this.std = std;
        this.min = min;
        this.max = max;
        this.p95 = p95;
        this.sampleCount = sampleCount;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getP95() {
        return p95;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public boolean isEmpty() {
        return sampleCount == 0;
    }

    /**
     * @return whether at least {@code minSamples} samples back this baseline
     */
    public boolean hasAtLeast(int minSamples) {
        return sampleCount >= minSamples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(std, that.std) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(p95, that.p95) == 0
                && sampleCount == that.sampleCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, median, std, min, max, p95, sampleCount);
    }

    @Override
    public String toString() {
        return String.format("Baseline{mean=%.4f, median=%.4f, std=%.4f, min=%.4f, max=%.4f, p95=%.4f, n=%d}",
                mean, median, std, min, max, p95, sampleCount);
    }
}
