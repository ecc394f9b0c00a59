package com.pfesentinel.core.baseline;

/**
 * Exponentially weighted moving average with a ±3σ band.
 *
 * <p>
 * {@code lowerBound} is never negative since rates cannot be.
 * </p>
 *
 * @since 1.0.0
 */
public final class EwmaBaseline {

    private final double ewma;
    private final double ewmaStd;
    private final double upperBound;
    private final double lowerBound;
    private final int sampleCount;
    private final double alpha;

    public EwmaBaseline(double ewma, double ewmaStd, int sampleCount, double alpha) {
        this.ewma = ewma;
        this.ewmaStd = ewmaStd;
        this.upperBound = ewma + 3 * ewmaStd;
        this.lowerBound = Math.max(0.0, ewma - 3 * ewmaStd);
        this.sampleCount = sampleCount;
        this.alpha = alpha;
    }

    public static EwmaBaseline empty(double alpha) {
        return new EwmaBaseline(0, 0, 0, alpha);
    }

    public double getEwma() {
        return ewma;
    }

    public double getEwmaStd() {
        return ewmaStd;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getAlpha() {
        return alpha;
    }

    public boolean isEmpty() {
        return sampleCount == 0;
    }

    @Override
    public String toString() {
        return String.format("EwmaBaseline{ewma=%.4f, std=%.4f, band=[%.4f, %.4f], n=%d, alpha=%.2f}",
                ewma, ewmaStd, lowerBound, upperBound, sampleCount, alpha);
    }
}
