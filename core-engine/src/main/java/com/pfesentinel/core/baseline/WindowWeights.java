package com.pfesentinel.core.baseline;

/**
 * Relative weights of the short, medium and long baseline windows.
 *
 * <p>
 * Weights sum to 1.0, except for {@link #NONE}, which is used when no window
 * holds any data.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowWeights {

    public static final WindowWeights NONE = new WindowWeights(0, 0, 0);

    private final double shortWeight;
    private final double mediumWeight;
    private final double longWeight;

    public WindowWeights(double shortWeight, double mediumWeight, double longWeight) {
        this.shortWeight = shortWeight;
        this.mediumWeight = mediumWeight;
        this.longWeight = longWeight;
    }

    public double getShort() {
        return shortWeight;
    }

    public double getMedium() {
        return mediumWeight;
    }

    public double getLong() {
        return longWeight;
    }

    public double sum() {
        return shortWeight + mediumWeight + longWeight;
    }

    @Override
    public String toString() {
        return String.format("WindowWeights{short=%.3f, medium=%.3f, long=%.3f}",
                shortWeight, mediumWeight, longWeight);
    }
}
