package com.pfesentinel.core.engine;

import java.time.Duration;

/**
 * Parameters of one analysis run.
 *
 * <p>
 * Every parameter has a default; build with {@link #builder()} or take
 * {@link #defaults()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisRequest {

    public static final int DEFAULT_LOOKBACK_HOURS = 1;
    public static final int DEFAULT_MIN_CONSECUTIVE_SAMPLES = 3;
    public static final double DEFAULT_ML_CONFIDENCE_THRESHOLD = 0.65;

    private final int lookbackHours;
    private final int minConsecutiveSamples;
    private final boolean useMl;
    private final double mlConfidenceThreshold;
    private final boolean useDynamicBaseline;

    private AnalysisRequest(Builder b) {
        this.lookbackHours = b.lookbackHours;
        this.minConsecutiveSamples = b.minConsecutiveSamples;
        this.useMl = b.useMl;
        this.mlConfidenceThreshold = b.mlConfidenceThreshold;
        this.useDynamicBaseline = b.useDynamicBaseline;
    }

    public static AnalysisRequest defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public Duration getLookback() {
        return Duration.ofHours(lookbackHours);
    }

    public int getMinConsecutiveSamples() {
        return minConsecutiveSamples;
    }

    public boolean isUseMl() {
        return useMl;
    }

    public double getMlConfidenceThreshold() {
        return mlConfidenceThreshold;
    }

    public boolean isUseDynamicBaseline() {
        return useDynamicBaseline;
    }

    @Override
    public String toString() {
        return "AnalysisRequest{"
                + "lookbackHours=" + lookbackHours
                + ", minConsecutiveSamples=" + minConsecutiveSamples
                + ", useMl=" + useMl
                + ", mlConfidenceThreshold=" + mlConfidenceThreshold
                + ", useDynamicBaseline=" + useDynamicBaseline
                + '}';
    }

    public static class Builder {
        private int lookbackHours = DEFAULT_LOOKBACK_HOURS;
        private int minConsecutiveSamples = DEFAULT_MIN_CONSECUTIVE_SAMPLES;
        private boolean useMl = true;
        private double mlConfidenceThreshold = DEFAULT_ML_CONFIDENCE_THRESHOLD;
        private boolean useDynamicBaseline = true;

        public Builder lookbackHours(int v) {
            this.lookbackHours = v;
            return this;
        }

        public Builder minConsecutiveSamples(int v) {
            this.minConsecutiveSamples = v;
            return this;
        }

        public Builder useMl(boolean v) {
            this.useMl = v;
            return this;
        }

        public Builder mlConfidenceThreshold(double v) {
            this.mlConfidenceThreshold = v;
            return this;
        }

        public Builder useDynamicBaseline(boolean v) {
            this.useDynamicBaseline = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a parameter is out of range
         */
        public AnalysisRequest build() {
            if (lookbackHours < 1) {
                throw new IllegalArgumentException("lookbackHours must be >= 1, got: " + lookbackHours);
            }
            if (minConsecutiveSamples < 1) {
                throw new IllegalArgumentException(
                        "minConsecutiveSamples must be >= 1, got: " + minConsecutiveSamples);
            }
            if (Double.isNaN(mlConfidenceThreshold) || mlConfidenceThreshold < 0 || mlConfidenceThreshold > 1) {
                throw new IllegalArgumentException(
                        "mlConfidenceThreshold must be in [0, 1], got: " + mlConfidenceThreshold);
            }
            return new AnalysisRequest(this);
        }
    }
}
