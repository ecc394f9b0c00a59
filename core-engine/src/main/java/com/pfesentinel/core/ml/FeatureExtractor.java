package com.pfesentinel.core.ml;

import com.pfesentinel.core.baseline.SampleStatistics;

/**
 * Turns a rate series into one six-dimensional feature vector per point:
 * value, 5-point moving average, 15-point moving average, 5-point moving
 * standard deviation, rate of change, absolute deviation from the series
 * mean.
 * <p>
 * Moving windows are left-truncated at the start of the series.
 * </p>
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 6;

    private static final int SHORT_WINDOW = 5;
    private static final int LONG_WINDOW = 15;
    private static final double EPSILON = 1e-6;

    private FeatureExtractor() {
    }

    public static double[][] extract(double[] values) {
        double overallMean = SampleStatistics.mean(values);
        double[][] features = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            int shortFrom = Math.max(0, i - SHORT_WINDOW + 1);
            int longFrom = Math.max(0, i - LONG_WINDOW + 1);
            double movingStd = i < SHORT_WINDOW - 1 ? 0.0 : SampleStatistics.populationStd(values, shortFrom, i + 1);
            double rateOfChange = i == 0 ? 0.0 : (value - values[i - 1]) / (values[i - 1] + EPSILON);
            features[i] = new double[] {
                    value,
                    SampleStatistics.mean(values, shortFrom, i + 1),
                    SampleStatistics.mean(values, longFrom, i + 1),
                    movingStd,
                    rateOfChange,
                    Math.abs(value - overallMean)
            };
        }
        return features;
    }
}
