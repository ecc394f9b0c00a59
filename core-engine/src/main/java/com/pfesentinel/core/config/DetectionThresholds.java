package com.pfesentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tunable constants of the detection rules and the outlier model.
 *
 * <p>
 * Defaults are the engine's design constants; a {@code thresholds:} block in
 * {@code detection.yml} may override any of them.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Shared ---
    /** Floor applied to ratio denominators. */
    private double ratioEpsilon = 0.01;

    /** Minimum valid samples for a baseline to be usable. */
    private int minBaselineSamples = 10;

    /** Fraction of recent samples that must individually confirm a shift. */
    private double sustainedFraction = 0.7;

    // --- Rule 1: emergence ---
    private double emergenceThreshold = 0.5;
    private double nearZeroThreshold = 0.1;

    // --- Rule 2: spike ---
    private double spikeSigma = 3.0;
    private double spikeMinRate = 0.5;
    private double spikeMinRatio = 2.0;

    // --- Rule 3: sustained shift ---
    private double shiftAbsoluteLevel = 1.0;
    private double shiftRatio = 1.3;
    private double shiftMinBaselineMean = 0.1;
    private double noSignalLevel = 0.1;
    private double newSeriesMinMean = 0.5;

    // --- Rule 4: weekly comparison ---
    private double weeklyRatio = 1.5;
    private double weeklyMinMean = 1.0;

    // --- Rule 5: trend ---
    private int trendMinLookbackHours = 6;
    private int trendMinPoints = 4;
    private int trendMinSteps = 4;
    private double trendMinGrowth = 0.3;
    private double trendMinLastValue = 1.0;

    // --- Rule 7: correlation ---
    private double correlationRatio = 1.3;
    private double correlationMinMean = 0.5;
    private int correlationMinExceptions = 2;

    // --- Rule 8: outlier model ---
    private int mlMinSamples = 20;
    private double mlMinPeak = 0.1;
    private double mlContamination = 0.15;
    private int mlTrees = 100;
    private double mlSubsample = 0.7;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    void validate(List<String> errors) {
        requirePositive(errors, "ratioEpsilon", ratioEpsilon);
        requireAtLeast(errors, "minBaselineSamples", minBaselineSamples, 1);
        requireFraction(errors, "sustainedFraction", sustainedFraction);
        requirePositive(errors, "emergenceThreshold", emergenceThreshold);
        requirePositive(errors, "nearZeroThreshold", nearZeroThreshold);
        requirePositive(errors, "spikeSigma", spikeSigma);
        requirePositive(errors, "spikeMinRatio", spikeMinRatio);
        requirePositive(errors, "shiftRatio", shiftRatio);
        requirePositive(errors, "weeklyRatio", weeklyRatio);
        requireAtLeast(errors, "trendMinLookbackHours", trendMinLookbackHours, 1);
        requireAtLeast(errors, "trendMinPoints", trendMinPoints, 2);
        requireAtLeast(errors, "trendMinSteps", trendMinSteps, 1);
        requirePositive(errors, "correlationRatio", correlationRatio);
        requireAtLeast(errors, "correlationMinExceptions", correlationMinExceptions, 2);
        requireAtLeast(errors, "mlMinSamples", mlMinSamples, 2);
        requireAtLeast(errors, "mlTrees", mlTrees, 1);
        if (mlContamination <= 0 || mlContamination >= 0.5) {
            errors.add("thresholds.mlContamination must be in (0, 0.5), got: " + mlContamination);
        }
        if (mlSubsample <= 0 || mlSubsample >= 1) {
            errors.add("thresholds.mlSubsample must be in (0, 1), got: " + mlSubsample);
        }
    }

    private static void requirePositive(List<String> errors, String name, double value) {
        if (!(value > 0)) {
            errors.add("thresholds." + name + " must be > 0, got: " + value);
        }
    }

    private static void requireAtLeast(List<String> errors, String name, int value, int min) {
        if (value < min) {
            errors.add("thresholds." + name + " must be >= " + min + ", got: " + value);
        }
    }

    private static void requireFraction(List<String> errors, String name, double value) {
        if (value <= 0 || value > 1) {
            errors.add("thresholds." + name + " must be in (0, 1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getRatioEpsilon() {
        return ratioEpsilon;
    }

    public void setRatioEpsilon(double ratioEpsilon) {
        this.ratioEpsilon = ratioEpsilon;
    }

    public int getMinBaselineSamples() {
        return minBaselineSamples;
    }

    public void setMinBaselineSamples(int minBaselineSamples) {
        this.minBaselineSamples = minBaselineSamples;
    }

    public double getSustainedFraction() {
        return sustainedFraction;
    }

    public void setSustainedFraction(double sustainedFraction) {
        this.sustainedFraction = sustainedFraction;
    }

    public double getEmergenceThreshold() {
        return emergenceThreshold;
    }

    public void setEmergenceThreshold(double emergenceThreshold) {
        this.emergenceThreshold = emergenceThreshold;
    }

    public double getNearZeroThreshold() {
        return nearZeroThreshold;
    }

    public void setNearZeroThreshold(double nearZeroThreshold) {
        this.nearZeroThreshold = nearZeroThreshold;
    }

    public double getSpikeSigma() {
        return spikeSigma;
    }

    public void setSpikeSigma(double spikeSigma) {
        this.spikeSigma = spikeSigma;
    }

    public double getSpikeMinRate() {
        return spikeMinRate;
    }

    public void setSpikeMinRate(double spikeMinRate) {
        this.spikeMinRate = spikeMinRate;
    }

    public double getSpikeMinRatio() {
        return spikeMinRatio;
    }

    public void setSpikeMinRatio(double spikeMinRatio) {
        this.spikeMinRatio = spikeMinRatio;
    }

    public double getShiftAbsoluteLevel() {
        return shiftAbsoluteLevel;
    }

    public void setShiftAbsoluteLevel(double shiftAbsoluteLevel) {
        this.shiftAbsoluteLevel = shiftAbsoluteLevel;
    }

    public double getShiftRatio() {
        return shiftRatio;
    }

    public void setShiftRatio(double shiftRatio) {
        this.shiftRatio = shiftRatio;
    }

    public double getShiftMinBaselineMean() {
        return shiftMinBaselineMean;
    }

    public void setShiftMinBaselineMean(double shiftMinBaselineMean) {
        this.shiftMinBaselineMean = shiftMinBaselineMean;
    }

    public double getNoSignalLevel() {
        return noSignalLevel;
    }

    public void setNoSignalLevel(double noSignalLevel) {
        this.noSignalLevel = noSignalLevel;
    }

    public double getNewSeriesMinMean() {
        return newSeriesMinMean;
    }

    public void setNewSeriesMinMean(double newSeriesMinMean) {
        this.newSeriesMinMean = newSeriesMinMean;
    }

    public double getWeeklyRatio() {
        return weeklyRatio;
    }

    public void setWeeklyRatio(double weeklyRatio) {
        this.weeklyRatio = weeklyRatio;
    }

    public double getWeeklyMinMean() {
        return weeklyMinMean;
    }

    public void setWeeklyMinMean(double weeklyMinMean) {
        this.weeklyMinMean = weeklyMinMean;
    }

    public int getTrendMinLookbackHours() {
        return trendMinLookbackHours;
    }

    public void setTrendMinLookbackHours(int trendMinLookbackHours) {
        this.trendMinLookbackHours = trendMinLookbackHours;
    }

    public int getTrendMinPoints() {
        return trendMinPoints;
    }

    public void setTrendMinPoints(int trendMinPoints) {
        this.trendMinPoints = trendMinPoints;
    }

    public int getTrendMinSteps() {
        return trendMinSteps;
    }

    public void setTrendMinSteps(int trendMinSteps) {
        this.trendMinSteps = trendMinSteps;
    }

    public double getTrendMinGrowth() {
        return trendMinGrowth;
    }

    public void setTrendMinGrowth(double trendMinGrowth) {
        this.trendMinGrowth = trendMinGrowth;
    }

    public double getTrendMinLastValue() {
        return trendMinLastValue;
    }

    public void setTrendMinLastValue(double trendMinLastValue) {
        this.trendMinLastValue = trendMinLastValue;
    }

    public double getCorrelationRatio() {
        return correlationRatio;
    }

    public void setCorrelationRatio(double correlationRatio) {
        this.correlationRatio = correlationRatio;
    }

    public double getCorrelationMinMean() {
        return correlationMinMean;
    }

    public void setCorrelationMinMean(double correlationMinMean) {
        this.correlationMinMean = correlationMinMean;
    }

    public int getCorrelationMinExceptions() {
        return correlationMinExceptions;
    }

    public void setCorrelationMinExceptions(int correlationMinExceptions) {
        this.correlationMinExceptions = correlationMinExceptions;
    }

    public int getMlMinSamples() {
        return mlMinSamples;
    }

    public void setMlMinSamples(int mlMinSamples) {
        this.mlMinSamples = mlMinSamples;
    }

    public double getMlMinPeak() {
        return mlMinPeak;
    }

    public void setMlMinPeak(double mlMinPeak) {
        this.mlMinPeak = mlMinPeak;
    }

    public double getMlContamination() {
        return mlContamination;
    }

    public void setMlContamination(double mlContamination) {
        this.mlContamination = mlContamination;
    }

    public int getMlTrees() {
        return mlTrees;
    }

    public void setMlTrees(int mlTrees) {
        this.mlTrees = mlTrees;
    }

    public double getMlSubsample() {
        return mlSubsample;
    }

    public void setMlSubsample(double mlSubsample) {
        this.mlSubsample = mlSubsample;
    }
}
