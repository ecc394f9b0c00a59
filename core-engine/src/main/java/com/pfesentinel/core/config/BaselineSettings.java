package com.pfesentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Window lengths and smoothing parameters for the baseline manager.
 *
 * @since 1.0.0
 */
public class BaselineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int shortWindowHours = 2;
    private int mediumWindowHours = 24;
    private int longWindowHours = 168;

    /** EWMA smoothing factor; higher reacts faster. */
    private double ewmaAlpha = 0.3;

    /** Standard deviations above the historical mean that mark a new regime. */
    private double regimeThreshold = 2.0;
    private int regimeMinSamples = 20;
    private double regimeSustainedFraction = 0.7;

    /** Hour-of-day radius for contextual baselines. */
    private int contextHourRadius = 2;
    private int contextMinSamples = 10;

    void validate(List<String> errors) {
        if (shortWindowHours < 1) {
            errors.add("baseline.shortWindowHours must be >= 1, got: " + shortWindowHours);
        }
        if (mediumWindowHours < shortWindowHours) {
            errors.add("baseline.mediumWindowHours must be >= shortWindowHours, got: " + mediumWindowHours);
        }
        if (longWindowHours < mediumWindowHours) {
            errors.add("baseline.longWindowHours must be >= mediumWindowHours, got: " + longWindowHours);
        }
        if (ewmaAlpha <= 0 || ewmaAlpha > 1) {
            errors.add("baseline.ewmaAlpha must be in (0, 1], got: " + ewmaAlpha);
        }
        if (regimeThreshold <= 0) {
            errors.add("baseline.regimeThreshold must be > 0, got: " + regimeThreshold);
        }
        if (regimeMinSamples < 1) {
            errors.add("baseline.regimeMinSamples must be >= 1, got: " + regimeMinSamples);
        }
        if (regimeSustainedFraction <= 0 || regimeSustainedFraction > 1) {
            errors.add("baseline.regimeSustainedFraction must be in (0, 1], got: " + regimeSustainedFraction);
        }
        if (contextHourRadius < 0 || contextHourRadius > 12) {
            errors.add("baseline.contextHourRadius must be in [0, 12], got: " + contextHourRadius);
        }
    }

    public int getShortWindowHours() {
        return shortWindowHours;
    }

    public void setShortWindowHours(int shortWindowHours) {
        this.shortWindowHours = shortWindowHours;
    }

    public int getMediumWindowHours() {
        return mediumWindowHours;
    }

    public void setMediumWindowHours(int mediumWindowHours) {
        this.mediumWindowHours = mediumWindowHours;
    }

    public int getLongWindowHours() {
        return longWindowHours;
    }

    public void setLongWindowHours(int longWindowHours) {
        this.longWindowHours = longWindowHours;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public double getRegimeThreshold() {
        return regimeThreshold;
    }

    public void setRegimeThreshold(double regimeThreshold) {
        this.regimeThreshold = regimeThreshold;
    }

    public int getRegimeMinSamples() {
        return regimeMinSamples;
    }

    public void setRegimeMinSamples(int regimeMinSamples) {
        this.regimeMinSamples = regimeMinSamples;
    }

    public double getRegimeSustainedFraction() {
        return regimeSustainedFraction;
    }

    public void setRegimeSustainedFraction(double regimeSustainedFraction) {
        this.regimeSustainedFraction = regimeSustainedFraction;
    }

    public int getContextHourRadius() {
        return contextHourRadius;
    }

    public void setContextHourRadius(int contextHourRadius) {
        this.contextHourRadius = contextHourRadius;
    }

    public int getContextMinSamples() {
        return contextMinSamples;
    }

    public void setContextMinSamples(int contextMinSamples) {
        this.contextMinSamples = contextMinSamples;
    }
}
