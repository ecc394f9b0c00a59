package com.pfesentinel.core.baseline;

import java.util.Objects;

/**
 * Short, medium and long trailing-window baselines plus their weighted
 * composite.
 *
 * @since 1.0.0
 */
public final class MultiWindowBaseline {

    public static final MultiWindowBaseline EMPTY = new MultiWindowBaseline(
            Baseline.EMPTY, Baseline.EMPTY, Baseline.EMPTY, Baseline.EMPTY, WindowWeights.NONE);

    private final Baseline shortWindow;
    private final Baseline mediumWindow;
    private final Baseline longWindow;
    private final Baseline composite;
    private final WindowWeights weights;

    public MultiWindowBaseline(Baseline shortWindow, Baseline mediumWindow, Baseline longWindow,
            Baseline composite, WindowWeights weights) {
        this.shortWindow = Objects.requireNonNull(shortWindow, "short baseline must not be null");
        this.mediumWindow = Objects.requireNonNull(mediumWindow, "medium baseline must not be null");
        this.longWindow = Objects.requireNonNull(longWindow, "long baseline must not be null");
        this.composite = Objects.requireNonNull(composite, "composite baseline must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public Baseline getShort() {
        return shortWindow;
    }

    public Baseline getMedium() {
        return mediumWindow;
    }

    public Baseline getLong() {
        return longWindow;
    }

    public Baseline getComposite() {
        return composite;
    }

    public WindowWeights getWeights() {
        return weights;
    }

    @Override
    public String toString() {
        return "MultiWindowBaseline{composite=" + composite + ", " + weights + '}';
    }
}
