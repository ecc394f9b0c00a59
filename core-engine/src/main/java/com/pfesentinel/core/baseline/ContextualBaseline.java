package com.pfesentinel.core.baseline;

import java.util.Objects;

/**
 * A {@link Baseline} restricted to samples from a similar time of day and
 * day class, tagged with the context used to build it.
 *
 * <p>
 * {@link #isContextMatched()} is {@code false} when too few samples matched
 * the context and the baseline fell back to the full series.
 * </p>
 *
 * @since 1.0.0
 */
public final class ContextualBaseline {

    private final Baseline baseline;
    private final String context;
    private final boolean contextMatched;

    public ContextualBaseline(Baseline baseline, String context, boolean contextMatched) {
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.contextMatched = contextMatched;
    }

    public Baseline getBaseline() {
        return baseline;
    }

    /**
     * @return descriptor such as {@code hour=14±2h, dayClass=weekday}
     */
    public String getContext() {
        return context;
    }

    public boolean isContextMatched() {
        return contextMatched;
    }

    @Override
    public String toString() {
        return "ContextualBaseline{" + context + (contextMatched ? "" : " (fallback: all data)")
                + ", " + baseline + '}';
    }
}
