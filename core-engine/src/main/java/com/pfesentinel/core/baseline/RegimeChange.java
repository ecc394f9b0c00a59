package com.pfesentinel.core.baseline;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a regime-change check. When a change is detected the recent
 * baseline becomes the new reference.
 *
 * @since 1.0.0
 */
public final class RegimeChange {

    private static final RegimeChange NONE = new RegimeChange(false, null);

    private final boolean detected;
    private final Baseline newBaseline;

    private RegimeChange(boolean detected, Baseline newBaseline) {
        this.detected = detected;
        this.newBaseline = newBaseline;
    }

    public static RegimeChange none() {
        return NONE;
    }

    public static RegimeChange detected(Baseline newBaseline) {
        return new RegimeChange(true, Objects.requireNonNull(newBaseline, "newBaseline must not be null"));
    }

    public boolean isDetected() {
        return detected;
    }

    public Optional<Baseline> getNewBaseline() {
        return Optional.ofNullable(newBaseline);
    }

    @Override
    public String toString() {
        return detected ? "RegimeChange{newBaseline=" + newBaseline + '}' : "RegimeChange{none}";
    }
}
