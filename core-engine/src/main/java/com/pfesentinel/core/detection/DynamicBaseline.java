package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.EwmaBaseline;

import java.util.Objects;

/**
 * Per-series reference used by the dynamic variants of the spike and
 * sustained-shift rules.
 *
 * @since 1.0.0
 */
public final class DynamicBaseline {

    private final Baseline reference;
    private final EwmaBaseline ewma;
    private final BaselineType type;
    private final boolean regimeChange;

    public DynamicBaseline(Baseline reference, EwmaBaseline ewma, BaselineType type, boolean regimeChange) {
        this.reference = Objects.requireNonNull(reference, "reference must not be null");
        this.ewma = Objects.requireNonNull(ewma, "ewma must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.regimeChange = regimeChange;
    }

    public Baseline getReference() {
        return reference;
    }

    public EwmaBaseline getEwma() {
        return ewma;
    }

    public BaselineType getType() {
        return type;
    }

    public boolean isRegimeChange() {
        return regimeChange;
    }

    /**
     * @return suffix appended to dynamic detection details
     */
    public String annotation() {
        return "[baseline=" + type.label() + ", regime_change=" + regimeChange + "]";
    }

    @Override
    public String toString() {
        return "DynamicBaseline{" + annotation() + ", reference=" + reference + ", ewma=" + ewma + '}';
    }
}
