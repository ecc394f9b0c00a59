package com.pfesentinel.core.detection;

/**
 * Which reference baseline a dynamic-mode rule compared against.
 *
 * @since 1.0.0
 */
public enum BaselineType {

    CONTEXTUAL("contextual"),
    MULTI_WINDOW("multi_window"),
    REGIME_CHANGE("regime_change");

    private final String label;

    BaselineType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
