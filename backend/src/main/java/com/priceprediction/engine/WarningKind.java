package com.priceprediction.engine;

/**
 * Category of a validation finding. Advisory kinds lower confidence to Medium,
 * the others to Low.
 */
public enum WarningKind {
    FIELD_POLICY(false),
    SIZE_RANGE(true),
    TYPE_MISMATCH(false),
    UNKNOWN_AREA(true),
    AUTO_FILLED(true);

    private final boolean advisory;

    WarningKind(boolean advisory) {
        this.advisory = advisory;
    }

    public boolean isAdvisory() {
        return advisory;
    }
}
