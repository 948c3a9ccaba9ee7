package com.priceprediction.engine;

public enum FieldRequirement {
    REQUIRED,
    OPTIONAL,
    HIDDEN,
    AUTO_FILLED;

    public boolean isVisible() {
        return this != HIDDEN;
    }
}
