package com.priceprediction.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
