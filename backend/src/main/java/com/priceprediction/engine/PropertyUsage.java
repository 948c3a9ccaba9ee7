package com.priceprediction.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PropertyUsage {
    RESIDENTIAL("Residential"),
    COMMERCIAL("Commercial"),
    HOSPITALITY("Hospitality"),
    INDUSTRIAL("Industrial"),
    MULTI_USE("Multi-Use"),
    AGRICULTURAL("Agricultural");

    private final String label;

    PropertyUsage(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PropertyUsage fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (PropertyUsage usage : values()) {
            if (Labels.matches(value, usage.label, usage.name())) {
                return usage;
            }
        }
        throw new IllegalArgumentException("Unknown property usage '" + value + "'");
    }
}
