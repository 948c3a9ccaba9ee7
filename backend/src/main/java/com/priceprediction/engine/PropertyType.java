package com.priceprediction.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PropertyType {
    UNIT("Unit"),
    VILLA("Villa"),
    LAND("Land"),
    BUILDING("Building");

    private final String label;

    PropertyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PropertyType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (PropertyType type : values()) {
            if (Labels.matches(value, type.label, type.name())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown property type '" + value + "'");
    }
}
