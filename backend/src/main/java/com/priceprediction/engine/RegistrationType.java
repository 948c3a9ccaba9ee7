package com.priceprediction.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Land department registration status; labels are the values the model was trained on. */
public enum RegistrationType {
    OFF_PLAN("Off-Plan Properties", "OffPlan"),
    READY("Ready Properties", "Ready"),
    EXISTING("Existing Properties", "Existing");

    private final String label;
    private final String shortName;

    RegistrationType(String label, String shortName) {
        this.label = label;
        this.shortName = shortName;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static RegistrationType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (RegistrationType type : values()) {
            if (Labels.matches(value, type.label, type.name()) || Labels.matches(value, type.shortName, type.name())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown registration type '" + value + "'");
    }
}
