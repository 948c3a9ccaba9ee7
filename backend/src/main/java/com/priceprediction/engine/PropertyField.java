package com.priceprediction.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/** The closed set of request fields a form rule can govern. */
public enum PropertyField {
    USAGE("usage"),
    TYPE("type"),
    SUBTYPE("subtype"),
    AREA_SIZE("area_size"),
    BEDROOMS("bedrooms"),
    HAS_PARKING("has_parking"),
    HAS_PROJECT("has_project"),
    AREA_NAME("area_name"),
    REGISTRATION_TYPE("registration_type");

    private final String wireName;

    PropertyField(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
