package com.priceprediction.reference;

import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;

public record PropertyCategory(PropertyUsage usage, PropertyType type) {

    public String describe() {
        return usage.getLabel() + " " + type.getLabel();
    }
}
