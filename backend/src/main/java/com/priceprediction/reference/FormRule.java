package com.priceprediction.reference;

import com.priceprediction.engine.PropertyField;

import java.util.Map;
import java.util.Set;

public record FormRule(Set<PropertyField> required,
                       Set<PropertyField> hidden,
                       Map<PropertyField, AutoFillStrategy> autoFill) {

    public FormRule {
        required = Set.copyOf(required);
        hidden = Set.copyOf(hidden);
        autoFill = Map.copyOf(autoFill);
    }
}
