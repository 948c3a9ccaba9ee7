package com.priceprediction.reference;

import java.util.ArrayList;
import java.util.List;

/** Class lists of the categorical model inputs, sorted as the model's label encoders saw them. */
public record EncoderVocabulary(List<String> areas, List<String> subtypes, List<String> registrationTypes) {

    public EncoderVocabulary {
        areas = sorted(areas);
        subtypes = sorted(subtypes);
        registrationTypes = sorted(registrationTypes);
    }

    private static List<String> sorted(List<String> values) {
        List<String> copy = new ArrayList<>(values == null ? List.of() : values);
        copy.sort(null);
        return List.copyOf(copy);
    }
}
