package com.priceprediction.client;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.engine.FeatureEncoder;
import com.priceprediction.engine.FeatureVector;
import com.priceprediction.reference.EncoderVocabulary;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Label encoding as used at training time: each categorical value becomes its
 * index in the sorted class list. Values the model never saw map to the first
 * class.
 */
@Slf4j
public class LabelFeatureEncoder implements FeatureEncoder {

    public static final List<String> FEATURE_NAMES = List.of(
        "procedure_area", "bedrooms", "has_parking", "has_project",
        "area_name_en", "property_sub_type_en", "reg_type_en");

    private final EncoderVocabulary vocabulary;

    public LabelFeatureEncoder(EncoderVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public FeatureVector encode(PropertyRequest request) {
        Map<String, Double> features = new LinkedHashMap<>();
        features.put("procedure_area", request.getAreaSize());
        features.put("bedrooms", (double) request.getBedrooms());
        features.put("has_parking", flag(request.getHasParking()));
        features.put("has_project", flag(request.getHasProject()));
        features.put("area_name_en", code(vocabulary.areas(), request.getAreaName(), "area"));
        features.put("property_sub_type_en", code(vocabulary.subtypes(), request.getSubtype(), "subtype"));
        features.put("reg_type_en", code(vocabulary.registrationTypes(),
            request.getRegistrationType() != null ? request.getRegistrationType().getLabel() : null,
            "registration type"));
        return new FeatureVector(features);
    }

    private static double flag(Boolean value) {
        return Boolean.TRUE.equals(value) ? 1.0 : 0.0;
    }

    private static double code(List<String> classes, String value, String column) {
        if (classes.isEmpty()) {
            return 0.0;
        }
        int index = value == null ? -1 : indexOfIgnoreCase(classes, value.trim());
        if (index < 0) {
            log.debug("Value '{}' not in {} classes, encoding as '{}'", value, column, classes.get(0));
            return 0.0;
        }
        return index;
    }

    private static int indexOfIgnoreCase(List<String> classes, String value) {
        for (int i = 0; i < classes.size(); i++) {
            if (classes.get(i).equalsIgnoreCase(value)) {
                return i;
            }
        }
        return -1;
    }
}
