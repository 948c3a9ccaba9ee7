package com.priceprediction.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Named numeric model inputs in the order the model expects them. */
public record FeatureVector(Map<String, Double> features) {

    public FeatureVector {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public List<String> names() {
        return List.copyOf(features.keySet());
    }

    public List<Double> values() {
        return List.copyOf(features.values());
    }
}
