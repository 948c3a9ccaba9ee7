package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;

/** Maps a normalized request to the numeric inputs of the price model. */
public interface FeatureEncoder {

    FeatureVector encode(PropertyRequest request);
}
