package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;

import java.util.List;

/** A request with hidden fields cleared and defaults filled, plus notes about what was filled. */
public record NormalizedRequest(PropertyRequest request, List<PredictionWarning> notes) {

    public NormalizedRequest {
        notes = List.copyOf(notes);
    }
}
