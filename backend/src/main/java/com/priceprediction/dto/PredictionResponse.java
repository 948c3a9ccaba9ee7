package com.priceprediction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceprediction.engine.ConfidenceLevel;
import com.priceprediction.reference.AreaTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionResponse {
    double          basePrice;
    double          multiplier;
    double          adjustedPrice;
    double          pricePerSqm;
    PriceRange      priceRange;
    String          adjustedPriceFormatted;
    String          priceRangeFormatted;
    ConfidenceLevel confidenceLevel;
    AreaTier        tier;
    boolean         areaMatched;
    List<String>    warnings;
    PropertyRequest inputFeatures;
    String          requestId;

    @Value
    @Builder
    public static class PriceRange {
        double lowerBound;
        double upperBound;
    }
}
