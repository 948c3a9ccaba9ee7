package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.reference.AreaTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PredictionResult {
    PropertyRequest           request;
    double                    basePrice;
    double                    multiplier;
    double                    adjustedPrice;
    double                    pricePerUnitArea;
    ConfidenceLevel           confidenceLevel;
    AreaTier                  tier;
    boolean                   areaMatched;
    List<PredictionWarning>   warnings;

    public List<String> warningMessages() {
        return warnings.stream().map(PredictionWarning::message).toList();
    }
}
